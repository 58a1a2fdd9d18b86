package aisp.java17.logic;

import aisp.java17.logic.Formula.Atom;
import aisp.java17.logic.Formula.Not;
import aisp.java17.logic.Term.Apply;
import aisp.java17.logic.Term.Constant;
import aisp.java17.logic.Term.Numeral;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SimplifierTest extends LogicTestBase {

    @Test
    void groundArithmeticFolds() {
        final Term sum = new Apply("+", List.of(Numeral.of(1), Numeral.of(2)), Sort.INT);
        assertThat(Simplifier.fold(sum)).isEqualTo(Numeral.of(3));
        assertThat(Simplifier.simplify(Atom.of(Atom.EQ, sum, Numeral.of(3)))).isEqualTo(Formula.Literal.TRUE);
        assertThat(Simplifier.simplify(Atom.of(Atom.LT, sum, Numeral.of(3)))).isEqualTo(Formula.Literal.FALSE);
    }

    @Test
    void doubleNegationAndDuplicatesDisappear() {
        final Formula a = Atom.of("A");
        assertThat(Simplifier.simplify(new Not(new Not(a)))).isEqualTo(a);
        assertThat(Simplifier.simplify(Formula.and(a, a))).isEqualTo(a);
        assertThat(Simplifier.simplify(Formula.or(a, Formula.Literal.TRUE))).isEqualTo(Formula.Literal.TRUE);
    }

    @Test
    void unrelatedAssumptionsAreDropped() {
        final Term a = new Constant("a", Sort.OBJECT);
        final Term b = new Constant("b", Sort.OBJECT);
        final Obligation obligation = new Obligation("relevance", Atom.of("P", a), List.of(
            new Axiom("about-b", Atom.of("Q", b)),
            new Axiom("about-a", Atom.of("R", a))));
        final Obligation simplified = Simplifier.simplify(obligation);
        assertThat(simplified.assumptionNames()).containsExactly("about-a");
        assertThat(simplified.id()).isEqualTo("relevance");
    }
}
