package aisp.java17.logic;

import aisp.java17.logic.Term.Constant;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SmtLibEmitterTest extends LogicTestBase {

    @Test
    void validityQueryNegatesTheGoal() {
        final String script = SmtLibEmitter.validityScript(firstRule(withRules("∀x:ℕ.x≥0")).obligation());
        assertThat(script)
            .contains("(set-logic ALL)")
            .contains("; nat-domain")
            .contains("(assert (not (forall ((x Int)) (=> (>= x 0) (>= x 0)))))")
            .endsWith("(check-sat)\n(get-model)\n");
    }

    @Test
    void membersSharedByTwoEnumerationsAreMangledPerSort() {
        final Sort player = Sort.uninterpreted("Player");
        final Sort cell = Sort.uninterpreted("Cell");
        final Formula goal = Formula.and(
            Formula.Atom.of(Formula.Atom.EQ, new Constant("X", player), new Constant("X", player)),
            Formula.Atom.of(Formula.Atom.EQ, new Constant("X", cell), new Constant("X", cell)));
        final String script = SmtLibEmitter.validityScript(Obligation.of("shared", goal));
        assertThat(script)
            .contains("(declare-sort Player 0)")
            .contains("(declare-sort Cell 0)")
            .contains("(declare-const |X:Player| Player)")
            .contains("(declare-const |X:Cell| Cell)");
    }

    @Test
    void symbolsOutsideTheSimpleAlphabetAreQuoted() {
        assertThat(SmtLibEmitter.symbol("next")).isEqualTo("next");
        assertThat(SmtLibEmitter.symbol("δ")).isEqualTo("|δ|");
        assertThat(SmtLibEmitter.symbol("and")).isEqualTo("and!u");
    }

    @Test
    void assumptionsAreAssertedUnderTheirNames() {
        final Obligation o = new Obligation("named", Formula.Literal.TRUE,
            List.of(new Axiom("fact", Formula.Atom.of("Ready"))));
        assertThat(SmtLibEmitter.validityScript(o))
            .contains("(declare-const Ready Bool)")
            .contains("; fact\n(assert Ready)");
    }
}
