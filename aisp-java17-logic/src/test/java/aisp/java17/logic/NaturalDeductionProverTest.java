package aisp.java17.logic;

import aisp.java17.logic.Formula.Atom;
import aisp.java17.logic.Formula.Implies;
import aisp.java17.logic.Term.Constant;
import aisp.java17.logic.Term.Numeral;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NaturalDeductionProverTest extends LogicTestBase {

    private final NaturalDeductionProver prover = new NaturalDeductionProver();

    private static List<ProofStep> steps(Verdict verdict) {
        final ProofObject proof = verdict instanceof Verdict.Proven p ? p.proof() : ((Verdict.Disproven) verdict).proof();
        return ((ProofObject.DeductionTree) proof).steps();
    }

    @Test
    void naturalNumberRuleNeedsOnlyTheDomainAxiom() {
        final Obligation obligation = firstRule(withRules("∀x:ℕ.x≥0")).obligation();
        final Verdict verdict = prover.prove(obligation);
        assertThat(verdict).isInstanceOf(Verdict.Proven.class);
        final List<ProofStep> steps = steps(verdict);
        assertThat(steps.get(steps.size() - 1).conclusion()).isEqualTo(obligation.goal());
        assertThat(steps).extracting(ProofStep::rule).contains("∀-intro", "axiom");
    }

    @Test
    void modusPonensUnderAConjunction() {
        final Formula a = Atom.of("A");
        final Formula b = Atom.of("B");
        final Formula goal = new Implies(Formula.and(a, new Implies(a, b)), b);
        final Verdict verdict = prover.prove(Obligation.of("mp", goal));
        assertThat(verdict).isInstanceOf(Verdict.Proven.class);
        assertThat(steps(verdict)).extracting(ProofStep::rule).contains("→-intro", "∧-elim", "→-elim");
    }

    @Test
    void everyPremiseIndexPointsBackwards() {
        final Verdict verdict = prover.prove(firstRule(withRules("∀i:Index:i≥0⇒i+1>0")).obligation());
        assertThat(verdict).isInstanceOf(Verdict.Proven.class);
        final List<ProofStep> steps = steps(verdict);
        for (int i = 0; i < steps.size(); i++) {
            for (int premise : steps.get(i).premises()) {
                assertThat(premise).isBetween(0, i - 1);
            }
        }
    }

    @Test
    void falseArithmeticIsDisproven() {
        final Formula goal = Atom.of(Atom.EQ, Numeral.of(1), Numeral.of(2));
        final Verdict verdict = prover.prove(Obligation.of("one-is-two", goal));
        assertThat(verdict).isInstanceOf(Verdict.Disproven.class);
        assertThat(steps(verdict)).extracting(ProofStep::rule).contains("numeral evaluation");
    }

    @Test
    void unprovableAtomIsUnknown() {
        final Verdict verdict = prover.prove(Obligation.of("open", Atom.of("Open")));
        assertThat(((Verdict.Unknown) verdict).reason()).isEqualTo(UnknownReason.INCOMPLETE);
    }

    @Test
    void stepLimitStopsTheSearch() {
        final Term x = new Constant("x", Sort.OBJECT);
        final Formula goal = Formula.and(Collections.nCopies(5, Atom.of(Atom.EQ, x, x)));
        final Verdict verdict = new NaturalDeductionProver(3).prove(Obligation.of("limited", goal));
        assertThat(((Verdict.Unknown) verdict).reason()).isEqualTo(UnknownReason.STEP_LIMIT);
    }

    @Test
    void definitionsHaveNoDeductionRules() {
        final Formula goal = new Formula.Definition("d", List.of(), Atom.of("A"), true);
        assertThatThrownBy(() -> prover.prove(Obligation.of("definition", goal)))
            .isInstanceOf(UnsupportedConstructException.class)
            .hasMessageStartingWith("unsupported construct");
    }

    @Test
    void stepLimitMustBePositive() {
        assertThatThrownBy(() -> new NaturalDeductionProver(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
