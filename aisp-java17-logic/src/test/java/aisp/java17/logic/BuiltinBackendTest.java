package aisp.java17.logic;

import aisp.java17.logic.Formula.Atom;
import aisp.java17.logic.Formula.Implies;
import aisp.java17.logic.Formula.Not;
import aisp.java17.logic.Term.Constant;
import aisp.java17.logic.Term.Numeral;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class BuiltinBackendTest extends LogicTestBase {

    private final BuiltinBackend backend = new BuiltinBackend();

    @ParameterizedTest
    @ValueSource(strings = {"Rules#0", "Rules#1", "Rules#2", "Rules#3", "Rules#4", "Rules#5", "Rules#6"})
    void provesEveryPlatinumRule(String id) {
        final TranslatedRule rule = FormulaTranslatorTest.rule(FormulaTranslator.translate(platinum()), id);
        final Verdict verdict = backend.check(rule.obligation(), Deadline.after(Duration.ofSeconds(10)));
        assertThat(verdict).isInstanceOf(Verdict.Proven.class);
    }

    @Test
    void naturalNumberRuleCitesTheDomainAxiom() {
        final Verdict verdict = backend.check(firstRule(withRules("∀x:ℕ.x≥0")).obligation(), Deadline.none());
        assertThat(verdict).isInstanceOf(Verdict.Proven.class);
        final var certificate = (ProofObject.SmtCertificate) ((Verdict.Proven) verdict).proof();
        assertThat(certificate.status()).isEqualTo("unsat");
        assertThat(certificate.backend()).isEqualTo("builtin");
        assertThat(certificate.axioms()).contains(Axiom.NAT_DOMAIN);
        assertThat(certificate.script()).contains("(check-sat)");
    }

    @Test
    void quantifierFreeCounterexampleIsADisproof() {
        final Verdict verdict = backend.check(firstRule(withRules("∀x:ℤ.x≥0")).obligation(), Deadline.none());
        assertThat(verdict).isInstanceOf(Verdict.Disproven.class);
        assertThat(((Verdict.Disproven) verdict).counterexample()).contains("sk!");
    }

    @Test
    void uninterpretedPredicateOverADeclaredSortIsDisproven() {
        final TranslatedRule rule = FormulaTranslatorTest.rule(FormulaTranslator.translate(platinum()), "Meta#2");
        assertThat(backend.check(rule.obligation(), Deadline.none())).isInstanceOf(Verdict.Disproven.class);
    }

    @Test
    void modelFoundAfterInstantiationIsOnlyUnknown() {
        final Verdict verdict = backend.check(firstRule(withRules("∀x:ℕ.x≥1")).obligation(), Deadline.none());
        assertThat(verdict).isInstanceOf(Verdict.Unknown.class);
        assertThat(((Verdict.Unknown) verdict).reason()).isEqualTo(UnknownReason.INCOMPLETE);
    }

    @Test
    void contradictoryIntegerBoundsAreRefuted() {
        final Term x = new Constant("x", Sort.INT);
        final Formula goal = new Not(Formula.and(Atom.of(Atom.GE, x, Numeral.of(3)), Atom.of(Atom.LE, x, Numeral.of(2))));
        assertThat(backend.check(Obligation.of("bounds", goal), Deadline.none())).isInstanceOf(Verdict.Proven.class);
    }

    @Test
    void integerGapBetweenStrictBoundsIsEmpty() {
        final Term x = new Constant("x", Sort.INT);
        final Formula goal = new Not(Formula.and(Atom.of(Atom.GT, x, Numeral.of(1)), Atom.of(Atom.LT, x, Numeral.of(2))));
        assertThat(backend.check(Obligation.of("int-gap", goal), Deadline.none())).isInstanceOf(Verdict.Proven.class);
    }

    @Test
    void realGapBetweenStrictBoundsIsNot() {
        final Term y = new Constant("y", Sort.REAL);
        final Formula goal = new Not(Formula.and(Atom.of(Atom.GT, y, Numeral.of(1)), Atom.of(Atom.LT, y, Numeral.of(2))));
        assertThat(backend.check(Obligation.of("real-gap", goal), Deadline.none())).isInstanceOf(Verdict.Disproven.class);
    }

    @Test
    void equalityIsTransitive() {
        final Term a = new Constant("a", Sort.OBJECT);
        final Term b = new Constant("b", Sort.OBJECT);
        final Term c = new Constant("c", Sort.OBJECT);
        final Formula goal = new Implies(Formula.and(Atom.of(Atom.EQ, a, b), Atom.of(Atom.EQ, b, c)), Atom.of(Atom.EQ, a, c));
        assertThat(backend.check(Obligation.of("transitive", goal), Deadline.none())).isInstanceOf(Verdict.Proven.class);
    }

    @Test
    void pigeonholeRunsOutOfTime() {
        final Verdict verdict = backend.check(Pigeonhole.obligation(9, 8), Deadline.after(Duration.ofMillis(1)));
        assertThat(verdict).isInstanceOf(Verdict.Unknown.class);
        assertThat(((Verdict.Unknown) verdict).reason()).isEqualTo(UnknownReason.TIMEOUT);
    }

    @Test
    void interruptedSearchIsCancelled() {
        Thread.currentThread().interrupt();
        try {
            final Verdict verdict = backend.check(Pigeonhole.obligation(9, 8), Deadline.none());
            assertThat(((Verdict.Unknown) verdict).reason()).isEqualTo(UnknownReason.CANCELLED);
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void smallPigeonholeIsProven() {
        assertThat(backend.check(Pigeonhole.obligation(3, 2), Deadline.after(Duration.ofSeconds(10))))
            .isInstanceOf(Verdict.Proven.class);
    }
}
