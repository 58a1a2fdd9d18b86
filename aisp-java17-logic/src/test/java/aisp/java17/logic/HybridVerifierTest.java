package aisp.java17.logic;

import aisp.java17.logic.Formula.Atom;
import aisp.java17.parser.BlockTag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HybridVerifierTest extends LogicTestBase {

    private static final EngineConfig CONFIG = EngineConfig.defaults().withBackend(BackendKind.BUILTIN).withConcurrency(2);

    private static TranslatedRule rule(Formula formula) {
        return new TranslatedRule("Rules#0", BlockTag.RULES, 0, 0, Formulas.render(formula), formula,
            List.of(), List.of(), false);
    }

    @Test
    void firstDefiniteVerdictWins() {
        try (var engine = new SmtEngine(CONFIG);
             var hybrid = new HybridVerifier(engine, new NaturalDeductionProver())) {
            final var result = hybrid.verify(firstRule(withRules("∀x:ℕ.x≥0")), Deadline.after(Duration.ofSeconds(10)));
            assertThat(result.verdict()).isInstanceOf(Verdict.Proven.class);
            assertThat(result.winner()).isIn("smt", "natural-deduction");
            assertThat(result.gap()).isNull();
        }
    }

    @Test
    void deductionWinsWhenTheSolverCannotDecide() {
        final var undecided = CountingBackend.undecided(UnknownReason.SOLVER_UNKNOWN);
        try (var engine = new SmtEngine(CONFIG, undecided, new ProofCache());
             var hybrid = new HybridVerifier(engine, new NaturalDeductionProver())) {
            final Formula a = Atom.of("A");
            final var result = hybrid.verify(rule(new Formula.Implies(a, a)), Deadline.after(Duration.ofSeconds(10)));
            assertThat(result.verdict()).isInstanceOf(Verdict.Proven.class);
            assertThat(result.winner()).isEqualTo("natural-deduction");
        }
    }

    @Test
    void unsupportedConstructIsAGap() {
        final var undecided = CountingBackend.undecided(UnknownReason.SOLVER_UNKNOWN);
        try (var engine = new SmtEngine(CONFIG, undecided, new ProofCache());
             var hybrid = new HybridVerifier(engine, new NaturalDeductionProver())) {
            final Formula definition = new Formula.Definition("d", List.of(), Atom.of("A"), true);
            final var result = hybrid.verify(rule(definition), Deadline.after(Duration.ofSeconds(10)));
            assertThat(result.winner()).isEqualTo("none");
            assertThat(((Verdict.Unknown) result.verdict()).reason()).isEqualTo(UnknownReason.SOLVER_UNKNOWN);
            assertThat(result.gap()).startsWith("unsupported construct");
        }
    }

    @Test
    void selfReferentialRuleIsNotRaced() {
        try (var engine = new SmtEngine(CONFIG);
             var hybrid = new HybridVerifier(engine, new NaturalDeductionProver())) {
            final TranslatedRule meta = FormulaTranslatorTest.rule(FormulaTranslator.translate(platinum()), "Meta#0");
            final var result = hybrid.verify(meta, Deadline.none());
            assertThat(result.winner()).isEqualTo("none");
            assertThat(((Verdict.Unknown) result.verdict()).reason()).isEqualTo(UnknownReason.SELF_REFERENTIAL);
        }
    }
}
