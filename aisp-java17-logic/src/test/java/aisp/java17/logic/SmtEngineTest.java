package aisp.java17.logic;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SmtEngineTest extends LogicTestBase {

    private static EngineConfig builtin() {
        return EngineConfig.defaults().withBackend(BackendKind.BUILTIN).withConcurrency(2);
    }

    @Test
    void naturalNumbersAreNonNegative() {
        try (var engine = new SmtEngine(builtin())) {
            final Verdict verdict = engine.verify(firstRule(withRules("∀x:ℕ.x≥0")), Deadline.none());
            assertThat(verdict).isInstanceOf(Verdict.Proven.class);
            final var certificate = (ProofObject.SmtCertificate) ((Verdict.Proven) verdict).proof();
            assertThat(certificate.axioms()).contains(Axiom.NAT_DOMAIN);
        }
    }

    @Test
    void timeoutIsRetriedOnceThenReported() {
        final var counting = new CountingBackend(new BuiltinBackend());
        final EngineConfig config = builtin().withTimeout(Duration.ofMillis(1));
        try (var engine = new SmtEngine(config, counting, new ProofCache())) {
            final Verdict verdict = engine.prove(Pigeonhole.obligation(9, 8));
            assertThat(verdict).isInstanceOf(Verdict.Unknown.class);
            assertThat(((Verdict.Unknown) verdict).reason()).isEqualTo(UnknownReason.TIMEOUT);
            assertThat(counting.calls()).isEqualTo(2);
            assertThat(engine.cache().size()).isZero();
        }
    }

    @Test
    void callerDeadlineCapsTheConfiguredTimeout() {
        try (var engine = new SmtEngine(builtin())) {
            final long started = System.nanoTime();
            final Verdict verdict = engine.prove(Pigeonhole.obligation(9, 8), Deadline.after(Duration.ofMillis(50)));
            assertThat(((Verdict.Unknown) verdict).reason()).isEqualTo(UnknownReason.TIMEOUT);
            assertThat(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - started)).isLessThan(10);
        }
    }

    @Test
    void definiteVerdictsAreCached() {
        final var counting = new CountingBackend(new BuiltinBackend());
        try (var engine = new SmtEngine(builtin(), counting, new ProofCache())) {
            final Obligation obligation = firstRule(withRules("∀x:ℕ.x≥0")).obligation();
            final Verdict first = engine.prove(obligation);
            final Verdict second = engine.prove(obligation);
            assertThat(second).isSameAs(first);
            assertThat(counting.calls()).isEqualTo(1);
            assertThat(engine.cache().hits()).isEqualTo(1);
            assertThat(engine.cache().misses()).isEqualTo(1);
        }
    }

    @Test
    void unknownVerdictsAreNotCached() {
        final var counting = CountingBackend.undecided(UnknownReason.SOLVER_UNKNOWN);
        try (var engine = new SmtEngine(builtin(), counting, new ProofCache())) {
            final Obligation obligation = Pigeonhole.obligation(2, 1);
            engine.prove(obligation);
            engine.prove(obligation);
            assertThat(counting.calls()).isEqualTo(2);
            assertThat(engine.cache().size()).isZero();
        }
    }

    @Test
    void selfReferentialRuleNeverReachesTheBackend() {
        final var counting = new CountingBackend(new BuiltinBackend());
        try (var engine = new SmtEngine(builtin(), counting, new ProofCache())) {
            final TranslatedRule meta = FormulaTranslatorTest.rule(FormulaTranslator.translate(platinum()), "Meta#0");
            final Verdict verdict = engine.verify(meta, Deadline.none());
            assertThat(((Verdict.Unknown) verdict).reason()).isEqualTo(UnknownReason.SELF_REFERENTIAL);
            assertThat(counting.calls()).isZero();
        }
    }

    @Test
    void backendFailureBecomesUnknown() {
        final SmtBackend failing = new SmtBackend() {
            @Override
            public String name() {
                return "failing";
            }

            @Override
            public Verdict check(Obligation obligation, Deadline deadline) {
                throw new IllegalStateException("solver crashed");
            }
        };
        try (var engine = new SmtEngine(builtin(), failing, new ProofCache())) {
            final Verdict verdict = engine.prove(Pigeonhole.obligation(2, 1));
            assertThat(((Verdict.Unknown) verdict).reason()).isEqualTo(UnknownReason.BACKEND_ERROR);
            assertThat(((Verdict.Unknown) verdict).detail()).contains("solver crashed");
        }
    }

    @Test
    void submittedRulesRunOnThePool() throws Exception {
        try (var engine = new SmtEngine(builtin())) {
            final var future = engine.submit(firstRule(withRules("∀x:ℕ.x≥0")), Deadline.after(Duration.ofSeconds(10)));
            assertThat(future.get(10, TimeUnit.SECONDS)).isInstanceOf(Verdict.Proven.class);
        }
    }

    @Test
    void missingSolverFallsBackToBuiltin() {
        final SmtBackend backend = SmtBackend.forConfig(EngineConfig.defaults().withZ3Executable("/nonexistent/z3"));
        assertThat(backend).isInstanceOf(BuiltinBackend.class);
    }

    @Test
    void unavailableSolverIsReported() {
        final Verdict verdict = new Z3ProcessBackend("/nonexistent/z3", 512)
            .check(Pigeonhole.obligation(2, 1), Deadline.after(Duration.ofSeconds(5)));
        assertThat(((Verdict.Unknown) verdict).reason()).isEqualTo(UnknownReason.BACKEND_UNAVAILABLE);
    }

    @Test
    void configRejectsNonsense() {
        final EngineConfig defaults = EngineConfig.defaults();
        assertThat(defaults.timeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(defaults.memoryMegabytes()).isEqualTo(512);
        assertThatThrownBy(() -> defaults.withTimeout(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> defaults.withConcurrency(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> defaults.withMemoryMegabytes(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
