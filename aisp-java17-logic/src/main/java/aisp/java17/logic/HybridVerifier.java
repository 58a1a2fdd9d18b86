package aisp.java17.logic;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static aisp.java17.logic.LogicLogging.LOG;

/// Races the SMT engine against the natural-deduction prover on the same rule.
///
/// The first definite verdict wins and the other search is cancelled. When neither is
/// definite the SMT verdict is reported. A construct the deduction prover does not support
/// is recorded as a gap rather than failing the race.
public final class HybridVerifier implements AutoCloseable {

    /// Verdict of a race.
    ///
    /// @param winner `smt`, `natural-deduction` or `none`
    /// @param gap    why natural deduction could not take part, or `null`
    public record Result(Verdict verdict, String winner, String gap) {
        public Result {
            Objects.requireNonNull(verdict, "verdict must not be null");
            Objects.requireNonNull(winner, "winner must not be null");
        }
    }

    private static final Duration GRACE = Duration.ofSeconds(1);

    private final SmtEngine engine;
    private final NaturalDeductionProver deduction;
    private final ExecutorService racers;

    public HybridVerifier(SmtEngine engine, NaturalDeductionProver deduction) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.deduction = Objects.requireNonNull(deduction, "deduction must not be null");
        this.racers = Executors.newCachedThreadPool(SmtEngine.daemonThreads("aisp-race-"));
    }

    public Result verify(TranslatedRule rule, Deadline deadline) {
        if (rule.selfReferential()) {
            return new Result(engine.verify(rule, deadline), "none", null);
        }
        final var race = new ExecutorCompletionService<Outcome>(racers);
        final Future<Outcome> smt = race.submit(() -> new Outcome("smt", engine.verify(rule, deadline), null));
        final Future<Outcome> nd = race.submit(() -> {
            try {
                return new Outcome("natural-deduction", deduction.prove(rule.obligation(), deadline), null);
            } catch (UnsupportedConstructException e) {
                return new Outcome("natural-deduction",
                    Verdict.unknown(UnknownReason.UNSUPPORTED, e.getMessage()), e.getMessage());
            }
        });
        Outcome smtOutcome = null;
        String gap = null;
        try {
            for (int received = 0; received < 2; received++) {
                final long waitMillis = deadline.remaining().plus(GRACE).toMillis();
                final Future<Outcome> done = race.poll(Math.max(1L, waitMillis), TimeUnit.MILLISECONDS);
                if (done == null) {
                    break;
                }
                final Outcome o = done.get();
                if (o.gap() != null) {
                    gap = o.gap();
                }
                if (o.verdict().isDefinite()) {
                    (done == smt ? nd : smt).cancel(true);
                    StructuredLog.fine(LOG, "hybrid.won", "rule", rule.id(), "winner", o.prover(),
                        "truth", o.verdict().truth());
                    return new Result(o.verdict(), o.prover(), gap);
                }
                if (done == smt) {
                    smtOutcome = o;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            smt.cancel(true);
            nd.cancel(true);
            return new Result(Verdict.unknown(UnknownReason.CANCELLED, "race interrupted"), "none", gap);
        } catch (ExecutionException e) {
            LOG.warning(() -> "Prover failed on " + rule.id() + ": " + e.getCause());
        }
        smt.cancel(true);
        nd.cancel(true);
        final Verdict verdict = smtOutcome != null ? smtOutcome.verdict()
            : Verdict.unknown(UnknownReason.TIMEOUT, "no prover answered before the deadline");
        return new Result(verdict, "none", gap);
    }

    @Override
    public void close() {
        racers.shutdownNow();
    }

    private record Outcome(String prover, Verdict verdict, String gap) {}
}
