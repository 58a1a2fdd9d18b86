package aisp.java17.logic;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import static aisp.java17.logic.LogicLogging.LOG;

/// Answers proof obligations through one [SmtBackend], with caching, deadlines and a single
/// retry on a simplified formula after a timeout.
///
/// Thread-safe. Rules submitted with [#submit] run on a fixed pool sized by
/// [EngineConfig#concurrency()].
public final class SmtEngine implements AutoCloseable {

    private final EngineConfig config;
    private final SmtBackend backend;
    private final ProofCache cache;
    private final ExecutorService pool;

    public SmtEngine(EngineConfig config) {
        this(config, SmtBackend.forConfig(config), new ProofCache());
    }

    public SmtEngine(EngineConfig config, SmtBackend backend, ProofCache cache) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.pool = Executors.newFixedThreadPool(config.concurrency(), daemonThreads("aisp-smt-"));
    }

    public SmtBackend backend() {
        return backend;
    }

    public ProofCache cache() {
        return cache;
    }

    public EngineConfig config() {
        return config;
    }

    public Verdict prove(Obligation obligation) {
        return prove(obligation, Deadline.none());
    }

    /// Proves `obligation` within `min(config timeout, remaining caller deadline)`.
    public Verdict prove(Obligation obligation, Deadline callerDeadline) {
        Objects.requireNonNull(obligation, "obligation must not be null");
        Objects.requireNonNull(callerDeadline, "callerDeadline must not be null");
        final String key = obligation.cacheKey();
        final var cached = cache.lookup(key);
        if (cached.isPresent()) {
            StructuredLog.finer(LOG, "smt.cache.hit", "obligation", obligation.id());
            return cached.get();
        }
        Verdict verdict = run(obligation, callerDeadline.cappedAt(config.timeout()));
        if (verdict instanceof Verdict.Unknown u && u.reason() == UnknownReason.TIMEOUT) {
            verdict = retrySimplified(obligation, callerDeadline);
        }
        return cache.store(key, verdict);
    }

    /// Verifies a translated rule; self-referential rules are never sent to a backend.
    public Verdict verify(TranslatedRule rule, Deadline callerDeadline) {
        if (rule.selfReferential()) {
            return Verdict.unknown(UnknownReason.SELF_REFERENTIAL,
                "rule refers to the validation of its own document");
        }
        return prove(rule.obligation(), callerDeadline);
    }

    public Future<Verdict> submit(TranslatedRule rule, Deadline callerDeadline) {
        return pool.submit(() -> verify(rule, callerDeadline));
    }

    private Verdict retrySimplified(Obligation obligation, Deadline callerDeadline) {
        final Obligation simplified = Simplifier.simplify(obligation);
        StructuredLog.fine(LOG, "smt.retry", "obligation", obligation.id(),
            "assumptions", obligation.assumptions().size(), "kept", simplified.assumptions().size());
        final Verdict retry = run(simplified, callerDeadline.cappedAt(config.timeout()));
        if (retry instanceof Verdict.Proven) {
            return retry;
        }
        // fewer assumptions can only lose proofs, so a model of the reduced query proves nothing
        if (retry instanceof Verdict.Disproven && simplified.assumptions().size() == obligation.assumptions().size()) {
            return retry;
        }
        return Verdict.unknown(UnknownReason.TIMEOUT, "timed out, also after simplification");
    }

    private Verdict run(Obligation obligation, Deadline deadline) {
        final long started = System.nanoTime();
        Verdict verdict;
        try {
            verdict = backend.check(obligation, deadline);
        } catch (RuntimeException e) {
            LOG.warning(() -> "Backend " + backend.name() + " failed on " + obligation.id() + ": " + e);
            verdict = Verdict.unknown(UnknownReason.BACKEND_ERROR, backend.name() + ": " + e.getMessage());
        }
        final Verdict result = verdict;
        StructuredLog.fine(LOG, "smt.check", "obligation", obligation.id(), "backend", backend.name(),
            "truth", result.truth(), "ms", (System.nanoTime() - started) / 1_000_000);
        return result;
    }

    @Override
    public void close() {
        pool.shutdownNow();
        StructuredLog.fine(LOG, "smt.cache", "entries", cache.size(), "hits", cache.hits(), "misses", cache.misses());
    }

    static ThreadFactory daemonThreads(String prefix) {
        final var counter = new AtomicInteger();
        return r -> {
            final Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
