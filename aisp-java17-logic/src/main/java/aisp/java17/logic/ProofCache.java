package aisp.java17.logic;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/// In-memory cache of definite verdicts keyed by [Obligation#cacheKey()].
///
/// Only [Verdict.Proven] and [Verdict.Disproven] are stored; the first verdict stored for a key
/// wins.
public final class ProofCache {

    private final ConcurrentMap<String, Verdict> entries = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public Optional<Verdict> lookup(String key) {
        final Verdict v = entries.get(key);
        if (v == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(v);
    }

    /// Stores `verdict` unless it is unknown or a verdict is already cached; returns the cached one.
    public Verdict store(String key, Verdict verdict) {
        if (!verdict.isDefinite()) {
            return verdict;
        }
        final Verdict previous = entries.putIfAbsent(key, verdict);
        return previous != null ? previous : verdict;
    }

    public int size() {
        return entries.size();
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }
}
