package aisp.java17.logic;

import java.time.Duration;
import java.util.Objects;

/// Absolute point in time after which a proof search must stop.
public final class Deadline {

    private final long deadlineNanos;

    private Deadline(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    public static Deadline after(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        final long nanos = timeout.isNegative() ? 0L : saturatedNanos(timeout);
        final long now = System.nanoTime();
        final long at = Long.MAX_VALUE - now < nanos ? Long.MAX_VALUE : now + nanos;
        return new Deadline(at);
    }

    public static Deadline none() {
        return new Deadline(Long.MAX_VALUE);
    }

    /// The earlier of this deadline and one `timeout` from now.
    public Deadline cappedAt(Duration timeout) {
        final Deadline other = after(timeout);
        return other.deadlineNanos - deadlineNanos < 0 ? other : this;
    }

    public boolean expired() {
        return deadlineNanos != Long.MAX_VALUE && System.nanoTime() - deadlineNanos >= 0;
    }

    public Duration remaining() {
        if (deadlineNanos == Long.MAX_VALUE) {
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        final long left = deadlineNanos - System.nanoTime();
        return left <= 0 ? Duration.ZERO : Duration.ofNanos(left);
    }

    /// @throws SearchAbortedException when the deadline passed or the thread was interrupted
    void check() {
        if (Thread.currentThread().isInterrupted()) {
            throw new SearchAbortedException(UnknownReason.CANCELLED);
        }
        if (expired()) {
            throw new SearchAbortedException(UnknownReason.TIMEOUT);
        }
    }

    private static long saturatedNanos(Duration d) {
        try {
            return d.toNanos();
        } catch (ArithmeticException overflow) {
            return Long.MAX_VALUE;
        }
    }
}
