package aisp.java17.logic;

import java.util.concurrent.atomic.AtomicInteger;

/// Test backend that counts how often it is asked.
final class CountingBackend implements SmtBackend {

    private final SmtBackend delegate;
    private final AtomicInteger calls = new AtomicInteger();

    CountingBackend(SmtBackend delegate) {
        this.delegate = delegate;
    }

    /// A backend that never decides anything.
    static CountingBackend undecided(UnknownReason reason) {
        return new CountingBackend(new SmtBackend() {
            @Override
            public String name() {
                return "undecided";
            }

            @Override
            public Verdict check(Obligation obligation, Deadline deadline) {
                return Verdict.unknown(reason, "stub");
            }
        });
    }

    int calls() {
        return calls.get();
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public Verdict check(Obligation obligation, Deadline deadline) {
        calls.incrementAndGet();
        return delegate.check(obligation, deadline);
    }
}
