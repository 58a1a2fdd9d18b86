package aisp.java17.logic;

/// Unwinds an in-process proof search that ran out of time or was interrupted.
final class SearchAbortedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final UnknownReason reason;

    SearchAbortedException(UnknownReason reason) {
        super(reason.name(), null, false, false);
        this.reason = reason;
    }

    UnknownReason reason() {
        return reason;
    }
}
