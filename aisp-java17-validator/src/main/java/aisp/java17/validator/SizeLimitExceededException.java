package aisp.java17.validator;

/// Thrown when a document is larger than the configured limit. Raised before lexing.
public class SizeLimitExceededException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final long size;
    private final long limit;

    public SizeLimitExceededException(long size, long limit) {
        super("document is " + size + " bytes, limit is " + limit);
        this.size = size;
        this.limit = limit;
    }

    public long size() {
        return size;
    }

    public long limit() {
        return limit;
    }
}
