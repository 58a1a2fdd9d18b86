package aisp.java17.parser;

import java.util.Objects;

/// Thrown when document bytes cannot be tokenized. Always fatal to the document.
public class LexException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /// Why lexing stopped.
    public enum Kind {
        /// Bytes are not well-formed UTF-8.
        MALFORMED_INPUT,
        /// Bidi control, zero-width character or confusable glyph.
        ADVERSARIAL_INPUT,
        /// A string literal runs to the end of input.
        UNTERMINATED_STRING
    }

    private final Kind kind;
    private final int byteOffset;

    public LexException(Kind kind, String message, int byteOffset) {
        super(formatMessage(kind, message, byteOffset));
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.byteOffset = byteOffset;
    }

    public Kind kind() {
        return kind;
    }

    /// UTF-8 byte offset of the offending input.
    public int byteOffset() {
        return byteOffset;
    }

    private static String formatMessage(Kind kind, String message, int byteOffset) {
        return kind + ": " + message + " at byte " + byteOffset;
    }
}
