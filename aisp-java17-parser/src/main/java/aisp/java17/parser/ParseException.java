package aisp.java17.parser;

import java.util.Objects;

/// Thrown when a token stream does not form a structurally valid AISP document.
public class ParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /// Structural failure classes.
    public enum Kind {
        MISSING_HEADER,
        UNBALANCED_DELIMITER,
        MISSING_REQUIRED_BLOCK,
        EMPTY_REQUIRED_BLOCK,
        DUPLICATE_BLOCK,
        PROSE_IN_BLOCK,
        UNEXPECTED_TOKEN,
        CYCLIC_DEFINITION
    }

    private final Kind kind;
    private final int byteOffset;
    private final BlockTag blockTag;

    public ParseException(Kind kind, String message, int byteOffset, BlockTag blockTag) {
        super(formatMessage(kind, message, byteOffset, blockTag));
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.byteOffset = byteOffset;
        this.blockTag = blockTag;
    }

    public Kind kind() {
        return kind;
    }

    /// UTF-8 byte offset of the offending token, or -1 when the failure concerns the whole document.
    public int byteOffset() {
        return byteOffset;
    }

    /// The block being parsed, or `null` outside any block.
    public BlockTag blockTag() {
        return blockTag;
    }

    private static String formatMessage(Kind kind, String message, int byteOffset, BlockTag blockTag) {
        final var sb = new StringBuilder();
        sb.append(kind).append(": ").append(message);
        if (blockTag != null) {
            sb.append(" in block ").append(blockTag.glyph()).append(':').append(blockTag.label());
        }
        if (byteOffset >= 0) {
            sb.append(" at byte ").append(byteOffset);
        }
        return sb.toString();
    }
}
