package aisp.java17.logic;

import aisp.java17.parser.BlockTag;

/// Thrown when a statement has no formula IR counterpart, for example a lambda in a
/// proposition position.
public class TranslationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final BlockTag blockTag;
    private final int byteOffset;
    private final String statement;

    public TranslationException(String message, BlockTag blockTag, int byteOffset, String statement) {
        super(message + " in '" + statement + "'");
        this.blockTag = blockTag;
        this.byteOffset = byteOffset;
        this.statement = statement;
    }

    public BlockTag blockTag() {
        return blockTag;
    }

    public int byteOffset() {
        return byteOffset;
    }

    /// Canonical rendering of the offending statement.
    public String statement() {
        return statement;
    }
}
