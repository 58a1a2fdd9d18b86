package aisp.java17.validator;

import aisp.java17.parser.BlockTag;

/// Where a diagnostic points: a byte offset, a block, a statement of a block, or nowhere.
///
/// @param byteOffset     UTF-8 byte offset, or `-1`
/// @param block          block tag, or `null`
/// @param statementIndex position within `block`, or `-1`
public record Location(int byteOffset, BlockTag block, int statementIndex) {

    private static final Location NOWHERE = new Location(-1, null, -1);

    public Location {
        if (byteOffset < -1 || statementIndex < -1) {
            throw new IllegalArgumentException("offsets must be >= -1");
        }
        if (statementIndex >= 0 && block == null) {
            throw new IllegalArgumentException("statementIndex requires a block");
        }
    }

    public static Location nowhere() {
        return NOWHERE;
    }

    public static Location at(int byteOffset) {
        return new Location(byteOffset, null, -1);
    }

    public static Location in(BlockTag block) {
        return new Location(-1, block, -1);
    }

    public static Location in(BlockTag block, int byteOffset) {
        return new Location(byteOffset, block, -1);
    }

    public static Location statement(BlockTag block, int statementIndex, int byteOffset) {
        return new Location(byteOffset, block, statementIndex);
    }

    @Override
    public String toString() {
        final var sb = new StringBuilder();
        if (block != null) {
            sb.append(block.label());
            if (statementIndex >= 0) {
                sb.append('#').append(statementIndex);
            }
        }
        if (byteOffset >= 0) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append("byte ").append(byteOffset);
        }
        return sb.length() == 0 ? "document" : sb.toString();
    }
}
