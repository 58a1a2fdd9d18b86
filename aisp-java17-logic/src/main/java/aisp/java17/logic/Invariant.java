package aisp.java17.logic;

import aisp.java17.parser.BlockTag;

import java.util.Objects;
import java.util.Optional;

/// A property inferred from the document's own statements.
///
/// `formula` is present when the invariant can serve as a proof assumption. `block` and
/// `byteOffset` locate the statement the invariant was read from; structural invariants
/// point at the block header.
public record Invariant(
    Kind kind,
    String description,
    double confidence,
    Formula formula,
    BlockTag block,
    int byteOffset
) {
    public enum Kind { TYPE_SAFETY, BOUNDS, MEMBERSHIP, STRUCTURAL }

    public Invariant {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(block, "block must not be null");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
    }

    public Optional<Formula> assumption() {
        return Optional.ofNullable(formula);
    }

    /// Whether this invariant was read from the statement at (`tag`, `offset`).
    public boolean derivedFrom(BlockTag tag, int offset) {
        return block == tag && byteOffset == offset;
    }
}
