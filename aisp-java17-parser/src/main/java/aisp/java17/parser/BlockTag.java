package aisp.java17.parser;

import java.util.EnumSet;
import java.util.Set;

/// Block tags of an AISP document, keyed by the category glyph in `⟦glyph:Label⟧`.
public enum BlockTag {
    META("Ω", "Meta", true, 2),
    TYPES("Σ", "Types", true, 4),
    RULES("Γ", "Rules", true, 6),
    FUNCTIONS("Λ", "Funcs", true, 4),
    EVIDENCE("Ε", "Evidence", true, 4),
    ERRORS("Χ", "Errors", false, 0),
    PROOFS("Θ", "Proofs", false, 0),
    CATEGORIES("ℭ", "Categories", false, 0);

    private final String glyph;
    private final String label;
    private final boolean required;
    private final int expectedBindings;

    BlockTag(String glyph, String label, boolean required, int expectedBindings) {
        this.glyph = glyph;
        this.label = label;
        this.required = required;
        this.expectedBindings = expectedBindings;
    }

    public String glyph() {
        return glyph;
    }

    /// Conventional label written after the colon. Any label is accepted when parsing.
    public String label() {
        return label;
    }

    public boolean required() {
        return required;
    }

    /// Minimum number of binding operators a well-formed block of this kind is expected to use.
    public int expectedBindings() {
        return expectedBindings;
    }

    /// The tag introduced by `glyph`, or `null`.
    public static BlockTag forGlyph(String glyph) {
        for (BlockTag tag : values()) {
            if (tag.glyph.equals(glyph)) {
                return tag;
            }
        }
        return null;
    }

    public static Set<BlockTag> requiredTags() {
        final var set = EnumSet.noneOf(BlockTag.class);
        for (BlockTag tag : values()) {
            if (tag.required) {
                set.add(tag);
            }
        }
        return set;
    }
}
