package aisp.java17.validator;

import aisp.java17.logic.StructuredLog;
import aisp.java17.parser.BlockTag;
import aisp.java17.parser.Token;
import aisp.java17.parser.TokenKind;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static aisp.java17.validator.ValidatorLogging.LOG;

/// Semantic density `δ` and pure density `ρ` of a token stream.
///
/// Works on tokens rather than the AST, so a document that fails to parse can still be
/// scored by the `density` command.
public final class DensityAnalyzer {

    static final double BLOCK_WEIGHT = 0.4;
    static final double BINDING_WEIGHT = 0.6;

    /// Definition, assignment, quantifiers, lambda, implications and set operators.
    static final Set<String> BINDING_GLYPHS = Set.of(
        "≜", "≔",
        "∀", "∃",
        "λ",
        "⇒", "⇔", "→", "↔",
        "∈", "∉", "⊆", "⊇", "∩", "∪", "∅");

    private static final Set<BlockTag> REQUIRED = BlockTag.requiredTags();
    private static final int EXPECTED_BINDINGS = REQUIRED.stream().mapToInt(BlockTag::expectedBindings).sum();

    private DensityAnalyzer() {}

    public static DensityMetrics analyze(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        final Set<BlockTag> headers = EnumSet.noneOf(BlockTag.class);
        final Map<BlockTag, Integer> blockBindings = new EnumMap<>(BlockTag.class);
        BlockTag current = null;
        int depth = 0;
        int bindings = 0;
        int symbols = 0;
        int nonWhitespace = 0;
        for (int i = 0; i < tokens.size(); i++) {
            final Token t = tokens.get(i);
            if (t.kind() == TokenKind.NEWLINE) {
                continue;
            }
            nonWhitespace++;
            if (t.isSymbol()) {
                symbols++;
            }
            final String g = t.glyph();
            if ("⟦".equals(g) && i + 1 < tokens.size()) {
                final BlockTag tag = BlockTag.forGlyph(tokens.get(i + 1).glyph());
                if (tag != null) {
                    if (REQUIRED.contains(tag)) {
                        headers.add(tag);
                    }
                    current = tag;
                    depth = 0;
                    blockBindings.putIfAbsent(tag, 0);
                }
            } else if (current != null && ("{".equals(g) || "⟨".equals(g))) {
                depth++;
            } else if (current != null && ("}".equals(g) || "⟩".equals(g))) {
                depth--;
                if (depth <= 0) {
                    current = null;
                }
            }
            if (BINDING_GLYPHS.contains(g)) {
                bindings++;
                if (current != null) {
                    blockBindings.merge(current, 1, Integer::sum);
                }
            }
        }
        final double blockScore = (double) headers.size() / REQUIRED.size();
        final double bindingScore = Math.min(1.0, (double) bindings / EXPECTED_BINDINGS);
        final double delta = delta(blockScore, bindingScore);
        final double rho = nonWhitespace == 0 ? 0.0 : (double) symbols / nonWhitespace;
        StructuredLog.fine(LOG, "density", "blocks", headers.size(), "bindings", bindings,
            "delta", delta, "rho", rho);
        return new DensityMetrics(blockScore, bindings, bindingScore, delta, rho, symbols, nonWhitespace, blockBindings);
    }

    /// `0.4 × blockScore + 0.6 × bindingScore`, clamped to [0,1] against rounding.
    public static double delta(double blockScore, double bindingScore) {
        final double d = BLOCK_WEIGHT * blockScore + BINDING_WEIGHT * bindingScore;
        return Math.max(0.0, Math.min(1.0, d));
    }

    /// One informational diagnostic per present required block using fewer binding
    /// operators than its expected minimum.
    static List<Diagnostic> belowMinimum(DensityMetrics metrics) {
        final var out = new ArrayList<Diagnostic>();
        for (BlockTag tag : REQUIRED) {
            final Integer count = metrics.blockBindings().get(tag);
            if (count != null && count < tag.expectedBindings()) {
                out.add(Diagnostic.of(DiagnosticKind.BINDING_BELOW_MINIMUM, Location.in(tag),
                    tag.label() + " block uses " + count + " binding operators, expected at least "
                        + tag.expectedBindings()));
            }
        }
        return out;
    }
}
