package aisp.java17.validator;

import aisp.java17.parser.BlockTag;

import java.util.Map;
import java.util.Objects;

/// Density scores of one token stream.
///
/// @param blockScore       distinct required block headers present, over 5
/// @param bindings         binding operators counted over the whole document
/// @param bindingScore     `min(1, bindings / 20)`
/// @param delta            semantic density `0.4 × blockScore + 0.6 × bindingScore`
/// @param pureDensity      registry symbol tokens over non-whitespace tokens
/// @param blockBindings    binding operators counted inside each block present
public record DensityMetrics(
    double blockScore,
    int bindings,
    double bindingScore,
    double delta,
    double pureDensity,
    int symbolTokens,
    int nonWhitespaceTokens,
    Map<BlockTag, Integer> blockBindings
) {
    public DensityMetrics {
        Objects.requireNonNull(blockBindings, "blockBindings must not be null");
        blockBindings = Map.copyOf(blockBindings); // defensive copy
    }

    public QualityTier tier() {
        return QualityTier.fromDelta(delta);
    }
}
