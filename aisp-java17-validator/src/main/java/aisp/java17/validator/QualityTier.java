package aisp.java17.validator;

/// Quality tiers ordered from worst to best, each with its lower `δ` bound.
public enum QualityTier {
    REJECT("⊘", 0.0),
    BRONZE("◊⁻", 0.20),
    SILVER("◊", 0.40),
    GOLD("◊⁺", 0.60),
    PLATINUM("◊⁺⁺", 0.75);

    /// Values this close below a threshold still reach the tier.
    static final double TOLERANCE = 1e-9;

    private final String glyph;
    private final double threshold;

    QualityTier(String glyph, double threshold) {
        this.glyph = glyph;
        this.threshold = threshold;
    }

    public String glyph() {
        return glyph;
    }

    public double threshold() {
        return threshold;
    }

    /// The single tier for `delta`; a boundary value belongs to the higher tier.
    /// @throws IllegalArgumentException if `delta` is NaN or outside [0,1]
    public static QualityTier fromDelta(double delta) {
        if (Double.isNaN(delta) || delta < 0.0 || delta > 1.0) {
            throw new IllegalArgumentException("delta must be within [0,1]: " + delta);
        }
        final QualityTier[] tiers = values();
        for (int i = tiers.length - 1; i > 0; i--) {
            if (delta + TOLERANCE >= tiers[i].threshold) {
                return tiers[i];
            }
        }
        return REJECT;
    }

    /// The tier written as `glyph`, e.g. `◊⁺⁺`, or `null`.
    public static QualityTier forGlyph(String glyph) {
        for (QualityTier tier : values()) {
            if (tier.glyph.equals(glyph)) {
                return tier;
            }
        }
        return null;
    }
}
