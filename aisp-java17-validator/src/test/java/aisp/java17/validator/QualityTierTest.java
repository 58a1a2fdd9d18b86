package aisp.java17.validator;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QualityTierTest extends ValidatorTestBase {

    @ParameterizedTest
    @CsvSource({
        "0.0, REJECT",
        "0.1999, REJECT",
        "0.20, BRONZE",
        "0.39, BRONZE",
        "0.40, SILVER",
        "0.60, GOLD",
        "0.7499, GOLD",
        "0.75, PLATINUM",
        "1.0, PLATINUM"
    })
    void boundariesBelongToTheHigherTier(double delta, QualityTier expected) {
        assertThat(QualityTier.fromDelta(delta)).isEqualTo(expected);
    }

    @Test
    void roundingJustBelowABoundaryStillQualifies() {
        assertThat(QualityTier.fromDelta(0.6 - 1e-12)).isEqualTo(QualityTier.GOLD);
    }

    @Test
    void outOfRangeIsRejected() {
        assertThatThrownBy(() -> QualityTier.fromDelta(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> QualityTier.fromDelta(-0.01)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> QualityTier.fromDelta(1.01)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void glyphsRoundTrip() {
        for (QualityTier tier : QualityTier.values()) {
            assertThat(QualityTier.forGlyph(tier.glyph())).isEqualTo(tier);
        }
        assertThat(QualityTier.forGlyph("?")).isNull();
    }

    @Property
    void exactlyOneTierApplies(@ForAll @DoubleRange(min = 0.0, max = 1.0) double delta) {
        final long matching = Arrays.stream(QualityTier.values())
            .filter(t -> delta + QualityTier.TOLERANCE >= t.threshold())
            .filter(t -> t.ordinal() == QualityTier.values().length - 1
                || delta + QualityTier.TOLERANCE < QualityTier.values()[t.ordinal() + 1].threshold())
            .count();
        assertThat(matching).isEqualTo(1);
        assertThat(QualityTier.fromDelta(delta).threshold()).isLessThanOrEqualTo(delta + QualityTier.TOLERANCE);
    }

    @Property
    void tierIsMonotoneInDelta(@ForAll @DoubleRange(min = 0.0, max = 1.0) double a,
                               @ForAll @DoubleRange(min = 0.0, max = 1.0) double b) {
        final double lo = Math.min(a, b);
        final double hi = Math.max(a, b);
        assertThat(QualityTier.fromDelta(lo).compareTo(QualityTier.fromDelta(hi))).isLessThanOrEqualTo(0);
    }
}
