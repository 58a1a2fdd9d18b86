package aisp.java17.validator;

import aisp.java17.parser.AispLexer;
import aisp.java17.parser.BlockTag;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DensityAnalyzerTest extends ValidatorTestBase {

    @Test
    void fullyBoundDocumentIsPlatinum() {
        final DensityMetrics m = DensityAnalyzer.analyze(tokens("scenario-a.aisp"));
        assertThat(m.blockScore()).isEqualTo(1.0);
        assertThat(m.bindings()).isEqualTo(16 + 9 + 4 + 3 + 7);
        assertThat(m.bindingScore()).isEqualTo(1.0);
        assertThat(m.delta()).isCloseTo(1.000, within(1e-9));
        assertThat(m.tier()).isEqualTo(QualityTier.PLATINUM);
    }

    @Test
    void bindingsAreAttributedToTheirBlocks() {
        final DensityMetrics m = DensityAnalyzer.analyze(tokens("scenario-a.aisp"));
        assertThat(m.blockBindings()).containsEntry(BlockTag.META, 3)
            .containsEntry(BlockTag.TYPES, 6)
            .containsEntry(BlockTag.EVIDENCE, 3);
    }

    @Test
    void sparseBlockGetsAnInformationalNote() {
        final List<Diagnostic> notes = DensityAnalyzer.belowMinimum(DensityAnalyzer.analyze(tokens("platinum.aisp")));
        assertThat(notes).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.BINDING_BELOW_MINIMUM);
            assertThat(d.severity()).isEqualTo(Severity.INFO);
            assertThat(d.location().block()).isEqualTo(BlockTag.EVIDENCE);
        });
    }

    @Test
    void missingBlockLowersTheBlockScore() {
        final DensityMetrics full = DensityAnalyzer.analyze(tokens("platinum.aisp"));
        final DensityMetrics partial = DensityAnalyzer.analyze(tokens("missing-evidence.aisp"));
        assertThat(partial.blockScore()).isCloseTo(0.8, within(1e-9));
        assertThat(partial.delta()).isLessThanOrEqualTo(full.delta());
    }

    @Test
    void proseOnlyInputIsBelowBronze() {
        final DensityMetrics m = DensityAnalyzer.analyze(AispLexer.tokenize("just some notes x≜1"));
        assertThat(m.delta()).isCloseTo(0.6 / 20, within(1e-9));
        assertThat(m.tier()).isEqualTo(QualityTier.REJECT);
    }

    @Test
    void emptyInputHasZeroPureDensity() {
        final DensityMetrics m = DensityAnalyzer.analyze(List.of());
        assertThat(m.pureDensity()).isZero();
        assertThat(m.delta()).isZero();
    }

    @Test
    void pureDensityCountsRegistrySymbols() {
        final DensityMetrics m = DensityAnalyzer.analyze(AispLexer.tokenize("x≜y"));
        assertThat(m.symbolTokens()).isEqualTo(1);
        assertThat(m.nonWhitespaceTokens()).isEqualTo(3);
        assertThat(m.pureDensity()).isCloseTo(1.0 / 3, within(1e-9));
    }

    @Property
    void removingABlockOrABindingNeverRaisesDelta(@ForAll @IntRange(min = 1, max = 5) int blocks,
                                                  @ForAll @IntRange(min = 1, max = 40) int bindings) {
        final double delta = DensityAnalyzer.delta(blocks / 5.0, Math.min(1.0, bindings / 20.0));
        final double fewerBlocks = DensityAnalyzer.delta((blocks - 1) / 5.0, Math.min(1.0, bindings / 20.0));
        final double fewerBindings = DensityAnalyzer.delta(blocks / 5.0, Math.min(1.0, (bindings - 1) / 20.0));
        assertThat(fewerBlocks).isLessThanOrEqualTo(delta);
        assertThat(fewerBindings).isLessThanOrEqualTo(delta);
    }

    @Property(tries = 50)
    void deletingABindingGlyphFromTheDocumentNeverRaisesDelta(@ForAll @IntRange(min = 0, max = 200) int seed) {
        final String text = fixture("platinum.aisp");
        final int[] positions = text.codePoints().toArray();
        final var candidates = new java.util.ArrayList<Integer>();
        for (int i = 0; i < positions.length; i++) {
            if (DensityAnalyzer.BINDING_GLYPHS.contains(new String(Character.toChars(positions[i])))) {
                candidates.add(i);
            }
        }
        final int drop = candidates.get(seed % candidates.size());
        final var reduced = new StringBuilder();
        for (int i = 0; i < positions.length; i++) {
            if (i != drop) {
                reduced.appendCodePoint(positions[i]);
            }
        }
        final double before = DensityAnalyzer.analyze(AispLexer.tokenize(text)).delta();
        final double after = DensityAnalyzer.analyze(AispLexer.tokenize(reduced.toString())).delta();
        assertThat(after).isLessThanOrEqualTo(before);
    }
}
