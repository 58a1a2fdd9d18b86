package aisp.java17.validator;

import aisp.java17.parser.AispLexer;
import aisp.java17.parser.ParseStrategy;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AmbiguityAnalyzerTest extends ValidatorTestBase {

    @Test
    void fixtureReadsOneWay() {
        final AmbiguityReport report = AmbiguityAnalyzer.analyze(tokens("platinum.aisp"));
        assertThat(report.ambiguity()).isZero();
        assertThat(report.strategies()).containsExactly(ParseStrategy.values());
        assertThat(report.unique()).isEqualTo(report.total());
        assertThat(report.divergent()).isEmpty();
    }

    @Test
    void precedenceSensitiveRuleIsAmbiguous() {
        final AmbiguityReport report = AmbiguityAnalyzer.analyze(tokens("ambiguous.aisp"));
        assertThat(report.divergent()).containsExactly("Rules#7");
        assertThat(report.ambiguity()).isGreaterThanOrEqualTo(0.02);
        // 23 statements read one way, the extra rule two ways
        assertThat(report.ambiguity()).isCloseTo(1.0 - 23.0 / 25.0, within(1e-9));
    }

    @Test
    void strategiesThatFailDoNotCount() {
        final AmbiguityReport report = AmbiguityAnalyzer.analyze(
            AispLexer.tokenize(withRules("x≥0 ≥; ∀y:ℕ.y≥0")));
        assertThat(report.strategies()).containsExactly(ParseStrategy.BACKTRACKING);
        assertThat(report.ambiguity()).isZero();
    }

    @Test
    void blocksAreToldApartByTagNotLabel() {
        final String text = withRules("∀x:ℕ.x≥0")
            .replace("⟦Ω:Meta⟧", "⟦Ω:Core⟧")
            .replace("⟦Σ:Types⟧", "⟦Σ:Core⟧");
        final AmbiguityReport report = AmbiguityAnalyzer.analyze(AispLexer.tokenize(text));
        assertThat(report.ambiguity()).isZero();
        assertThat(report.divergent()).isEmpty();
        assertThat(report.unique()).isEqualTo(report.total());
    }
}
