package aisp.java17.validator;

import aisp.java17.logic.TruthValue;
import aisp.java17.logic.Verdict;
import aisp.java17.parser.BlockTag;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AispValidatorTest extends ValidatorTestBase {

    private AispValidator validator;

    @BeforeEach
    void open() {
        validator = new AispValidator(builtin());
    }

    @AfterEach
    void close() {
        validator.close();
    }

    private static RuleVerdict rule(ValidationResult result, String id) {
        return result.ruleVerdicts().stream().filter(r -> r.id().equals(id)).findFirst().orElseThrow();
    }

    @Test
    void fixtureIsPlatinum() {
        final ValidationResult result = validator.validate(fixture("platinum.aisp"));
        assertThat(result.errors()).isEmpty();
        assertThat(result.valid()).isTrue();
        assertThat(result.tier()).isEqualTo(QualityTier.PLATINUM);
        assertThat(result.ambiguity()).isZero();
        assertThat(result.triVector().orthogonal()).isTrue();
        assertThat(rule(result, "Rules#0").verdict()).isInstanceOf(Verdict.Proven.class);
        assertThat(rule(result, "Rules#0").block()).isEqualTo(BlockTag.RULES);
        assertThat(result.invariants()).isNotEmpty();
        assertThat(result.has(DiagnosticKind.INVARIANT)).isTrue();
    }

    @Test
    void fullyBoundDocumentScoresOne() {
        final ValidationResult result = validator.validate(fixture("scenario-a.aisp"));
        assertThat(result.delta()).isCloseTo(1.0, within(1e-9));
        assertThat(result.tier()).isEqualTo(QualityTier.PLATINUM);
        assertThat(result.metrics().blockScore()).isEqualTo(1.0);
        assertThat(result.metrics().bindingScore()).isEqualTo(1.0);
        assertThat(result.valid()).isTrue();
    }

    @Test
    void missingEvidenceStopsBeforeScoring() {
        final ValidationResult result = validator.validate(fixture("missing-evidence.aisp"));
        assertThat(result.valid()).isFalse();
        assertThat(result.tier()).isEqualTo(QualityTier.REJECT);
        assertThat(result.delta()).isZero();
        assertThat(result.metrics()).isNull();
        assertThat(result.triVector()).isNull();
        assertThat(result.ruleVerdicts()).isEmpty();
        assertThat(result.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.PARSE_ERROR);
            assertThat(d.message()).startsWith("MISSING_REQUIRED_BLOCK");
            assertThat(d.location().block()).isEqualTo(BlockTag.EVIDENCE);
        });
    }

    @Test
    void adversarialInputIsALexError() {
        final String text = withRules("∀x:ℕ.x≥0\u202E");
        final ValidationResult result = validator.validate(text);
        assertThat(result.diagnostics()).singleElement()
            .extracting(Diagnostic::kind).isEqualTo(DiagnosticKind.LEX_ERROR);
        assertThat(result.diagnostics().get(0).location().byteOffset()).isPositive();
    }

    @Test
    void oversizedInputIsRejectedBeforeLexing() {
        try (var small = new AispValidator(builtin().withMaxDocumentBytes(64))) {
            final ValidationResult result = small.validate(fixture("platinum.aisp"));
            assertThat(result.tier()).isEqualTo(QualityTier.REJECT);
            assertThat(result.diagnostics()).singleElement()
                .extracting(Diagnostic::kind).isEqualTo(DiagnosticKind.SIZE_LIMIT_EXCEEDED);
        }
    }

    @Test
    void filesAreCheckedForExtensionAndSize(@TempDir Path dir) throws IOException {
        final Path good = Files.writeString(dir.resolve("game.aisp"), fixture("platinum.aisp"), StandardCharsets.UTF_8);
        final Path bad = Files.writeString(dir.resolve("game.pdf"), fixture("platinum.aisp"), StandardCharsets.UTF_8);
        assertThat(validator.validate(good).valid()).isTrue();
        assertThat(validator.validate(bad).diagnostics()).singleElement()
            .extracting(Diagnostic::kind).isEqualTo(DiagnosticKind.UNSUPPORTED_EXTENSION);
        try (var small = new AispValidator(builtin().withMaxDocumentBytes(64))) {
            assertThat(small.validate(good).has(DiagnosticKind.SIZE_LIMIT_EXCEEDED)).isTrue();
        }
        assertThat(AispValidator.hasSupportedExtension("NOTES.MD")).isTrue();
        assertThat(AispValidator.hasSupportedExtension("rules.aisp5")).isTrue();
        assertThat(AispValidator.hasSupportedExtension("rules.json")).isFalse();
    }

    @Test
    void ambiguousDocumentFailsTheGate() {
        final ValidationResult result = validator.validate(fixture("ambiguous.aisp"));
        assertThat(result.valid()).isFalse();
        assertThat(result.ambiguity()).isGreaterThanOrEqualTo(0.02);
        assertThat(result.tier()).isEqualTo(QualityTier.PLATINUM);
        assertThat(result.errors()).extracting(Diagnostic::kind).containsExactly(DiagnosticKind.AMBIGUITY_VIOLATION);
        assertThat(result.errors().get(0).message()).contains("Rules#7");
    }

    @Test
    void hugeDeclaredDimensionsAreValidated() {
        final ValidationResult result = validator.validate(withRules("∀x:ℕ.x≥0")
            .replace("Index≜ℕ", "Index≜ℕ; V_H≜ℝ¹⁰⁰⁰⁰⁰⁰⁰⁰⁰; V_L≜ℝ¹⁰⁰⁰⁰⁰⁰⁰⁰⁰; V_S≜ℝ¹⁰⁰⁰⁰⁰⁰⁰⁰⁰"));
        assertThat(result.triVector()).isNotNull();
        assertThat(result.has(DiagnosticKind.ORTHOGONALITY_VIOLATION)).isFalse();
        assertThat(result.valid()).isTrue();
    }

    @Test
    void sharedBlockLabelsAreNotAmbiguous() {
        final String text = withRules("∀x:ℕ.x≥0")
            .replace("⟦Ω:Meta⟧", "⟦Ω:Core⟧")
            .replace("⟦Σ:Types⟧", "⟦Σ:Core⟧");
        final ValidationResult result = validator.validate(text);
        assertThat(result.ambiguity()).isZero();
        assertThat(result.has(DiagnosticKind.AMBIGUITY_VIOLATION)).isFalse();
        assertThat(result.valid()).isTrue();
    }

    @Test
    void contradictoryRuleIsAnError() {
        final ValidationResult result = validator.validate(withRules("∀x:ℤ.x<x"));
        assertThat(result.valid()).isFalse();
        assertThat(result.has(DiagnosticKind.RULE_CONTRADICTION)).isTrue();
        final RuleVerdict verdict = rule(result, "Rules#0");
        assertThat(verdict.truth()).isEqualTo(TruthValue.FALSE);
        assertThat(verdict.reason()).isNotBlank();
    }

    @Test
    void contingentRuleIsOnlyReported() {
        final ValidationResult result = validator.validate(withRules("∀x:ℤ.x≥0"));
        assertThat(result.has(DiagnosticKind.RULE_CONTINGENT)).isTrue();
        assertThat(result.has(DiagnosticKind.RULE_CONTRADICTION)).isFalse();
        assertThat(result.valid()).isTrue();
    }

    @Test
    void solverOnlyModeNamesTheBackend() {
        try (var smtOnly = new AispValidator(builtin().withHybrid(false))) {
            final ValidationResult result = smtOnly.validate(fixture("platinum.aisp"));
            assertThat(result.valid()).isTrue();
            assertThat(result.ruleVerdicts()).isNotEmpty()
                .allSatisfy(r -> assertThat(r.backend()).isEqualTo("builtin"))
                .allSatisfy(r -> assertThat(r.gap()).isNull());
        }
    }

    @Test
    void validationIsRepeatable() {
        final byte[] bytes = fixture("platinum.aisp").getBytes(StandardCharsets.UTF_8);
        final ValidationResult first = validator.validate(bytes);
        final ValidationResult second = validator.validate(bytes);
        assertThat(second.valid()).isEqualTo(first.valid());
        assertThat(second.tier()).isEqualTo(first.tier());
        assertThat(second.delta()).isEqualTo(first.delta());
        assertThat(second.ruleVerdicts()).extracting(RuleVerdict::truth)
            .containsExactlyElementsOf(first.ruleVerdicts().stream().map(RuleVerdict::truth).toList());
        assertThat(second.diagnostics()).extracting(Diagnostic::kind)
            .containsExactlyElementsOf(first.diagnostics().stream().map(Diagnostic::kind).toList());
    }
}
