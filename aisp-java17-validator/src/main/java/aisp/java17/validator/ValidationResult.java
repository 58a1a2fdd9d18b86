package aisp.java17.validator;

import aisp.java17.logic.Invariant;

import java.util.List;
import java.util.Objects;

/// Result of validating one document. Immutable.
///
/// A document rejected by the lexer, the parser or an input limit carries only that
/// diagnostic, tier `REJECT`, `δ = 0` and no metrics, tri-vector result, rules or invariants.
public record ValidationResult(
    boolean valid,
    QualityTier tier,
    double delta,
    double ambiguity,
    double pureDensity,
    DensityMetrics metrics,
    List<RuleVerdict> ruleVerdicts,
    List<Invariant> invariants,
    TriVectorResult triVector,
    List<Diagnostic> diagnostics
) {
    public ValidationResult {
        Objects.requireNonNull(tier, "tier must not be null");
        Objects.requireNonNull(ruleVerdicts, "ruleVerdicts must not be null");
        Objects.requireNonNull(invariants, "invariants must not be null");
        Objects.requireNonNull(diagnostics, "diagnostics must not be null");
        ruleVerdicts = List.copyOf(ruleVerdicts); // defensive copy
        invariants = List.copyOf(invariants); // defensive copy
        diagnostics = List.copyOf(diagnostics); // defensive copy
        if (valid && diagnostics.stream().anyMatch(Diagnostic::isError)) {
            throw new IllegalArgumentException("a valid result cannot carry errors");
        }
    }

    /// Creates a result for a document that never reached scoring.
    public static ValidationResult rejected(Diagnostic diagnostic) {
        return new ValidationResult(false, QualityTier.REJECT, 0.0, 0.0, 0.0, null,
            List.of(), List.of(), null, List.of(diagnostic));
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(Diagnostic::isError).toList();
    }

    public boolean has(DiagnosticKind kind) {
        return diagnostics.stream().anyMatch(d -> d.kind() == kind);
    }
}
