package aisp.java17.validator;

/// Every kind of finding a validation run can report, with its usual severity.
public enum DiagnosticKind {
    LEX_ERROR(Severity.ERROR),
    PARSE_ERROR(Severity.ERROR),
    SIZE_LIMIT_EXCEEDED(Severity.ERROR),
    UNSUPPORTED_EXTENSION(Severity.ERROR),
    AMBIGUITY_VIOLATION(Severity.ERROR),
    ORTHOGONALITY_VIOLATION(Severity.ERROR),
    DENSITY_TOO_LOW(Severity.ERROR),
    RULE_CONTRADICTION(Severity.ERROR),
    SMT_TIMEOUT(Severity.WARNING),
    /// Raised to `ERROR` when the unresolved property is safety-critical.
    SMT_UNKNOWN(Severity.WARNING),
    RULE_CONTINGENT(Severity.INFO),
    PROOF_UNSUPPORTED_CONSTRUCT(Severity.INFO),
    DIMENSION_EXCEEDED(Severity.WARNING),
    BINDING_BELOW_MINIMUM(Severity.INFO),
    INVARIANT(Severity.INFO);

    private final Severity severity;

    DiagnosticKind(Severity severity) {
        this.severity = severity;
    }

    public Severity severity() {
        return severity;
    }
}
