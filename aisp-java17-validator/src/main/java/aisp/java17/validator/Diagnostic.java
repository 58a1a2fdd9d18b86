package aisp.java17.validator;

import java.util.Objects;

/// A single located finding of a validation run.
public record Diagnostic(DiagnosticKind kind, Severity severity, Location location, String message) {

    public Diagnostic {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(location, "location must not be null");
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("Diagnostic message cannot be null or empty");
        }
    }

    /// A diagnostic with the kind's usual severity.
    public static Diagnostic of(DiagnosticKind kind, Location location, String message) {
        return new Diagnostic(kind, kind.severity(), location, message);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return severity + " " + kind + " at " + location + ": " + message;
    }
}
