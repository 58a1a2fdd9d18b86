package aisp.java17.validator;

/// How much a [Diagnostic] matters. Any `ERROR` makes the document invalid.
public enum Severity {
    ERROR,
    WARNING,
    INFO
}
