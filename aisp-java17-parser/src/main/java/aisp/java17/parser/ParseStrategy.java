package aisp.java17.parser;

/// Alternative readings of the same token stream, compared to measure ambiguity.
public enum ParseStrategy {
    /// Standard connective precedence; any error aborts the parse.
    STRICT,
    /// Binary logical connectives share one precedence and associate left, in reading order.
    PERMISSIVE,
    /// Strict precedence, but a statement that fails to parse is dropped and parsing resumes at
    /// the next statement separator.
    BACKTRACKING
}
