package aisp.java17.parser;

/// Lexical class of a [Token].
public enum TokenKind {
    SYMBOL,
    SUPERSCRIPT,
    IDENTIFIER,
    NUMBER,
    PUNCTUATION,
    STRING,
    PROSE,
    NEWLINE;

    /// The single token kind a registry entry lexes to.
    static TokenKind of(SymbolTable.Entry entry) {
        return entry.superscript() ? SUPERSCRIPT : SYMBOL;
    }
}
