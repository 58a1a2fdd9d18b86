package aisp.java17.parser;

import java.util.Objects;

/// A classified lexeme with the UTF-8 byte offset of its first byte.
public record Token(TokenKind kind, String glyph, int byteOffset, SymbolCategory category, SymbolRole role) {

    public Token {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(glyph, "glyph must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(role, "role must not be null");
        if (byteOffset < 0) {
            throw new IllegalArgumentException("byteOffset must be >= 0");
        }
    }

    static Token plain(TokenKind kind, String glyph, int byteOffset) {
        return new Token(kind, glyph, byteOffset, kind == TokenKind.PROSE ? SymbolCategory.PROSE : SymbolCategory.NONE, SymbolRole.NONE);
    }

    /// True when this token is a registry glyph.
    public boolean isSymbol() {
        return kind == TokenKind.SYMBOL || kind == TokenKind.SUPERSCRIPT;
    }

    boolean is(String text) {
        return glyph.equals(text);
    }

    boolean isPunct(char c) {
        return kind == TokenKind.PUNCTUATION && glyph.length() == 1 && glyph.charAt(0) == c;
    }

    @Override
    public String toString() {
        return kind + "(" + glyph + ")@" + byteOffset;
    }
}
