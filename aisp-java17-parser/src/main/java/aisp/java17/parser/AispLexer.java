package aisp.java17.parser;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static aisp.java17.parser.ParserLogging.LOG;

/// Converts UTF-8 document bytes into classified [Token]s.
///
/// Lexing rules:
/// - registry glyphs become one `SYMBOL` or `SUPERSCRIPT` token each
/// - ASCII letters, digits and `_` form identifiers; digits with an optional fraction form numbers
/// - other ASCII characters are single-character punctuation, except `//` which starts a comment
/// - runs of unregistered non-ASCII characters become one `PROSE` token
/// - newlines are kept, all other whitespace is dropped
///
/// Adversarial input (bidi controls, zero-width characters, confusable glyphs) is rejected with
/// [LexException.Kind#ADVERSARIAL_INPUT] rather than being silently accepted.
public final class AispLexer {

    private final String text;
    private final List<Token> tokens = new ArrayList<>();
    private int index;
    private int byteOffset;

    private AispLexer(String text, int startByteOffset) {
        this.text = text;
        this.byteOffset = startByteOffset;
    }

    /// Tokenizes raw document bytes.
    /// @throws LexException for malformed UTF-8 or adversarial input
    public static List<Token> tokenize(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        String text = decode(bytes);
        int start = 0;
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
            start = 3;
        }
        final var lexer = new AispLexer(text, start);
        lexer.run();
        LOG.fine(() -> "Tokenized " + bytes.length + " bytes into " + lexer.tokens.size() + " tokens");
        return List.copyOf(lexer.tokens);
    }

    /// Tokenizes a document held as a string.
    public static List<Token> tokenize(String text) {
        Objects.requireNonNull(text, "text must not be null");
        return tokenize(text.getBytes(StandardCharsets.UTF_8));
    }

    private static String decode(byte[] bytes) {
        final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        final ByteBuffer in = ByteBuffer.wrap(bytes);
        final CharBuffer out = CharBuffer.allocate(bytes.length + 1);
        final CoderResult result = decoder.decode(in, out, true);
        if (result.isError()) {
            throw new LexException(LexException.Kind.MALFORMED_INPUT, "invalid UTF-8 sequence", in.position());
        }
        final CoderResult flush = decoder.flush(out);
        if (flush.isError()) {
            throw new LexException(LexException.Kind.MALFORMED_INPUT, "truncated UTF-8 sequence", in.position());
        }
        out.flip();
        return out.toString();
    }

    private void run() {
        while (index < text.length()) {
            final int cp = text.codePointAt(index);
            screen(cp);
            if (cp == '\n') {
                emit(TokenKind.NEWLINE, "\n");
                advance(cp);
            } else if (Character.isWhitespace(cp) || Character.isSpaceChar(cp)) {
                advance(cp);
            } else if (cp == '/' && peekChar(1) == '/') {
                skipComment();
            } else if (cp == '"') {
                lexString();
            } else if (isIdentStart(cp)) {
                lexWhile(TokenKind.IDENTIFIER, AispLexer::isIdentPart);
            } else if (cp >= '0' && cp <= '9') {
                lexNumber();
            } else if (SymbolTable.isRegistered(cp)) {
                final var entry = SymbolTable.lookup(cp);
                tokens.add(new Token(TokenKind.of(entry), entry.glyph(), byteOffset, entry.category(), entry.role()));
                advance(cp);
            } else if (cp < 0x80) {
                emit(TokenKind.PUNCTUATION, String.valueOf((char) cp));
                advance(cp);
            } else {
                lexProse();
            }
        }
    }

    private void screen(int cp) {
        if (SymbolTable.isBidiControl(cp)) {
            throw new LexException(LexException.Kind.ADVERSARIAL_INPUT,
                String.format("bidirectional control U+%04X", cp), byteOffset);
        }
        if (SymbolTable.isZeroWidth(cp)) {
            final boolean inIdentifier = index > 0 && isIdentPart(text.codePointBefore(index));
            throw new LexException(LexException.Kind.ADVERSARIAL_INPUT,
                String.format("zero-width character U+%04X%s", cp, inIdentifier ? " inside identifier" : ""), byteOffset);
        }
        final String imitated = SymbolTable.confusableFor(cp);
        if (imitated != null) {
            throw new LexException(LexException.Kind.ADVERSARIAL_INPUT,
                String.format("confusable glyph U+%04X imitates %s", cp, imitated), byteOffset);
        }
    }

    private void lexWhile(TokenKind kind, java.util.function.IntPredicate part) {
        final int startIndex = index;
        final int startOffset = byteOffset;
        while (index < text.length()) {
            final int cp = text.codePointAt(index);
            if (!part.test(cp)) {
                break;
            }
            advance(cp);
        }
        tokens.add(Token.plain(kind, text.substring(startIndex, index), startOffset));
    }

    private void lexNumber() {
        final int startIndex = index;
        final int startOffset = byteOffset;
        consumeDigits();
        if (peekChar(0) == '.' && isDigit(peekChar(1))) {
            advance('.');
            consumeDigits();
        }
        tokens.add(Token.plain(TokenKind.NUMBER, text.substring(startIndex, index), startOffset));
    }

    private void consumeDigits() {
        while (index < text.length() && isDigit(text.charAt(index))) {
            advance(text.charAt(index));
        }
    }

    private void lexString() {
        final int startOffset = byteOffset;
        advance('"');
        final var sb = new StringBuilder();
        while (true) {
            if (index >= text.length()) {
                throw new LexException(LexException.Kind.UNTERMINATED_STRING, "string literal not closed", startOffset);
            }
            final int cp = text.codePointAt(index);
            screen(cp);
            advance(cp);
            if (cp == '"') {
                break;
            }
            if (cp == '\\' && index < text.length()) {
                final int escaped = text.codePointAt(index);
                advance(escaped);
                sb.appendCodePoint(escaped);
                continue;
            }
            sb.appendCodePoint(cp);
        }
        tokens.add(Token.plain(TokenKind.STRING, sb.toString(), startOffset));
    }

    private void lexProse() {
        lexWhile(TokenKind.PROSE, cp -> cp >= 0x80
            && !SymbolTable.isRegistered(cp)
            && !Character.isWhitespace(cp)
            && !Character.isSpaceChar(cp)
            && !SymbolTable.isBidiControl(cp)
            && !SymbolTable.isZeroWidth(cp)
            && SymbolTable.confusableFor(cp) == null);
    }

    private void skipComment() {
        while (index < text.length() && text.charAt(index) != '\n') {
            final int cp = text.codePointAt(index);
            screen(cp);
            advance(cp);
        }
    }

    private void emit(TokenKind kind, String glyph) {
        tokens.add(Token.plain(kind, glyph, byteOffset));
    }

    private void advance(int cp) {
        index += Character.charCount(cp);
        byteOffset += utf8Length(cp);
    }

    private char peekChar(int ahead) {
        final int i = index + ahead;
        return i < text.length() ? text.charAt(i) : '\0';
    }

    static int utf8Length(int cp) {
        if (cp < 0x80) return 1;
        if (cp < 0x800) return 2;
        if (cp < 0x10000) return 3;
        return 4;
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentStart(int cp) {
        return (cp >= 'a' && cp <= 'z') || (cp >= 'A' && cp <= 'Z') || cp == '_';
    }

    private static boolean isIdentPart(int cp) {
        return isIdentStart(cp) || isDigit(cp);
    }
}
