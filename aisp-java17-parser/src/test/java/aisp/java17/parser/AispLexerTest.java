package aisp.java17.parser;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.Chars;
import net.jqwik.api.constraints.StringLength;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AispLexerTest extends ParserTestBase {

    @Test
    void classifiesSymbolsIdentifiersAndNumbers() {
        final List<Token> tokens = AispLexer.tokenize("∀x:ℕ.x≥0");
        assertThat(tokens).extracting(Token::kind).containsExactly(
            TokenKind.SYMBOL, TokenKind.IDENTIFIER, TokenKind.PUNCTUATION, TokenKind.SYMBOL,
            TokenKind.PUNCTUATION, TokenKind.IDENTIFIER, TokenKind.SYMBOL, TokenKind.NUMBER);
        assertThat(tokens).extracting(Token::glyph).containsExactly("∀", "x", ":", "ℕ", ".", "x", "≥", "0");
    }

    @Test
    void byteOffsetsCountUtf8Bytes() {
        final List<Token> tokens = AispLexer.tokenize("∀x");
        assertThat(tokens.get(0).byteOffset()).isEqualTo(0);
        assertThat(tokens.get(1).byteOffset()).isEqualTo(3);

        final List<Token> astral = AispLexer.tokenize("𝔸1");
        assertThat(astral.get(1).byteOffset()).isEqualTo(4);
    }

    @Test
    void decimalNumbersAreSingleTokens() {
        final List<Token> tokens = AispLexer.tokenize("δ≜0.75");
        assertThat(tokens).extracting(Token::glyph).containsExactly("δ", "≜", "0.75");
        assertThat(tokens.get(0).role()).isEqualTo(SymbolRole.GREEK);
    }

    @Test
    void superscriptsLexSeparately() {
        final List<Token> tokens = AispLexer.tokenize("◊⁺⁺");
        assertThat(tokens).extracting(Token::kind)
            .containsExactly(TokenKind.SYMBOL, TokenKind.SUPERSCRIPT, TokenKind.SUPERSCRIPT);
    }

    @Test
    void newlinesAreKeptAndCommentsDropped() {
        final List<Token> tokens = AispLexer.tokenize("a // note\nb");
        assertThat(tokens).extracting(Token::glyph).containsExactly("a", "\n", "b");
    }

    @Test
    void unregisteredTextIsProse() {
        final List<Token> tokens = AispLexer.tokenize("naïve");
        assertThat(tokens).extracting(Token::kind)
            .containsExactly(TokenKind.IDENTIFIER, TokenKind.PROSE, TokenKind.IDENTIFIER);
        assertThat(tokens.get(1).category()).isEqualTo(SymbolCategory.PROSE);
    }

    @Test
    void stringLiteralsKeepContent() {
        final List<Token> tokens = AispLexer.tokenize("\"verifiable play\"");
        assertThat(tokens).singleElement().satisfies(t -> {
            assertThat(t.kind()).isEqualTo(TokenKind.STRING);
            assertThat(t.glyph()).isEqualTo("verifiable play");
        });
    }

    @Test
    void unterminatedStringIsRejected() {
        assertThatThrownBy(() -> AispLexer.tokenize("\"open"))
            .isInstanceOf(LexException.class)
            .extracting(e -> ((LexException) e).kind())
            .isEqualTo(LexException.Kind.UNTERMINATED_STRING);
    }

    @ParameterizedTest
    @ValueSource(strings = {"a\u202Eb", "x\u2066y", "a\u200Fb"})
    void bidiControlsAreAdversarial(String input) {
        assertThatThrownBy(() -> AispLexer.tokenize(input))
            .isInstanceOf(LexException.class)
            .satisfies(e -> {
                final var lex = (LexException) e;
                assertThat(lex.kind()).isEqualTo(LexException.Kind.ADVERSARIAL_INPUT);
                assertThat(lex.byteOffset()).isEqualTo(1);
            });
    }

    @Test
    void zeroWidthJoinerInsideIdentifierIsAdversarial() {
        assertThatThrownBy(() -> AispLexer.tokenize("Pla\u200Dyer≜ℕ"))
            .isInstanceOf(LexException.class)
            .hasMessageContaining("inside identifier")
            .extracting(e -> ((LexException) e).byteOffset())
            .isEqualTo(3);
    }

    @ParameterizedTest
    @ValueSource(strings = {"\u2126", "\u2206", "\u2C6F", "\u018E", "\u03F5", "\u301A", "\u2329", "\u0413"})
    void confusablesAreAdversarial(String glyph) {
        assertThatThrownBy(() -> AispLexer.tokenize("x" + glyph + "y"))
            .isInstanceOf(LexException.class)
            .hasMessageContaining("confusable");
    }

    @Test
    void leadingByteOrderMarkIsAllowed() {
        final byte[] bom = "\uFEFFx".getBytes(StandardCharsets.UTF_8);
        final List<Token> tokens = AispLexer.tokenize(bom);
        assertThat(tokens).singleElement().satisfies(t -> assertThat(t.byteOffset()).isEqualTo(3));
    }

    @Test
    void malformedUtf8IsRejectedWithOffset() {
        final byte[] bytes = {'a', 'b', (byte) 0xC3, (byte) 0x28};
        assertThatThrownBy(() -> AispLexer.tokenize(bytes))
            .isInstanceOf(LexException.class)
            .satisfies(e -> {
                final var lex = (LexException) e;
                assertThat(lex.kind()).isEqualTo(LexException.Kind.MALFORMED_INPUT);
                assertThat(lex.byteOffset()).isEqualTo(2);
            });
    }

    @Property(tries = 200)
    void offsetsIncreaseWithinTheInput(
            @ForAll @Chars({'a', 'x', '0', '7', ' ', '\n', '.', ':', '∀', '≜', '≥', 'ℕ', '⇒'}) @StringLength(max = 40)
            String text) {
        final int length = text.getBytes(StandardCharsets.UTF_8).length;
        int previous = -1;
        for (Token t : AispLexer.tokenize(text)) {
            assertThat(t.byteOffset()).isGreaterThan(previous).isLessThan(length);
            previous = t.byteOffset();
        }
    }
}
