package aisp.java17.parser;

import aisp.java17.parser.AispAst.Statement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AstPrinterTest extends ParserTestBase {

    @Test
    void layoutDoesNotChangeTheFingerprint() {
        final Statement compact = rule("∀m:Index:(m≥0∧m≤8)⇒m∈Index");
        final Statement spaced = rule("∀m : Index : ( m ≥ 0 ∧ m ≤ 8 ) ⇒ m ∈ Index");
        assertThat(AstPrinter.fingerprint(compact)).isEqualTo(AstPrinter.fingerprint(spaced));
    }

    @Test
    void numbersAreNormalised() {
        assertThat(AstPrinter.render(rule("x≥1.50"))).isEqualTo(AstPrinter.render(rule("x≥1.5")));
    }

    @Test
    void differentGroupingChangesTheFingerprint() {
        assertThat(AstPrinter.fingerprint(rule("(A⇒B)∧C"))).isNotEqualTo(AstPrinter.fingerprint(rule("A⇒B∧C")));
    }

    @Test
    void rendersQuantifiersLambdasAndPowers() {
        assertThat(AstPrinter.render(rule("∀x∈S:x≥0"))).isEqualTo("∀x∈S.(x≥0)");
        assertThat(AstPrinter.render(rule("f≜λa.a+1"))).isEqualTo("f≜λa.(a+1)");
        assertThat(AstPrinter.render(rule("V≜ℝ²"))).isEqualTo("V≜ℝ^2");
        assertThat(AstPrinter.render(rule("s≜\"a\\\"b\""))).isEqualTo("s≜\"a\\\"b\"");
    }

    @Test
    void fingerprintIsLowerCaseHexSha256() {
        final String fp = AstPrinter.fingerprint(rule("x≥0"));
        assertThat(fp).hasSize(64).matches("[0-9a-f]+");
        assertThat(fp).isEqualTo(Sha256.hex("(x≥0)"));
    }

    @Test
    void seedIsStableForEqualText() {
        assertThat(Sha256.seed("(x≥0)")).isEqualTo(Sha256.seed("(x≥0)"));
        assertThat(Sha256.seed("(x≥0)")).isNotEqualTo(Sha256.seed("(x≥1)"));
    }

    private static Statement rule(String text) {
        final List<Statement> rules = AispParser.parse(withRules(text)).block(BlockTag.RULES).statements();
        return rules.get(0);
    }
}
