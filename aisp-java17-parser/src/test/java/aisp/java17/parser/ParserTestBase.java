package aisp.java17.parser;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;

/// Base class for parser tests.
/// - Emits an INFO banner per test.
/// - Loads fixture documents from `src/test/resources/fixtures`.
public class ParserTestBase extends ParserLoggingConfig {

    static final Logger LOG = Logger.getLogger("aisp.java17.parser");

    @BeforeEach
    void announce(TestInfo testInfo) {
        final String cls = testInfo.getTestClass().map(Class::getSimpleName).orElse("UnknownTest");
        final String name = testInfo.getTestMethod().map(java.lang.reflect.Method::getName)
                .orElseGet(testInfo::getDisplayName);
        LOG.info(() -> "TEST: " + cls + "#" + name);
    }

    static String fixture(String name) {
        try (InputStream in = ParserTestBase.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("missing fixture " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /// A minimal document with all five required blocks; `rules` is the Rules block body.
    static String withRules(String rules) {
        return """
            𝔸5.1.sample@2026-01-16
            ⟦Ω:Meta⟧{ Vision≜"sample" }
            ⟦Σ:Types⟧{ Index≜ℕ }
            ⟦Γ:Rules⟧{ %s }
            ⟦Λ:Funcs⟧{ next≜λi.i+1 }
            ⟦Ε⟧⟨δ≜0.75;τ≜◊⁺⁺⟩
            """.formatted(rules);
    }
}
