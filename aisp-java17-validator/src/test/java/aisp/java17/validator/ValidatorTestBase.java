package aisp.java17.validator;

import aisp.java17.logic.BackendKind;
import aisp.java17.parser.AispLexer;
import aisp.java17.parser.Token;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.logging.Logger;

/// Base class for validator tests.
/// - Emits an INFO banner per test.
/// - Loads fixture documents and builds a validator on the builtin solver.
public class ValidatorTestBase extends ValidatorLoggingConfig {

    static final Logger LOG = Logger.getLogger("aisp.java17.validator");

    @BeforeEach
    void announce(TestInfo testInfo) {
        final String cls = testInfo.getTestClass().map(Class::getSimpleName).orElse("UnknownTest");
        final String name = testInfo.getTestMethod().map(java.lang.reflect.Method::getName)
                .orElseGet(testInfo::getDisplayName);
        LOG.info(() -> "TEST: " + cls + "#" + name);
    }

    static String fixture(String name) {
        try (InputStream in = ValidatorTestBase.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("missing fixture " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static List<Token> tokens(String fixture) {
        return AispLexer.tokenize(fixture(fixture));
    }

    /// Settings that do not depend on a solver being installed.
    static ValidatorConfig builtin() {
        return ValidatorConfig.defaults()
            .withBackend(BackendKind.BUILTIN)
            .withSmtConcurrency(2)
            .withSmtTimeout(Duration.ofSeconds(10));
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
