package aisp.java17.cli;

import aisp.java17.logic.BackendKind;
import aisp.java17.validator.ValidatorConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.logging.Logger;

/// Base class for CLI tests: per-test INFO banner, fixture files and captured output.
public class CliTestBase extends CliLoggingConfig {

    static final Logger LOG = Logger.getLogger("aisp.java17.cli");

    @BeforeEach
    void announce(TestInfo testInfo) {
        final String cls = testInfo.getTestClass().map(Class::getSimpleName).orElse("UnknownTest");
        final String name = testInfo.getTestMethod().map(java.lang.reflect.Method::getName)
                .orElseGet(testInfo::getDisplayName);
        LOG.info(() -> "TEST: " + cls + "#" + name);
    }

    static ValidatorConfig builtin() {
        return ValidatorConfig.defaults()
            .withBackend(BackendKind.BUILTIN)
            .withSmtConcurrency(2)
            .withSmtTimeout(Duration.ofSeconds(10));
    }

    /// Copies a fixture into `dir` under `fileName`.
    static Path fixtureFile(Path dir, String fixture, String fileName) {
        try (InputStream in = CliTestBase.class.getResourceAsStream("/fixtures/" + fixture)) {
            if (in == null) {
                throw new IllegalArgumentException("missing fixture " + fixture);
            }
            final Path file = dir.resolve(fileName);
            Files.write(file, in.readAllBytes());
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /// Output of one CLI run.
    record Run(int exitCode, String out, String err) {}

    static Run cli(String... args) {
        final var out = new StringWriter();
        final var err = new StringWriter();
        final int code = AispCli.run(args, builtin(), new PrintWriter(out, true), new PrintWriter(err, true));
        return new Run(code, out.toString(), err.toString());
    }
}
