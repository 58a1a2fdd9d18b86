package aisp.java17.validator;

import aisp.java17.logic.BackendKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidatorConfigTest extends ValidatorTestBase {

    @Test
    void defaultsAreUsable() {
        final ValidatorConfig c = ValidatorConfig.defaults();
        assertThat(c.maxDocumentBytes()).isEqualTo(64 * 1024);
        assertThat(c.backend()).isEqualTo(BackendKind.AUTO);
        assertThat(c.hybrid()).isTrue();
        assertThat(c.ambiguityThreshold()).isEqualTo(0.02);
        assertThat(c.triVectorSmtFallback()).isFalse();
        assertThat(c.engineConfig().timeout()).isEqualTo(c.smtTimeout());
    }

    @Test
    void documentLimitHasACeiling() {
        assertThat(ValidatorConfig.defaults().withMaxDocumentBytes(ValidatorConfig.MAX_DOCUMENT_BYTES_CEILING)
            .maxDocumentBytes()).isEqualTo(1024 * 1024);
        assertThatThrownBy(() -> ValidatorConfig.defaults()
            .withMaxDocumentBytes(ValidatorConfig.MAX_DOCUMENT_BYTES_CEILING + 1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxDocumentBytes");
    }

    @Test
    void rejectsOutOfRangeSettings() {
        final ValidatorConfig c = ValidatorConfig.defaults();
        assertThatThrownBy(() -> c.withSmtTimeout(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> c.withSmtConcurrency(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> c.withAmbiguityThreshold(0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> c.withOrthogonalityTolerance(1.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> c.withZ3Executable(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void propertiesOverlayTheDefaults() {
        final var props = new Properties();
        props.setProperty("aisp.maxDocumentBytes", "4096");
        props.setProperty("aisp.smt.timeoutMillis", "1500");
        props.setProperty("aisp.smt.backend", "builtin");
        props.setProperty("aisp.hybrid", "false");
        props.setProperty("aisp.trivector.smtFallback", "TRUE");
        final ValidatorConfig c = ValidatorConfig.fromProperties(props);
        assertThat(c.maxDocumentBytes()).isEqualTo(4096);
        assertThat(c.smtTimeout()).isEqualTo(Duration.ofMillis(1500));
        assertThat(c.backend()).isEqualTo(BackendKind.BUILTIN);
        assertThat(c.hybrid()).isFalse();
        assertThat(c.triVectorSmtFallback()).isTrue();
        assertThat(c.z3Executable()).isEqualTo("z3");
    }

    @Test
    void unparseableValuesKeepTheDefault() {
        final var props = new Properties();
        props.setProperty("aisp.smt.concurrency", "many");
        props.setProperty("aisp.smt.backend", "cvc5");
        props.setProperty("aisp.hybrid", "yes");
        final ValidatorConfig c = ValidatorConfig.fromProperties(props);
        assertThat(c.smtConcurrency()).isEqualTo(ValidatorConfig.defaults().smtConcurrency());
        assertThat(c.backend()).isEqualTo(BackendKind.AUTO);
        assertThat(c.hybrid()).isTrue();
    }

    @Test
    void parseableButInvalidValuesAreRejected() {
        final var props = new Properties();
        props.setProperty("aisp.maxDocumentBytes", "-1");
        assertThatThrownBy(() -> ValidatorConfig.fromProperties(props))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
