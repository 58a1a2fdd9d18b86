package aisp.java17.cli;

import aisp.java17.logic.BackendKind;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CliOptionsTest extends CliTestBase {

    @Test
    void optionsMayAppearAnywhere() {
        final CliOptions o = CliOptions.parse(new String[] {
            "--timeout-ms=250", "validate", "--no-hybrid", "doc.aisp", "--json", "--backend=Z3", "--max-bytes=1024"
        }, builtin());
        assertThat(o.command()).isEqualTo(CliOptions.Command.VALIDATE);
        assertThat(o.path()).isEqualTo(Path.of("doc.aisp"));
        assertThat(o.json()).isTrue();
        assertThat(o.config().hybrid()).isFalse();
        assertThat(o.config().backend()).isEqualTo(BackendKind.Z3);
        assertThat(o.config().smtTimeout()).isEqualTo(Duration.ofMillis(250));
        assertThat(o.config().maxDocumentBytes()).isEqualTo(1024);
    }

    @Test
    void baseConfigIsKeptWithoutOptions() {
        final CliOptions o = CliOptions.parse(new String[] {"TIER", "doc.md"}, builtin());
        assertThat(o.command()).isEqualTo(CliOptions.Command.TIER);
        assertThat(o.config()).isEqualTo(builtin());
    }

    @Test
    void rejectsMalformedCommandLines() {
        assertThatThrownBy(() -> CliOptions.parse(new String[] {"tier", "a.aisp", "--json"}, builtin()))
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("validate only");
        assertThatThrownBy(() -> CliOptions.parse(new String[] {"validate", "a.aisp", "b.aisp"}, builtin()))
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("unexpected argument");
        assertThatThrownBy(() -> CliOptions.parse(new String[] {"validate", "a.aisp", "--timeout-ms=soon"}, builtin()))
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("not a number");
        assertThatThrownBy(() -> CliOptions.parse(new String[] {"validate", "a.aisp", "--verbose"}, builtin()))
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("unknown option");
        assertThatThrownBy(() -> CliOptions.parse(new String[] {"validate", "a.aisp", "--timeout-ms=0"}, builtin()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
