package aisp.java17.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class AispCliTest extends CliTestBase {

    @TempDir
    Path dir;

    @Test
    void validDocumentExitsZero() {
        final Path file = fixtureFile(dir, "platinum.aisp", "game.aisp");
        final Run run = cli("validate", file.toString());
        assertThat(run.exitCode()).isEqualTo(AispCli.OK);
        assertThat(run.out()).startsWith("game.aisp: VALID").contains("◊⁺⁺ (PLATINUM)").contains("Rules#0");
    }

    @Test
    void invalidDocumentExitsOne() {
        final Path file = fixtureFile(dir, "missing-evidence.aisp", "broken.aisp");
        final Run run = cli("validate", file.toString());
        assertThat(run.exitCode()).isEqualTo(AispCli.INVALID);
        assertThat(run.out()).contains("INVALID").contains("PARSE_ERROR").contains("MISSING_REQUIRED_BLOCK");
    }

    @Test
    void jsonReportCarriesEveryField() throws Exception {
        final Path file = fixtureFile(dir, "ambiguous.aisp", "ambiguous.aisp");
        final Run run = cli("validate", file.toString(), "--json", "--backend=builtin");
        assertThat(run.exitCode()).isEqualTo(AispCli.INVALID);
        final JsonNode json = new ObjectMapper().readTree(run.out());
        assertThat(json.get("valid").asBoolean()).isFalse();
        assertThat(json.get("tier").asText()).isEqualTo("◊⁺⁺");
        assertThat(json.get("ambiguity").asDouble()).isGreaterThanOrEqualTo(0.02);
        assertThat(json.has("pure_density")).isTrue();
        assertThat(json.get("rules").get(0).fieldNames()).toIterable()
            .containsExactly("id", "block", "formula", "verdict", "backend", "reason");
        assertThat(json.get("invariants").get(0).has("confidence")).isTrue();
        assertThat(json.get("tri_vector").get("semantic_safety_dim").asInt()).isZero();
        assertThat(json.get("diagnostics").findValuesAsText("kind")).contains("AMBIGUITY_VIOLATION");
    }

    @Test
    void tierAndDensityPrintOneLine() {
        final Path file = fixtureFile(dir, "platinum.aisp", "game.aisp");
        assertThat(cli("tier", file.toString()).out().strip()).isEqualTo("◊⁺⁺ PLATINUM");
        final Run density = cli("density", file.toString(), "--no-hybrid");
        assertThat(density.exitCode()).isEqualTo(AispCli.OK);
        assertThat(density.out().strip()).startsWith("delta=1.000 pure_density=").endsWith("ambiguity=0.0000");
    }

    @Test
    void debugListsTokensAndStatements() {
        final Path file = fixtureFile(dir, "platinum.aisp", "game.aisp");
        final Run run = cli("debug", file.toString());
        assertThat(run.exitCode()).isEqualTo(AispCli.OK);
        assertThat(run.out()).contains("tokens: ").contains("statements: 23").contains("Rules#6");
    }

    @Test
    void debugReportsWhereParsingStopped() {
        final Path file = fixtureFile(dir, "missing-evidence.aisp", "broken.aisp");
        final Run run = cli("debug", file.toString());
        assertThat(run.exitCode()).isEqualTo(AispCli.INVALID);
        assertThat(run.out()).contains("tokens: ");
        assertThat(run.err()).contains("MISSING_REQUIRED_BLOCK");
    }

    @Test
    void sizeLimitOptionApplies() {
        final Path file = fixtureFile(dir, "platinum.aisp", "game.aisp");
        final Run run = cli("validate", file.toString(), "--max-bytes=64");
        assertThat(run.exitCode()).isEqualTo(AispCli.INVALID);
        assertThat(run.out()).contains("SIZE_LIMIT_EXCEEDED");
    }

    @Test
    void usageErrorsExitTwo() {
        assertThat(cli().exitCode()).isEqualTo(AispCli.USAGE);
        assertThat(cli("prove", "x.aisp").err()).contains("unknown command prove").contains("Usage:");
        assertThat(cli("validate").exitCode()).isEqualTo(AispCli.USAGE);
        assertThat(cli("validate", "x.aisp", "--backend=cvc5").exitCode()).isEqualTo(AispCli.USAGE);
        assertThat(cli("validate", "x.aisp", "--max-bytes=2000000").err()).contains("maxDocumentBytes");
    }

    @Test
    void missingFileExitsOne() {
        final Run run = cli("validate", dir.resolve("absent.aisp").toString());
        assertThat(run.exitCode()).isEqualTo(AispCli.INVALID);
        assertThat(run.err()).startsWith("cannot read");
    }
}
