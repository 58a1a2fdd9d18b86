package aisp.java17.cli;

import aisp.java17.parser.AispAst.Block;
import aisp.java17.parser.AispAst.Document;
import aisp.java17.parser.AispLexer;
import aisp.java17.parser.AispParser;
import aisp.java17.parser.AstPrinter;
import aisp.java17.parser.LexException;
import aisp.java17.parser.ParseException;
import aisp.java17.parser.Token;
import aisp.java17.parser.TokenKind;
import aisp.java17.validator.AispValidator;
import aisp.java17.validator.Diagnostic;
import aisp.java17.validator.RuleVerdict;
import aisp.java17.validator.ValidationResult;
import aisp.java17.validator.ValidatorConfig;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import static aisp.java17.cli.CliLogging.LOG;

/// Command-line entry point.
///
/// Usage:
/// `java -jar aisp-java17-cli.jar validate rules.aisp --json`
///
/// Exit codes: 0 valid (or command done), 1 invalid document or unreadable file, 2 usage error.
public final class AispCli {
    static final int OK = 0;
    static final int INVALID = 1;
    static final int USAGE = 2;

    private AispCli() {}

    public static void main(String[] args) {
        final var out = new PrintWriter(System.out, true, StandardCharsets.UTF_8);
        final var err = new PrintWriter(System.err, true, StandardCharsets.UTF_8);
        System.exit(run(args, out, err));
    }

    static int run(String[] args, PrintWriter out, PrintWriter err) {
        return run(args, ValidatorConfig.fromSystemProperties(), out, err);
    }

    static int run(String[] args, ValidatorConfig base, PrintWriter out, PrintWriter err) {
        final CliOptions options;
        try {
            options = CliOptions.parse(args, base);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(CliOptions.USAGE);
            return USAGE;
        }
        try {
            LOG.info(() -> "Running " + options.command().name().toLowerCase(Locale.ROOT) + " on " + options.path());
            return switch (options.command()) {
                case VALIDATE -> validate(options, out);
                case TIER -> tier(options, out);
                case DENSITY -> density(options, out);
                case DEBUG -> debug(options, out, err);
            };
        } catch (IOException e) {
            err.println("cannot read " + options.path() + ": " + e.getMessage());
            return INVALID;
        } finally {
            out.flush();
            err.flush();
        }
    }

    private static ValidationResult check(CliOptions options) throws IOException {
        try (var validator = new AispValidator(options.config())) {
            final ValidationResult result = validator.validate(options.path());
            LOG.info(() -> "Validated " + options.path() + ": valid=" + result.valid() + " tier=" + result.tier()
                + " diagnostics=" + result.diagnostics().size());
            return result;
        }
    }

    private static int validate(CliOptions options, PrintWriter out) throws IOException {
        final ValidationResult result = check(options);
        if (options.json()) {
            out.println(new JsonReport().render(result));
        } else {
            printReport(options.path(), result, out);
        }
        return result.valid() ? OK : INVALID;
    }

    private static int tier(CliOptions options, PrintWriter out) throws IOException {
        final ValidationResult result = check(options);
        out.println(result.tier().glyph() + " " + result.tier().name());
        return OK;
    }

    private static int density(CliOptions options, PrintWriter out) throws IOException {
        final ValidationResult result = check(options);
        out.println(String.format(Locale.ROOT, "delta=%.3f pure_density=%.3f ambiguity=%.4f",
            result.delta(), result.pureDensity(), result.ambiguity()));
        return OK;
    }

    /// Prints the token stream and the parsed statements, or where lexing or parsing stopped.
    private static int debug(CliOptions options, PrintWriter out, PrintWriter err) throws IOException {
        final long size = Files.size(options.path());
        if (size > options.config().maxDocumentBytes()) {
            err.println("document is " + size + " bytes, limit is " + options.config().maxDocumentBytes());
            return INVALID;
        }
        final byte[] bytes = Files.readAllBytes(options.path());
        final List<Token> tokens;
        try {
            tokens = AispLexer.tokenize(bytes);
        } catch (LexException e) {
            err.println(e.getMessage());
            return INVALID;
        }
        out.println("tokens: " + tokens.size());
        for (Token t : tokens) {
            final String glyph = t.kind() == TokenKind.NEWLINE ? "\\n" : t.glyph();
            out.println(String.format(Locale.ROOT, "  %6d %-12s %s", t.byteOffset(), t.kind(), glyph));
        }
        final Document document;
        try {
            document = AispParser.parse(tokens);
        } catch (ParseException e) {
            err.println(e.getMessage());
            return INVALID;
        }
        out.println("statements: " + document.statements().size());
        for (Block block : document.blocks().values()) {
            for (int i = 0; i < block.statements().size(); i++) {
                out.println("  " + block.tag().label() + "#" + i + "  " + AstPrinter.render(block.statements().get(i)));
            }
        }
        return OK;
    }

    private static void printReport(Path path, ValidationResult result, PrintWriter out) {
        out.println(String.format(Locale.ROOT, "%s: %s  tier %s (%s)  δ=%.3f  ambiguity=%.4f",
            path.getFileName(), result.valid() ? "VALID" : "INVALID", result.tier().glyph(), result.tier().name(),
            result.delta(), result.ambiguity()));
        if (!result.ruleVerdicts().isEmpty()) {
            out.println("rules:");
            for (RuleVerdict r : result.ruleVerdicts()) {
                out.println(String.format(Locale.ROOT, "  %-10s %-9s %-17s %s", r.id(),
                    JsonReport.verdictName(r.verdict()), r.backend(), r.formula()));
            }
        }
        if (result.triVector() != null) {
            out.println(String.format(Locale.ROOT, "tri-vector: %s, %s (max |⟨a,b⟩| %.2e)",
                result.triVector().semanticSafety().rankArgument(),
                result.triVector().structuralSafety().rankArgument(),
                result.triVector().maxInnerProduct()));
        }
        if (!result.diagnostics().isEmpty()) {
            out.println("diagnostics:");
            for (Diagnostic d : result.diagnostics()) {
                out.println("  " + d.severity() + " " + d.kind() + " at " + d.location() + ": " + d.message());
            }
        }
    }
}
