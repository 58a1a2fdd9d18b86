package aisp.java17.validator;

import aisp.java17.logic.Deadline;
import aisp.java17.logic.FormulaTranslator;
import aisp.java17.logic.Formulas;
import aisp.java17.logic.HybridVerifier;
import aisp.java17.logic.Invariant;
import aisp.java17.logic.InvariantDiscovery;
import aisp.java17.logic.NaturalDeductionProver;
import aisp.java17.logic.SmtEngine;
import aisp.java17.logic.StructuredLog;
import aisp.java17.logic.TranslatedRule;
import aisp.java17.logic.Translation;
import aisp.java17.logic.UnknownReason;
import aisp.java17.logic.Verdict;
import aisp.java17.parser.AispAst.Document;
import aisp.java17.parser.AispLexer;
import aisp.java17.parser.AispParser;
import aisp.java17.parser.LexException;
import aisp.java17.parser.ParseException;
import aisp.java17.parser.ParseStrategy;
import aisp.java17.parser.Token;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import static aisp.java17.validator.ValidatorLogging.LOG;

/// Validates AISP documents: parse, score density and ambiguity, discover invariants,
/// check tri-vector isolation and prove the rules.
///
/// Thread-safe; one instance may validate many documents at once. Close it to stop the
/// worker pools.
public final class AispValidator implements AutoCloseable {

    /// File extensions accepted by [#validate(Path)].
    public static final Set<String> EXTENSIONS = Set.of(".aisp", ".aisp5", ".md", ".txt", ".spec");

    private final ValidatorConfig config;
    private final SmtEngine engine;
    private final HybridVerifier hybrid;
    private final TriVectorVerifier triVector;
    private final ExecutorService stages;

    public AispValidator() {
        this(ValidatorConfig.defaults());
    }

    public AispValidator(ValidatorConfig config) {
        this(config, new SmtEngine(config.engineConfig()));
    }

    /// Uses `engine` for every SMT query and closes it on [#close()].
    AispValidator(ValidatorConfig config, SmtEngine engine) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.hybrid = config.hybrid()
            ? new HybridVerifier(engine, new NaturalDeductionProver(config.proofStepLimit()))
            : null;
        this.triVector = new TriVectorVerifier(config, engine);
        this.stages = Executors.newFixedThreadPool(Math.max(2, config.smtConcurrency()), daemonThreads());
    }

    public ValidatorConfig config() {
        return config;
    }

    public SmtEngine engine() {
        return engine;
    }

    /// Validates a file after checking its extension and size.
    /// @throws IOException if the file cannot be read
    public ValidationResult validate(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        final String name = path.getFileName() == null ? "" : path.getFileName().toString();
        if (!hasSupportedExtension(name)) {
            return ValidationResult.rejected(Diagnostic.of(DiagnosticKind.UNSUPPORTED_EXTENSION, Location.nowhere(),
                "unsupported file extension '" + name + "', expected one of " + EXTENSIONS.stream().sorted().toList()));
        }
        final long size = Files.size(path);
        if (size > config.maxDocumentBytes()) {
            return ValidationResult.rejected(Diagnostics.of(new SizeLimitExceededException(size, config.maxDocumentBytes())));
        }
        return validate(Files.readAllBytes(path));
    }

    public ValidationResult validate(String text) {
        Objects.requireNonNull(text, "text must not be null");
        return validate(text.getBytes(StandardCharsets.UTF_8));
    }

    public ValidationResult validate(byte[] bytes) {
        return validate(bytes, Deadline.none());
    }

    /// Validates UTF-8 document bytes. Every SMT query also respects `deadline`.
    public ValidationResult validate(byte[] bytes, Deadline deadline) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        Objects.requireNonNull(deadline, "deadline must not be null");
        final long started = System.nanoTime();
        final List<Token> tokens;
        final Document document;
        try {
            requireWithinLimit(bytes.length);
            tokens = AispLexer.tokenize(bytes);
            document = AispParser.parse(tokens, ParseStrategy.STRICT);
        } catch (SizeLimitExceededException e) {
            return reject(Diagnostics.of(e));
        } catch (LexException e) {
            return reject(Diagnostics.of(e));
        } catch (ParseException e) {
            return reject(Diagnostics.of(e));
        }

        final var diagnostics = new ArrayList<Diagnostic>();
        final DensityMetrics density = DensityAnalyzer.analyze(tokens);
        final AmbiguityReport ambiguity = AmbiguityAnalyzer.analyze(tokens);
        if (density.delta() + QualityTier.TOLERANCE < QualityTier.BRONZE.threshold()) {
            diagnostics.add(Diagnostic.of(DiagnosticKind.DENSITY_TOO_LOW, Location.nowhere(),
                String.format(Locale.ROOT, "δ=%.3f is below the Bronze threshold %.2f",
                    density.delta(), QualityTier.BRONZE.threshold())));
        }
        diagnostics.addAll(DensityAnalyzer.belowMinimum(density));
        if (ambiguity.ambiguity() >= config.ambiguityThreshold()) {
            diagnostics.add(Diagnostic.of(DiagnosticKind.AMBIGUITY_VIOLATION, Location.nowhere(),
                String.format(Locale.ROOT, "ambiguity %.4f reaches the limit %.2f; read differently: %s",
                    ambiguity.ambiguity(), config.ambiguityThreshold(), String.join(", ", ambiguity.divergent()))));
        }

        final List<Invariant> invariants = InvariantDiscovery.discover(document);

        final CompletableFuture<TriVectorResult> isolation =
            CompletableFuture.supplyAsync(() -> triVector.verify(document, deadline), stages);
        final CompletableFuture<Translation> translated =
            CompletableFuture.supplyAsync(() -> FormulaTranslator.translate(document, invariants), stages);
        final TriVectorResult vectors = isolation.join();
        final Translation translation = translated.join();
        diagnostics.addAll(vectors.diagnostics());
        translation.failures().forEach(f -> diagnostics.add(Diagnostics.of(f)));

        final List<RuleVerdict> verdicts = verifyRules(translation.rules(), deadline, diagnostics);
        for (Invariant inv : invariants) {
            diagnostics.add(Diagnostic.of(DiagnosticKind.INVARIANT, Location.in(inv.block(), inv.byteOffset()),
                String.format(Locale.ROOT, "%s %s (confidence %.2f)", inv.kind(), inv.description(), inv.confidence())));
        }

        final boolean valid = diagnostics.stream().noneMatch(Diagnostic::isError);
        final ValidationResult result = new ValidationResult(valid, density.tier(), density.delta(),
            ambiguity.ambiguity(), density.pureDensity(), density, verdicts, invariants, vectors, diagnostics);
        StructuredLog.fine(LOG, "validate", "valid", valid, "tier", result.tier(), "delta", density.delta(),
            "rules", verdicts.size(), "diagnostics", diagnostics.size(),
            "ms", (System.nanoTime() - started) / 1_000_000);
        return result;
    }

    private List<RuleVerdict> verifyRules(List<TranslatedRule> rules, Deadline deadline, List<Diagnostic> diagnostics) {
        final var verdicts = new ArrayList<RuleVerdict>(rules.size());
        if (hybrid != null) {
            final var races = new ArrayList<CompletableFuture<HybridVerifier.Result>>(rules.size());
            rules.forEach(r -> races.add(CompletableFuture.supplyAsync(() -> hybrid.verify(r, deadline), stages)));
            for (int i = 0; i < rules.size(); i++) {
                final HybridVerifier.Result race = races.get(i).join();
                final String backend = "smt".equals(race.winner()) ? engine.backend().name() : race.winner();
                verdicts.add(judge(rules.get(i), race.verdict(), backend, race.gap(), deadline, diagnostics));
            }
        } else {
            final var queries = new ArrayList<Future<Verdict>>(rules.size());
            rules.forEach(r -> queries.add(engine.submit(r, deadline)));
            for (int i = 0; i < rules.size(); i++) {
                verdicts.add(judge(rules.get(i), await(queries.get(i)), engine.backend().name(), null, deadline,
                    diagnostics));
            }
        }
        return verdicts;
    }

    private static Verdict await(Future<Verdict> query) {
        try {
            return query.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            query.cancel(true);
            return Verdict.unknown(UnknownReason.CANCELLED, "validation interrupted");
        } catch (ExecutionException e) {
            LOG.warning(() -> "Rule verification failed: " + e.getCause());
            return Verdict.unknown(UnknownReason.BACKEND_ERROR, String.valueOf(e.getCause()));
        }
    }

    /// Records the diagnostics for one rule verdict. A disproven rule is contradictory when
    /// its negation is valid and merely contingent otherwise.
    private RuleVerdict judge(TranslatedRule rule, Verdict verdict, String backend, String gap, Deadline deadline,
                              List<Diagnostic> diagnostics) {
        final Location where = Location.statement(rule.block(), rule.index(), rule.byteOffset());
        String reason = null;
        if (verdict instanceof Verdict.Disproven d) {
            reason = d.counterexample();
            final Verdict negation = engine.prove(
                rule.obligation().withGoal(Formulas.negate(rule.formula())), deadline);
            if (negation instanceof Verdict.Proven) {
                diagnostics.add(Diagnostic.of(DiagnosticKind.RULE_CONTRADICTION, where,
                    "rule " + rule.id() + " '" + rule.source() + "' can never hold: its negation is valid"));
            } else {
                diagnostics.add(Diagnostic.of(DiagnosticKind.RULE_CONTINGENT, where,
                    "rule " + rule.id() + " '" + rule.source() + "' does not always hold: " + reason));
            }
        } else if (verdict instanceof Verdict.Unknown u) {
            reason = u.reason().name();
            final DiagnosticKind kind = u.reason() == UnknownReason.TIMEOUT
                ? DiagnosticKind.SMT_TIMEOUT : DiagnosticKind.SMT_UNKNOWN;
            diagnostics.add(Diagnostic.of(kind, where, "rule " + rule.id() + " is undecided: " + u.detail()));
        }
        if (gap != null) {
            diagnostics.add(Diagnostic.of(DiagnosticKind.PROOF_UNSUPPORTED_CONSTRUCT, where,
                "rule " + rule.id() + ": " + gap));
        }
        return new RuleVerdict(rule.id(), rule.block(), rule.byteOffset(), Formulas.render(rule.formula()),
            verdict, backend, reason, gap);
    }

    private void requireWithinLimit(long size) {
        if (size > config.maxDocumentBytes()) {
            throw new SizeLimitExceededException(size, config.maxDocumentBytes());
        }
    }

    private static ValidationResult reject(Diagnostic diagnostic) {
        StructuredLog.fine(LOG, "validate.rejected", "kind", diagnostic.kind(), "at", diagnostic.location());
        return ValidationResult.rejected(diagnostic);
    }

    static boolean hasSupportedExtension(String fileName) {
        final String lower = fileName.toLowerCase(Locale.ROOT);
        return EXTENSIONS.stream().anyMatch(lower::endsWith);
    }

    private static ThreadFactory daemonThreads() {
        final var counter = new AtomicInteger();
        return r -> {
            final Thread t = new Thread(r, "aisp-validate-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @Override
    public void close() {
        stages.shutdownNow();
        if (hybrid != null) {
            hybrid.close();
        }
        engine.close();
    }
}
