package aisp.java17.validator;

import aisp.java17.logic.BackendKind;
import aisp.java17.logic.EngineConfig;
import aisp.java17.logic.NaturalDeductionProver;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Function;

import static aisp.java17.validator.ValidatorLogging.LOG;

/// Settings for one [AispValidator].
///
/// @param maxDocumentBytes       documents above this size are rejected before lexing
/// @param triVectorSmtFallback   send small tri-vector systems to the SMT engine as well
public record ValidatorConfig(
    int maxDocumentBytes,
    Duration smtTimeout,
    int smtMemoryMegabytes,
    int smtConcurrency,
    BackendKind backend,
    String z3Executable,
    boolean hybrid,
    int proofStepLimit,
    double ambiguityThreshold,
    double orthogonalityTolerance,
    int maxAmbientDimension,
    boolean triVectorSmtFallback
) {
    public static final int DEFAULT_MAX_DOCUMENT_BYTES = 64 * 1024;
    public static final int MAX_DOCUMENT_BYTES_CEILING = 1024 * 1024;

    public ValidatorConfig {
        Objects.requireNonNull(smtTimeout, "smtTimeout");
        Objects.requireNonNull(backend, "backend");
        Objects.requireNonNull(z3Executable, "z3Executable");
        if (maxDocumentBytes <= 0) {
            throw new IllegalArgumentException("maxDocumentBytes must be > 0");
        }
        if (maxDocumentBytes > MAX_DOCUMENT_BYTES_CEILING) {
            throw new IllegalArgumentException("maxDocumentBytes must be <= " + MAX_DOCUMENT_BYTES_CEILING);
        }
        if (smtTimeout.isNegative() || smtTimeout.isZero()) {
            throw new IllegalArgumentException("smtTimeout must be > 0");
        }
        if (smtMemoryMegabytes <= 0) {
            throw new IllegalArgumentException("smtMemoryMegabytes must be > 0");
        }
        if (smtConcurrency <= 0) {
            throw new IllegalArgumentException("smtConcurrency must be > 0");
        }
        if (z3Executable.isBlank()) {
            throw new IllegalArgumentException("z3Executable must not be blank");
        }
        if (proofStepLimit <= 0) {
            throw new IllegalArgumentException("proofStepLimit must be > 0");
        }
        if (!(ambiguityThreshold > 0.0 && ambiguityThreshold <= 1.0)) {
            throw new IllegalArgumentException("ambiguityThreshold must be within (0,1]");
        }
        if (!(orthogonalityTolerance > 0.0 && orthogonalityTolerance < 1.0)) {
            throw new IllegalArgumentException("orthogonalityTolerance must be within (0,1)");
        }
        if (maxAmbientDimension <= 0) {
            throw new IllegalArgumentException("maxAmbientDimension must be > 0");
        }
    }

    public static ValidatorConfig defaults() {
        return new ValidatorConfig(DEFAULT_MAX_DOCUMENT_BYTES, Duration.ofSeconds(30), 512,
            Runtime.getRuntime().availableProcessors(), BackendKind.AUTO, "z3", true,
            NaturalDeductionProver.DEFAULT_STEP_LIMIT, 0.02, 1e-9, 64, false);
    }

    /// Defaults overlaid with the `aisp.*` system properties.
    public static ValidatorConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /// Defaults overlaid with the `aisp.*` entries of `props`. Unparseable values are
    /// logged and ignored; parseable but out-of-range values are rejected.
    public static ValidatorConfig fromProperties(Properties props) {
        Objects.requireNonNull(props, "props");
        ValidatorConfig c = defaults();
        c = c.withMaxDocumentBytes(read(props, "aisp.maxDocumentBytes", Integer::valueOf, c.maxDocumentBytes));
        c = c.withSmtTimeout(Duration.ofMillis(
            read(props, "aisp.smt.timeoutMillis", Long::valueOf, c.smtTimeout.toMillis())));
        c = c.withSmtMemoryMegabytes(read(props, "aisp.smt.memoryMegabytes", Integer::valueOf, c.smtMemoryMegabytes));
        c = c.withSmtConcurrency(read(props, "aisp.smt.concurrency", Integer::valueOf, c.smtConcurrency));
        c = c.withBackend(read(props, "aisp.smt.backend",
            v -> BackendKind.valueOf(v.toUpperCase(Locale.ROOT)), c.backend));
        c = c.withZ3Executable(read(props, "aisp.smt.z3", Function.identity(), c.z3Executable));
        c = c.withHybrid(read(props, "aisp.hybrid", ValidatorConfig::parseBoolean, c.hybrid));
        c = c.withProofStepLimit(read(props, "aisp.proof.stepLimit", Integer::valueOf, c.proofStepLimit));
        c = c.withTriVectorSmtFallback(read(props, "aisp.trivector.smtFallback",
            ValidatorConfig::parseBoolean, c.triVectorSmtFallback));
        return c;
    }

    private static <T> T read(Properties props, String key, Function<String, T> parse, T fallback) {
        final String raw = props.getProperty(key);
        if (raw == null) {
            return fallback;
        }
        try {
            final T value = parse.apply(raw.trim());
            LOG.fine(() -> "Configuration " + key + "=" + value + " from system property");
            return value;
        } catch (IllegalArgumentException e) {
            LOG.warning(() -> "Invalid value for " + key + ": " + raw + ". Using default: " + fallback);
            return fallback;
        }
    }

    private static Boolean parseBoolean(String raw) {
        return switch (raw.toLowerCase(Locale.ROOT)) {
            case "true" -> Boolean.TRUE;
            case "false" -> Boolean.FALSE;
            default -> throw new IllegalArgumentException("not a boolean: " + raw);
        };
    }

    /// The SMT engine settings carried by this configuration.
    public EngineConfig engineConfig() {
        return new EngineConfig(backend, smtTimeout, smtMemoryMegabytes, smtConcurrency, z3Executable);
    }

    public ValidatorConfig withMaxDocumentBytes(int newMaxDocumentBytes) {
        return new ValidatorConfig(newMaxDocumentBytes, smtTimeout, smtMemoryMegabytes, smtConcurrency, backend,
            z3Executable, hybrid, proofStepLimit, ambiguityThreshold, orthogonalityTolerance, maxAmbientDimension,
            triVectorSmtFallback);
    }

    public ValidatorConfig withSmtTimeout(Duration newTimeout) {
        Objects.requireNonNull(newTimeout, "newTimeout");
        return new ValidatorConfig(maxDocumentBytes, newTimeout, smtMemoryMegabytes, smtConcurrency, backend,
            z3Executable, hybrid, proofStepLimit, ambiguityThreshold, orthogonalityTolerance, maxAmbientDimension,
            triVectorSmtFallback);
    }

    public ValidatorConfig withSmtMemoryMegabytes(int newMemoryMegabytes) {
        return new ValidatorConfig(maxDocumentBytes, smtTimeout, newMemoryMegabytes, smtConcurrency, backend,
            z3Executable, hybrid, proofStepLimit, ambiguityThreshold, orthogonalityTolerance, maxAmbientDimension,
            triVectorSmtFallback);
    }

    public ValidatorConfig withSmtConcurrency(int newConcurrency) {
        return new ValidatorConfig(maxDocumentBytes, smtTimeout, smtMemoryMegabytes, newConcurrency, backend,
            z3Executable, hybrid, proofStepLimit, ambiguityThreshold, orthogonalityTolerance, maxAmbientDimension,
            triVectorSmtFallback);
    }

    public ValidatorConfig withBackend(BackendKind newBackend) {
        return new ValidatorConfig(maxDocumentBytes, smtTimeout, smtMemoryMegabytes, smtConcurrency, newBackend,
            z3Executable, hybrid, proofStepLimit, ambiguityThreshold, orthogonalityTolerance, maxAmbientDimension,
            triVectorSmtFallback);
    }

    public ValidatorConfig withZ3Executable(String newExecutable) {
        return new ValidatorConfig(maxDocumentBytes, smtTimeout, smtMemoryMegabytes, smtConcurrency, backend,
            newExecutable, hybrid, proofStepLimit, ambiguityThreshold, orthogonalityTolerance, maxAmbientDimension,
            triVectorSmtFallback);
    }

    public ValidatorConfig withHybrid(boolean newHybrid) {
        return new ValidatorConfig(maxDocumentBytes, smtTimeout, smtMemoryMegabytes, smtConcurrency, backend,
            z3Executable, newHybrid, proofStepLimit, ambiguityThreshold, orthogonalityTolerance, maxAmbientDimension,
            triVectorSmtFallback);
    }

    public ValidatorConfig withProofStepLimit(int newStepLimit) {
        return new ValidatorConfig(maxDocumentBytes, smtTimeout, smtMemoryMegabytes, smtConcurrency, backend,
            z3Executable, hybrid, newStepLimit, ambiguityThreshold, orthogonalityTolerance, maxAmbientDimension,
            triVectorSmtFallback);
    }

    public ValidatorConfig withAmbiguityThreshold(double newThreshold) {
        return new ValidatorConfig(maxDocumentBytes, smtTimeout, smtMemoryMegabytes, smtConcurrency, backend,
            z3Executable, hybrid, proofStepLimit, newThreshold, orthogonalityTolerance, maxAmbientDimension,
            triVectorSmtFallback);
    }

    public ValidatorConfig withOrthogonalityTolerance(double newTolerance) {
        return new ValidatorConfig(maxDocumentBytes, smtTimeout, smtMemoryMegabytes, smtConcurrency, backend,
            z3Executable, hybrid, proofStepLimit, ambiguityThreshold, newTolerance, maxAmbientDimension,
            triVectorSmtFallback);
    }

    public ValidatorConfig withMaxAmbientDimension(int newDimension) {
        return new ValidatorConfig(maxDocumentBytes, smtTimeout, smtMemoryMegabytes, smtConcurrency, backend,
            z3Executable, hybrid, proofStepLimit, ambiguityThreshold, orthogonalityTolerance, newDimension,
            triVectorSmtFallback);
    }

    public ValidatorConfig withTriVectorSmtFallback(boolean newFallback) {
        return new ValidatorConfig(maxDocumentBytes, smtTimeout, smtMemoryMegabytes, smtConcurrency, backend,
            z3Executable, hybrid, proofStepLimit, ambiguityThreshold, orthogonalityTolerance, maxAmbientDimension,
            newFallback);
    }
}
