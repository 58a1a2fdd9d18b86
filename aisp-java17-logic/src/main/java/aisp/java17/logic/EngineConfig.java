package aisp.java17.logic;

import java.time.Duration;
import java.util.Objects;

/// Settings for the SMT engine.
public record EngineConfig(
    BackendKind backend,
    Duration timeout,
    int memoryMegabytes,
    int concurrency,
    String z3Executable
) {
    public EngineConfig {
        Objects.requireNonNull(backend, "backend");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(z3Executable, "z3Executable");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        if (memoryMegabytes <= 0) {
            throw new IllegalArgumentException("memoryMegabytes must be > 0");
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be > 0");
        }
        if (z3Executable.isBlank()) {
            throw new IllegalArgumentException("z3Executable must not be blank");
        }
    }

    public static EngineConfig defaults() {
        return new EngineConfig(BackendKind.AUTO, Duration.ofSeconds(30), 512,
            Runtime.getRuntime().availableProcessors(), "z3");
    }

    public EngineConfig withBackend(BackendKind newBackend) {
        return new EngineConfig(newBackend, timeout, memoryMegabytes, concurrency, z3Executable);
    }

    public EngineConfig withTimeout(Duration newTimeout) {
        return new EngineConfig(backend, newTimeout, memoryMegabytes, concurrency, z3Executable);
    }

    public EngineConfig withMemoryMegabytes(int newMemoryMegabytes) {
        return new EngineConfig(backend, timeout, newMemoryMegabytes, concurrency, z3Executable);
    }

    public EngineConfig withConcurrency(int newConcurrency) {
        return new EngineConfig(backend, timeout, memoryMegabytes, newConcurrency, z3Executable);
    }

    public EngineConfig withZ3Executable(String newExecutable) {
        return new EngineConfig(backend, timeout, memoryMegabytes, concurrency, newExecutable);
    }
}
