package aisp.java17.logic;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static aisp.java17.logic.LogicLogging.LOG;

/// Runs each obligation through an external `z3` process fed over stdin.
///
/// The process gets the remaining time as `-t:<ms>` and is killed if it outlives the deadline by
/// more than a short grace period.
public final class Z3ProcessBackend implements SmtBackend {

    private static final long GRACE_MILLIS = 500;

    private final String executable;
    private final int memoryMegabytes;

    public Z3ProcessBackend(String executable, int memoryMegabytes) {
        this.executable = Objects.requireNonNull(executable, "executable must not be null");
        if (memoryMegabytes <= 0) {
            throw new IllegalArgumentException("memoryMegabytes must be > 0");
        }
        this.memoryMegabytes = memoryMegabytes;
    }

    @Override
    public String name() {
        return "z3";
    }

    @Override
    public Verdict check(Obligation obligation, Deadline deadline) {
        final String script = SmtLibEmitter.validityScript(obligation);
        final long millis = Math.max(1L, Math.min(Integer.MAX_VALUE, deadline.remaining().toMillis()));
        if (deadline.expired()) {
            return Verdict.unknown(UnknownReason.TIMEOUT, "deadline passed before z3 started");
        }
        final Process process;
        try {
            process = new ProcessBuilder(executable, "-in", "-smt2", "-t:" + millis, "-memory:" + memoryMegabytes)
                .redirectErrorStream(true)
                .start();
        } catch (IOException e) {
            LOG.warning(() -> "Could not start " + executable + ": " + e.getMessage());
            return Verdict.unknown(UnknownReason.BACKEND_UNAVAILABLE, executable + ": " + e.getMessage());
        }
        StructuredLog.fine(LOG, "z3.start", "obligation", obligation.id(), "timeoutMs", millis);
        final long started = System.nanoTime();
        final CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        try (OutputStream in = process.getOutputStream()) {
            in.write(script.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            process.destroyForcibly();
            return Verdict.unknown(UnknownReason.BACKEND_ERROR, "could not write to z3: " + e.getMessage());
        }
        try {
            final String text = output.get(millis + GRACE_MILLIS, TimeUnit.MILLISECONDS);
            process.waitFor(GRACE_MILLIS, TimeUnit.MILLISECONDS);
            final boolean outOfTime = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started) >= millis;
            return interpret(obligation, script, text, outOfTime);
        } catch (TimeoutException e) {
            return Verdict.unknown(UnknownReason.TIMEOUT, "z3 exceeded " + millis + "ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Verdict.unknown(UnknownReason.CANCELLED, "interrupted while waiting for z3");
        } catch (ExecutionException e) {
            return Verdict.unknown(UnknownReason.BACKEND_ERROR, "reading z3 output failed: " + e.getCause());
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    private Verdict interpret(Obligation obligation, String script, String text, boolean outOfTime) {
        final String trimmed = text.strip();
        final int eol = trimmed.indexOf('\n');
        final String status = (eol < 0 ? trimmed : trimmed.substring(0, eol)).strip();
        final String rest = eol < 0 ? "" : trimmed.substring(eol + 1).strip();
        final String goal = Formulas.render(obligation.goal());
        StructuredLog.fine(LOG, "z3.done", "obligation", obligation.id(), "status", status);
        return switch (status) {
            case "unsat" -> new Verdict.Proven(new ProofObject.SmtCertificate(
                "unsat", name(), script, obligation.assumptionNames(), "", goal));
            case "sat" -> new Verdict.Disproven(rest, new ProofObject.SmtCertificate(
                "sat", name(), script, obligation.assumptionNames(), rest, goal));
            case "timeout" -> Verdict.unknown(UnknownReason.TIMEOUT, "z3 reported timeout");
            case "unknown" -> outOfTime || rest.contains("timeout") || rest.contains("canceled")
                ? Verdict.unknown(UnknownReason.TIMEOUT, "z3 gave up: " + rest)
                : Verdict.unknown(UnknownReason.SOLVER_UNKNOWN, "z3 answered unknown");
            default -> Verdict.unknown(UnknownReason.BACKEND_ERROR, "unexpected z3 output: " + trimmed);
        };
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /// Whether `executable` names a runnable file, directly or through the `PATH`.
    public static boolean isOnPath(String executable) {
        if (executable.contains(File.separator)) {
            return Files.isExecutable(Path.of(executable));
        }
        final String path = System.getenv("PATH");
        if (path == null) {
            return false;
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (!dir.isEmpty() && Files.isExecutable(Path.of(dir, executable))) {
                return true;
            }
        }
        return false;
    }
}
