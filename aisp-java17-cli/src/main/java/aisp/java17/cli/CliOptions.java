package aisp.java17.cli;

import aisp.java17.logic.BackendKind;
import aisp.java17.validator.ValidatorConfig;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/// A parsed command line: one command, one document path and the global options applied
/// on top of a base [ValidatorConfig].
record CliOptions(Command command, Path path, boolean json, ValidatorConfig config) {

    enum Command { VALIDATE, TIER, DENSITY, DEBUG }

    static final String USAGE = String.join(System.lineSeparator(),
        "Usage: aisp <validate|tier|density|debug> <path> [options]",
        "  --json                      validate only: print the JSON report",
        "  --backend=auto|builtin|z3   SMT backend",
        "  --timeout-ms=N              per-query solver timeout",
        "  --max-bytes=N               document size limit",
        "  --no-hybrid                 solver only, no natural-deduction race");

    CliOptions {
        Objects.requireNonNull(command, "command must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(config, "config must not be null");
    }

    /// @throws IllegalArgumentException on any usage error, with a message fit for the user
    static CliOptions parse(String[] args, ValidatorConfig base) {
        Objects.requireNonNull(base, "base must not be null");
        if (args == null) {
            throw new IllegalArgumentException("no command given");
        }
        Command command = null;
        Path path = null;
        boolean json = false;
        ValidatorConfig config = base;
        for (String arg : args) {
            if (arg.equals("--json")) {
                json = true;
            } else if (arg.equals("--no-hybrid")) {
                config = config.withHybrid(false);
            } else if (arg.startsWith("--backend=")) {
                config = config.withBackend(backend(value(arg)));
            } else if (arg.startsWith("--timeout-ms=")) {
                config = config.withSmtTimeout(Duration.ofMillis(number(arg)));
            } else if (arg.startsWith("--max-bytes=")) {
                final long bytes = number(arg);
                if (bytes > Integer.MAX_VALUE) {
                    throw new IllegalArgumentException("--max-bytes is too large: " + bytes);
                }
                config = config.withMaxDocumentBytes((int) bytes);
            } else if (arg.startsWith("--")) {
                throw new IllegalArgumentException("unknown option " + arg);
            } else if (command == null) {
                command = command(arg);
            } else if (path == null) {
                path = Path.of(arg);
            } else {
                throw new IllegalArgumentException("unexpected argument " + arg);
            }
        }
        if (command == null) {
            throw new IllegalArgumentException("no command given");
        }
        if (path == null) {
            throw new IllegalArgumentException("no document path given");
        }
        if (json && command != Command.VALIDATE) {
            throw new IllegalArgumentException("--json applies to validate only");
        }
        return new CliOptions(command, path, json, config);
    }

    private static Command command(String arg) {
        try {
            return Command.valueOf(arg.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown command " + arg, e);
        }
    }

    private static BackendKind backend(String value) {
        try {
            return BackendKind.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown backend " + value + ", expected auto, builtin or z3", e);
        }
    }

    private static long number(String arg) {
        final String value = value(arg);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a number: " + arg, e);
        }
    }

    private static String value(String arg) {
        return arg.substring(arg.indexOf('=') + 1);
    }
}
