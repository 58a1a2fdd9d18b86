package aisp.java17.logic;

import java.util.logging.Level;
import java.util.logging.Logger;

/// Structured JUL logging at the debug levels.
/// Lines read `event=NAME key=value ...`; values with whitespace are quoted.
public final class StructuredLog {
    private static final int MAX_VALUE = 200;

    private StructuredLog() {}

    public static void fine(Logger log, String event, Object... kv) {
        emit(log, Level.FINE, event, kv);
    }

    public static void finer(Logger log, String event, Object... kv) {
        emit(log, Level.FINER, event, kv);
    }

    private static void emit(Logger log, Level level, String event, Object... kv) {
        if (log.isLoggable(level)) {
            log.log(level, () -> line(event, kv));
        }
    }

    static String line(String event, Object... kv) {
        final var sb = new StringBuilder(64).append("event=").append(clean(event));
        for (int i = 0; i + 1 < kv.length; i += 2) {
            if (kv[i] == null) {
                continue;
            }
            final String value = clean(String.valueOf(kv[i + 1]));
            sb.append(' ').append(kv[i]).append('=');
            if (value.chars().anyMatch(c -> Character.isWhitespace(c) || c == '"')) {
                sb.append('"').append(value.replace("\"", "'")).append('"');
            } else {
                sb.append(value);
            }
        }
        return sb.toString();
    }

    private static String clean(String s) {
        final String trimmed = s.length() > MAX_VALUE ? s.substring(0, MAX_VALUE) + "..." : s;
        return trimmed.replace('\n', ' ').replace('\r', ' ').replace('\t', ' ');
    }
}
