package aisp.java17.parser;

import java.util.logging.Logger;

/// Centralized logger for the lexer and parser.
/// Classes use it via:
///   import static aisp.java17.parser.ParserLogging.LOG;
final class ParserLogging {
    static final Logger LOG = Logger.getLogger("aisp.java17.parser");
    private ParserLogging() {}
}
