package aisp.java17.logic;

import java.util.logging.Logger;

/// Centralized logger for translation and proving.
/// All classes use it via:
///   import static aisp.java17.logic.LogicLogging.LOG;
final class LogicLogging {
    static final Logger LOG = Logger.getLogger("aisp.java17.logic");

    private LogicLogging() {}
}
