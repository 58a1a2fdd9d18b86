package aisp.java17.cli;

import java.util.logging.Logger;

/// Logger for the command surface.
final class CliLogging {
    static final Logger LOG = Logger.getLogger("aisp.java17.cli");

    private CliLogging() {}
}
