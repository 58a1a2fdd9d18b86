package aisp.java17.validator;

import java.util.logging.Logger;

/// Centralized logger for scoring and the validation pipeline.
/// Classes use it via:
///   import static aisp.java17.validator.ValidatorLogging.LOG;
final class ValidatorLogging {
    static final Logger LOG = Logger.getLogger("aisp.java17.validator");

    private ValidatorLogging() {}
}
