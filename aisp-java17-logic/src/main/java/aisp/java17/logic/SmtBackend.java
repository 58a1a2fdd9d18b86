package aisp.java17.logic;

import static aisp.java17.logic.LogicLogging.LOG;

/// A decision procedure answering validity obligations.
///
/// Implementations never throw for solver-side failures; they answer [Verdict.Unknown] with a
/// reason instead. They must stop by `deadline` and honour thread interruption.
public interface SmtBackend {

    String name();

    Verdict check(Obligation obligation, Deadline deadline);

    /// Backend selected by `config`.
    static SmtBackend forConfig(EngineConfig config) {
        return switch (config.backend()) {
            case BUILTIN -> new BuiltinBackend();
            case Z3 -> new Z3ProcessBackend(config.z3Executable(), config.memoryMegabytes());
            case AUTO -> {
                if (Z3ProcessBackend.isOnPath(config.z3Executable())) {
                    yield new Z3ProcessBackend(config.z3Executable(), config.memoryMegabytes());
                }
                LOG.fine(() -> "No " + config.z3Executable() + " on PATH, using builtin solver");
                yield new BuiltinBackend();
            }
        };
    }
}
