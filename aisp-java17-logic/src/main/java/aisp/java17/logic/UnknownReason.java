package aisp.java17.logic;

/// Why a prover could not reach a definite verdict.
public enum UnknownReason {
    /// The query ran past its deadline, also after the simplified retry.
    TIMEOUT,
    /// The search gave up because bounded quantifier instantiation cannot refute further.
    INCOMPLETE,
    /// No solver process could be started.
    BACKEND_UNAVAILABLE,
    /// The solver answered with something that is not `sat`, `unsat` or `unknown`.
    BACKEND_ERROR,
    /// The solver itself answered `unknown`.
    SOLVER_UNKNOWN,
    /// The formula talks about the validation of the document it belongs to.
    SELF_REFERENTIAL,
    /// The natural-deduction step ceiling was reached.
    STEP_LIMIT,
    /// The formula uses a construct the prover does not handle.
    UNSUPPORTED,
    /// The query was interrupted or lost a race.
    CANCELLED
}
