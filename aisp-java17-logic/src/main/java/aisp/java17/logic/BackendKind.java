package aisp.java17.logic;

/// Which SMT backend answers obligations.
public enum BackendKind {
    /// Z3 when an executable is found on the `PATH`, the builtin solver otherwise.
    AUTO,
    BUILTIN,
    Z3
}
