package aisp.java17.logic;

/// Three-valued outcome of a verification question. Never collapse it into a boolean.
public enum TruthValue {
    TRUE,
    FALSE,
    UNKNOWN;

    public TruthValue negate() {
        return switch (this) {
            case TRUE -> FALSE;
            case FALSE -> TRUE;
            case UNKNOWN -> UNKNOWN;
        };
    }
}
