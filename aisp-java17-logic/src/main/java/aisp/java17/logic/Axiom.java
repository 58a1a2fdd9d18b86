package aisp.java17.logic;

import java.util.Objects;

/// Named assumption: a domain axiom, a set axiom, a context definition or a discovered invariant.
public record Axiom(String name, Formula formula) {
    public static final String NAT_DOMAIN = "nat-domain";
    public static final String SET_EMPTY = "set-empty";
    public static final String SET_UNION = "set-union";
    public static final String SET_INTER = "set-inter";
    public static final String SET_DIFF = "set-diff";
    public static final String SET_SUBSET = "set-subset";
    public static final String SET_ENUM = "set-enum";

    public Axiom {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(formula, "formula must not be null");
    }
}
