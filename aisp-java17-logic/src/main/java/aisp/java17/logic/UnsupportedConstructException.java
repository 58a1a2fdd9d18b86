package aisp.java17.logic;

import java.util.Objects;

/// Raised by the natural-deduction prover for a formula shape it has no rules for.
public class UnsupportedConstructException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient Formula formula;

    public UnsupportedConstructException(Formula formula) {
        super("unsupported construct: " + Formulas.render(Objects.requireNonNull(formula, "formula must not be null")));
        this.formula = formula;
    }

    public Formula formula() {
        return formula;
    }
}
