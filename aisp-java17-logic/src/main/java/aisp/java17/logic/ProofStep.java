package aisp.java17.logic;

import java.util.List;
import java.util.Objects;

/// One derived line of a natural-deduction proof. `premises` are indices of earlier steps.
public record ProofStep(List<Integer> premises, String rule, Formula conclusion, String justification) {
    public ProofStep {
        Objects.requireNonNull(premises, "premises must not be null");
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(conclusion, "conclusion must not be null");
        Objects.requireNonNull(justification, "justification must not be null");
        premises = List.copyOf(premises); // defensive copy
    }

    @Override
    public String toString() {
        return rule + " " + premises + " ⊢ " + Formulas.render(conclusion)
            + (justification.isEmpty() ? "" : " [" + justification + "]");
    }
}
