package aisp.java17.logic;

import java.util.List;
import java.util.Objects;

/// Evidence attached to a definite verdict.
public sealed interface ProofObject permits ProofObject.DeductionTree, ProofObject.SmtCertificate {

    /// Name of the prover that produced the evidence.
    String backend();

    /// Linearised natural-deduction proof; the last step concludes the goal.
    record DeductionTree(List<ProofStep> steps) implements ProofObject {
        public DeductionTree {
            Objects.requireNonNull(steps, "steps must not be null");
            steps = List.copyOf(steps); // defensive copy
        }

        @Override
        public String backend() {
            return "natural-deduction";
        }
    }

    /// Solver answer for a validity query.
    ///
    /// @param status  `unsat` when the negated goal was refuted, `sat` when a model exists
    /// @param script  the SMT-LIB 2 script sent to the solver
    /// @param axioms  names of the axioms the query depended on
    /// @param model   solver model for `sat`, empty otherwise
    /// @param formula canonical rendering of the goal
    record SmtCertificate(String status, String backend, String script, List<String> axioms, String model,
                          String formula) implements ProofObject {
        public SmtCertificate {
            Objects.requireNonNull(status, "status must not be null");
            Objects.requireNonNull(backend, "backend must not be null");
            Objects.requireNonNull(script, "script must not be null");
            Objects.requireNonNull(axioms, "axioms must not be null");
            Objects.requireNonNull(model, "model must not be null");
            Objects.requireNonNull(formula, "formula must not be null");
            axioms = List.copyOf(axioms); // defensive copy
        }
    }
}
