package aisp.java17.validator;

import aisp.java17.logic.TruthValue;
import aisp.java17.logic.Verdict;
import aisp.java17.parser.BlockTag;

import java.util.Objects;

/// Proof outcome for one translated rule.
///
/// @param formula canonical rendering of the formula IR
/// @param backend prover that produced the verdict: a solver name, `natural-deduction` or `none`
/// @param reason  why the verdict is not `Proven`: the unknown reason or the counterexample; `null` when proven
/// @param gap     why natural deduction could not take part, or `null`
public record RuleVerdict(
    String id,
    BlockTag block,
    int byteOffset,
    String formula,
    Verdict verdict,
    String backend,
    String reason,
    String gap
) {
    public RuleVerdict {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(block, "block must not be null");
        Objects.requireNonNull(formula, "formula must not be null");
        Objects.requireNonNull(verdict, "verdict must not be null");
        Objects.requireNonNull(backend, "backend must not be null");
    }

    public TruthValue truth() {
        return verdict.truth();
    }
}
