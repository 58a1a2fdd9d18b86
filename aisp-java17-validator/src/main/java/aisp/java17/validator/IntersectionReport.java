package aisp.java17.validator;

import aisp.java17.logic.Verdict;

import java.util.Objects;

/// How two subspaces meet.
///
/// `dimension = rankA + rankB − rankUnion`. When it is positive `witness` is a unit
/// vector lying in both subspaces.
///
/// @param maxInnerProduct largest `|⟨a, b⟩|` over the orthonormalised bases; `≈0` means fully orthogonal
/// @param degenerate      the union rank changes under a looser tolerance, so the numeric verdict is fragile
/// @param smtVerdict      verdict of the SMT fallback on the isolation claim, or `null` when it did not run
public record IntersectionReport(
    String pair,
    int dimension,
    int rankA,
    int rankB,
    int rankUnion,
    double maxInnerProduct,
    double[] witness,
    boolean degenerate,
    Verdict smtVerdict
) {
    public IntersectionReport {
        Objects.requireNonNull(pair, "pair must not be null");
        if (dimension < 0) {
            throw new IllegalArgumentException("dimension must be >= 0");
        }
        witness = witness == null ? null : witness.clone(); // defensive copy
    }

    public boolean trivial() {
        return dimension == 0;
    }

    @Override
    public double[] witness() {
        return witness == null ? null : witness.clone();
    }

    /// The rank argument in words, e.g. `rank 3 + rank 2 − rank 5 = 0`.
    public String rankArgument() {
        return "rank " + rankA + " + rank " + rankB + " − rank " + rankUnion + " = " + dimension;
    }
}
