package aisp.java17.validator;

import java.util.List;
import java.util.Objects;

/// Outcome of the tri-vector isolation check. Only the two pairs involving the safety
/// subspace have to be trivial; semantic ∩ structural is informational.
public record TriVectorResult(
    VectorSpaceDescriptor semantic,
    VectorSpaceDescriptor structural,
    VectorSpaceDescriptor safety,
    IntersectionReport semanticSafety,
    IntersectionReport structuralSafety,
    IntersectionReport semanticStructural,
    List<Diagnostic> diagnostics
) {
    public TriVectorResult {
        Objects.requireNonNull(semantic, "semantic must not be null");
        Objects.requireNonNull(structural, "structural must not be null");
        Objects.requireNonNull(safety, "safety must not be null");
        Objects.requireNonNull(semanticSafety, "semanticSafety must not be null");
        Objects.requireNonNull(structuralSafety, "structuralSafety must not be null");
        Objects.requireNonNull(semanticStructural, "semanticStructural must not be null");
        Objects.requireNonNull(diagnostics, "diagnostics must not be null");
        diagnostics = List.copyOf(diagnostics); // defensive copy
    }

    public boolean orthogonal() {
        return diagnostics.stream().noneMatch(Diagnostic::isError);
    }

    /// The larger of the two safety-pair inner products.
    public double maxInnerProduct() {
        return Math.max(semanticSafety.maxInnerProduct(), structuralSafety.maxInnerProduct());
    }
}
