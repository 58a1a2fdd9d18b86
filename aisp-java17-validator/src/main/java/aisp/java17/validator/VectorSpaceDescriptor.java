package aisp.java17.validator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// A subspace given by its generators in the shared ambient space.
///
/// @param nominalDimension declared dimension, e.g. 768 for `V_H≜ℝ⁷⁶⁸`
/// @param generators       spanning vectors, all of the ambient length
public record VectorSpaceDescriptor(Kind kind, int nominalDimension, List<double[]> generators) {

    public enum Kind { SEMANTIC, STRUCTURAL, SAFETY }

    public VectorSpaceDescriptor {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(generators, "generators must not be null");
        if (nominalDimension <= 0) {
            throw new IllegalArgumentException("nominalDimension must be > 0");
        }
        final var copy = new ArrayList<double[]>(generators.size());
        int length = -1;
        for (double[] g : generators) {
            Objects.requireNonNull(g, "generator must not be null");
            if (length >= 0 && g.length != length) {
                throw new IllegalArgumentException("generators must share one length");
            }
            length = g.length;
            copy.add(g.clone()); // defensive copy
        }
        generators = List.copyOf(copy);
    }

    /// Length of the generator vectors, or 0 when there are none.
    public int ambientDimension() {
        return generators.isEmpty() ? 0 : generators.get(0).length;
    }

    /// Copies of the generators; the descriptor itself never changes.
    @Override
    public List<double[]> generators() {
        final var out = new ArrayList<double[]>(generators.size());
        generators.forEach(g -> out.add(g.clone()));
        return out;
    }
}
