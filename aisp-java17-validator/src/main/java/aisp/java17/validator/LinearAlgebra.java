package aisp.java17.validator;

import java.util.ArrayList;
import java.util.List;

/// Dense real linear algebra over small generator sets. Vectors are `double[]` of equal length.
final class LinearAlgebra {
    private LinearAlgebra() {}

    /// Rank of the span of `vectors` by Gaussian elimination with partial pivoting.
    static int rank(List<double[]> vectors, double tolerance) {
        if (vectors.isEmpty()) {
            return 0;
        }
        final double[][] m = rowsOf(vectors);
        return reduce(m, tolerance).length;
    }

    /// Orthonormal basis of the span by modified Gram-Schmidt; dependent vectors are dropped.
    static List<double[]> orthonormalize(List<double[]> vectors, double tolerance) {
        final var basis = new ArrayList<double[]>();
        for (double[] v : vectors) {
            final double[] w = v.clone();
            for (double[] q : basis) {
                axpy(-dot(q, w), q, w);
            }
            // second pass keeps the basis orthogonal in floating point
            for (double[] q : basis) {
                axpy(-dot(q, w), q, w);
            }
            final double n = norm(w);
            if (n > tolerance * Math.max(1.0, norm(v))) {
                scale(w, 1.0 / n);
                basis.add(w);
            }
        }
        return basis;
    }

    /// Largest `|⟨a, b⟩|` over pairs of the two (orthonormal) bases, 0 if either is empty.
    static double maxAbsInnerProduct(List<double[]> a, List<double[]> b) {
        double max = 0.0;
        for (double[] x : a) {
            for (double[] y : b) {
                max = Math.max(max, Math.abs(dot(x, y)));
            }
        }
        return max;
    }

    /// A non-zero vector in `span(a) ∩ span(b)`, or `null` when the intersection is trivial.
    /// Both arguments must be linearly independent sets, e.g. orthonormal bases.
    static double[] intersectionWitness(List<double[]> a, List<double[]> b, double tolerance) {
        if (a.isEmpty() || b.isEmpty()) {
            return null;
        }
        final int n = a.get(0).length;
        final int cols = a.size() + b.size();
        // columns are a₁..aₚ, -b₁..-b_q; a null vector c gives Σcᵢaᵢ = Σcⱼbⱼ
        final double[][] m = new double[n][cols];
        for (int j = 0; j < a.size(); j++) {
            for (int i = 0; i < n; i++) {
                m[i][j] = a.get(j)[i];
            }
        }
        for (int j = 0; j < b.size(); j++) {
            for (int i = 0; i < n; i++) {
                m[i][a.size() + j] = -b.get(j)[i];
            }
        }
        final int[] pivotColumn = new int[n];
        final int rank = rref(m, tolerance, pivotColumn);
        final boolean[] isPivot = new boolean[cols];
        for (int r = 0; r < rank; r++) {
            isPivot[pivotColumn[r]] = true;
        }
        for (int free = 0; free < cols; free++) {
            if (isPivot[free]) {
                continue;
            }
            final double[] c = new double[cols];
            c[free] = 1.0;
            for (int r = 0; r < rank; r++) {
                c[pivotColumn[r]] = -m[r][free];
            }
            final double[] witness = new double[n];
            for (int j = 0; j < a.size(); j++) {
                axpy(c[j], a.get(j), witness);
            }
            final double len = norm(witness);
            if (len > tolerance) {
                scale(witness, 1.0 / len);
                return witness;
            }
        }
        return null;
    }

    static double dot(double[] x, double[] y) {
        double s = 0.0;
        for (int i = 0; i < x.length; i++) {
            s += x[i] * y[i];
        }
        return s;
    }

    static double norm(double[] x) {
        return Math.sqrt(dot(x, x));
    }

    /// `y += alpha · x`
    private static void axpy(double alpha, double[] x, double[] y) {
        for (int i = 0; i < x.length; i++) {
            y[i] += alpha * x[i];
        }
    }

    private static void scale(double[] x, double factor) {
        for (int i = 0; i < x.length; i++) {
            x[i] *= factor;
        }
    }

    private static double[][] rowsOf(List<double[]> vectors) {
        final double[][] m = new double[vectors.size()][];
        for (int i = 0; i < m.length; i++) {
            m[i] = vectors.get(i).clone();
        }
        return m;
    }

    /// Row echelon form; returns the non-zero rows.
    private static double[][] reduce(double[][] m, double tolerance) {
        final int[] pivots = new int[m.length];
        final int rank = rref(m, tolerance, pivots);
        final double[][] out = new double[rank][];
        System.arraycopy(m, 0, out, 0, rank);
        return out;
    }

    /// In-place reduced row echelon form. Entries below `tolerance × scale` count as zero.
    /// Fills `pivotColumn[r]` for each pivot row `r` and returns the rank.
    private static int rref(double[][] m, double tolerance, int[] pivotColumn) {
        final int rows = m.length;
        if (rows == 0) {
            return 0;
        }
        final int cols = m[0].length;
        double scale = 0.0;
        for (double[] row : m) {
            for (double v : row) {
                scale = Math.max(scale, Math.abs(v));
            }
        }
        final double eps = tolerance * Math.max(1.0, scale) * Math.max(rows, cols);
        int r = 0;
        for (int col = 0; col < cols && r < rows; col++) {
            int best = r;
            for (int i = r + 1; i < rows; i++) {
                if (Math.abs(m[i][col]) > Math.abs(m[best][col])) {
                    best = i;
                }
            }
            if (Math.abs(m[best][col]) <= eps) {
                for (int i = r; i < rows; i++) {
                    m[i][col] = 0.0;
                }
                continue;
            }
            final double[] tmp = m[r];
            m[r] = m[best];
            m[best] = tmp;
            final double p = m[r][col];
            for (int j = col; j < cols; j++) {
                m[r][j] /= p;
            }
            for (int i = 0; i < rows; i++) {
                if (i != r && m[i][col] != 0.0) {
                    final double f = m[i][col];
                    for (int j = col; j < cols; j++) {
                        m[i][j] -= f * m[r][j];
                    }
                }
            }
            pivotColumn[r] = col;
            r++;
        }
        return r;
    }
}
