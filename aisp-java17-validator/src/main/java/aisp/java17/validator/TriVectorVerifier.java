package aisp.java17.validator;

import aisp.java17.logic.Deadline;
import aisp.java17.logic.Formula;
import aisp.java17.logic.Formula.Atom;
import aisp.java17.logic.Obligation;
import aisp.java17.logic.SmtEngine;
import aisp.java17.logic.Sort;
import aisp.java17.logic.StructuredLog;
import aisp.java17.logic.Term;
import aisp.java17.logic.Term.Apply;
import aisp.java17.logic.Term.Numeral;
import aisp.java17.logic.Term.Var;
import aisp.java17.logic.Verdict;
import aisp.java17.parser.AispAst.Block;
import aisp.java17.parser.AispAst.Definition;
import aisp.java17.parser.AispAst.Document;
import aisp.java17.parser.AispAst.Power;
import aisp.java17.parser.AispAst.Statement;
import aisp.java17.parser.AstPrinter;
import aisp.java17.parser.BlockTag;
import aisp.java17.parser.Sha256;
import aisp.java17.validator.VectorSpaceDescriptor.Kind;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

import static aisp.java17.validator.ValidatorLogging.LOG;

/// Proves that the semantic and structural subspaces meet the safety subspace only in the
/// zero vector.
///
/// Each statement of a source block contributes one generator, a Gaussian vector seeded
/// from the SHA-256 of its canonical rendering. All three subspaces live in one ambient
/// space of dimension `min(maxAmbientDimension, dH + dL + dS)`; each subspace may use at
/// most its share of that space, proportional to its nominal dimension.
public final class TriVectorVerifier {

    static final int DEFAULT_SEMANTIC_DIMENSION = 768;
    static final int DEFAULT_STRUCTURAL_DIMENSION = 512;
    static final int DEFAULT_SAFETY_DIMENSION = 256;
    static final int SMT_MAX_AMBIENT = 16;
    static final int SMT_MAX_GENERATORS = 8;

    private final ValidatorConfig config;
    private final SmtEngine engine;

    /// @param engine used for the SMT fallback; may be `null` when the fallback is disabled
    public TriVectorVerifier(ValidatorConfig config, SmtEngine engine) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        if (config.triVectorSmtFallback()) {
            Objects.requireNonNull(engine, "engine is required for the SMT fallback");
        }
        this.engine = engine;
    }

    public TriVectorResult verify(Document document, Deadline deadline) {
        Objects.requireNonNull(document, "document must not be null");
        final Map<Kind, Integer> nominal = nominalDimensions(document);
        // declared dimensions may be close to Integer.MAX_VALUE, so sums and products are long
        final long sum = nominal.values().stream().mapToLong(Integer::longValue).sum();
        final int ambient = (int) Math.min(config.maxAmbientDimension(), sum);
        final var diagnostics = new ArrayList<Diagnostic>();

        final Map<Kind, VectorSpaceDescriptor> spaces = new EnumMap<>(Kind.class);
        for (Kind kind : Kind.values()) {
            final long share = (long) ambient * nominal.get(kind) / sum;
            final int capacity = (int) Math.max(1L, Math.min(nominal.get(kind), share));
            final var generators = new ArrayList<double[]>();
            for (BlockTag tag : sources(kind)) {
                final Block block = document.block(tag);
                if (block != null) {
                    block.statements().forEach(s -> generators.add(generator(s, ambient)));
                }
            }
            if (generators.size() > capacity) {
                diagnostics.add(Diagnostic.of(DiagnosticKind.DIMENSION_EXCEEDED, Location.in(sources(kind).get(0)),
                    kind + " subspace has " + generators.size() + " generators but room for " + capacity
                        + " (nominal dimension " + nominal.get(kind) + ", ambient " + ambient + ")"));
                generators.subList(capacity, generators.size()).clear();
            }
            spaces.put(kind, new VectorSpaceDescriptor(kind, nominal.get(kind), generators));
        }

        final VectorSpaceDescriptor semantic = spaces.get(Kind.SEMANTIC);
        final VectorSpaceDescriptor structural = spaces.get(Kind.STRUCTURAL);
        final VectorSpaceDescriptor safety = spaces.get(Kind.SAFETY);
        final IntersectionReport semanticSafety = intersect(semantic, safety, deadline);
        final IntersectionReport structuralSafety = intersect(structural, safety, deadline);
        final IntersectionReport semanticStructural = intersect(semantic, structural, deadline);
        diagnostics.addAll(judge(semanticSafety, BlockTag.RULES));
        diagnostics.addAll(judge(structuralSafety, BlockTag.TYPES));
        StructuredLog.fine(LOG, "trivector", "ambient", ambient,
            "semantic_safety", semanticSafety.dimension(), "structural_safety", structuralSafety.dimension(),
            "semantic_structural", semanticStructural.dimension());
        return new TriVectorResult(semantic, structural, safety, semanticSafety, structuralSafety,
            semanticStructural, diagnostics);
    }

    /// Computes `dim(span(a) ∩ span(b))` and its certificate.
    public IntersectionReport intersect(VectorSpaceDescriptor a, VectorSpaceDescriptor b, Deadline deadline) {
        final double tol = config.orthogonalityTolerance();
        final String pair = a.kind().name().toLowerCase(Locale.ROOT) + "∩" + b.kind().name().toLowerCase(Locale.ROOT);
        final List<double[]> qa = LinearAlgebra.orthonormalize(a.generators(), tol);
        final List<double[]> qb = LinearAlgebra.orthonormalize(b.generators(), tol);
        final var union = new ArrayList<double[]>(qa);
        union.addAll(qb);
        final int rankUnion = LinearAlgebra.rank(union, tol);
        final int dimension = Math.max(0, qa.size() + qb.size() - rankUnion);
        final boolean degenerate = rankUnion != LinearAlgebra.rank(union, Math.sqrt(tol));
        final double[] witness = dimension > 0 ? LinearAlgebra.intersectionWitness(qa, qb, tol) : null;
        Verdict smt = null;
        final int ambient = Math.max(a.ambientDimension(), b.ambientDimension());
        if (config.triVectorSmtFallback() && ambient <= SMT_MAX_AMBIENT
                && qa.size() + qb.size() <= SMT_MAX_GENERATORS && !qa.isEmpty() && !qb.isEmpty()) {
            smt = engine.prove(isolationClaim(pair, qa, qb), deadline);
        }
        StructuredLog.finer(LOG, "trivector.pair", "pair", pair, "rank_a", qa.size(), "rank_b", qb.size(),
            "rank_union", rankUnion, "degenerate", degenerate);
        return new IntersectionReport(pair, dimension, qa.size(), qb.size(), rankUnion,
            LinearAlgebra.maxAbsInnerProduct(qa, qb), witness, degenerate, smt);
    }

    /// Diagnostics for a pair that must be trivial. The SMT verdict overrides the numeric one
    /// only when the numeric rank is degenerate.
    private static List<Diagnostic> judge(IntersectionReport r, BlockTag at) {
        final Location where = Location.in(at);
        if (r.degenerate() && r.smtVerdict() != null) {
            if (r.smtVerdict() instanceof Verdict.Proven) {
                return List.of();
            }
            if (r.smtVerdict() instanceof Verdict.Disproven d) {
                return List.of(Diagnostic.of(DiagnosticKind.ORTHOGONALITY_VIOLATION, where,
                    r.pair() + " is not trivial: solver found " + d.counterexample()));
            }
            return List.of(new Diagnostic(DiagnosticKind.SMT_UNKNOWN, Severity.ERROR, where,
                r.pair() + " isolation is numerically degenerate and the solver could not decide it"));
        }
        if (!r.trivial()) {
            return List.of(Diagnostic.of(DiagnosticKind.ORTHOGONALITY_VIOLATION, where,
                r.pair() + " has dimension " + r.dimension() + " (" + r.rankArgument() + ")"));
        }
        return List.of();
    }

    /// `∀a ∀b. Σaᵢqaᵢ = Σbⱼqbⱼ ⇒ ⋀ aᵢ = 0` over the reals.
    static Obligation isolationClaim(String pair, List<double[]> qa, List<double[]> qb) {
        final var as = new ArrayList<Var>();
        final var bs = new ArrayList<Var>();
        for (int i = 0; i < qa.size(); i++) {
            as.add(new Var("a" + i, Sort.REAL));
        }
        for (int j = 0; j < qb.size(); j++) {
            bs.add(new Var("b" + j, Sort.REAL));
        }
        final int n = qa.get(0).length;
        final var equations = new ArrayList<Formula>(n);
        for (int k = 0; k < n; k++) {
            equations.add(Atom.of(Atom.EQ, combination(as, qa, k), combination(bs, qb, k)));
        }
        final var zeros = new ArrayList<Formula>(as.size());
        as.forEach(v -> zeros.add(Atom.of(Atom.EQ, v, Numeral.of(0))));
        Formula claim = new Formula.Implies(Formula.and(equations), Formula.and(zeros));
        for (int j = bs.size() - 1; j >= 0; j--) {
            claim = new Formula.Forall(bs.get(j), claim);
        }
        for (int i = as.size() - 1; i >= 0; i--) {
            claim = new Formula.Forall(as.get(i), claim);
        }
        return Obligation.of("tri-vector " + pair, claim);
    }

    private static Term combination(List<Var> coefficients, List<double[]> basis, int coordinate) {
        Term sum = null;
        for (int i = 0; i < coefficients.size(); i++) {
            final Term product = new Apply("*", List.of(
                new Numeral(BigDecimal.valueOf(basis.get(i)[coordinate])), coefficients.get(i)), Sort.REAL);
            sum = sum == null ? product : new Apply("+", List.of(sum, product), Sort.REAL);
        }
        return sum;
    }

    private static double[] generator(Statement statement, int ambient) {
        final var random = new Random(Sha256.seed(AstPrinter.render(statement)));
        final double[] v = new double[ambient];
        for (int i = 0; i < ambient; i++) {
            v[i] = random.nextGaussian();
        }
        return v;
    }

    static List<BlockTag> sources(Kind kind) {
        return switch (kind) {
            case SEMANTIC -> List.of(BlockTag.RULES, BlockTag.FUNCTIONS);
            case STRUCTURAL -> List.of(BlockTag.TYPES);
            case SAFETY -> List.of(BlockTag.META, BlockTag.ERRORS);
        };
    }

    /// Dimensions declared as `V_H≜ℝⁿ`, `V_L≜ℝⁿ`, `V_S≜ℝⁿ` in the Types block, else the defaults.
    static Map<Kind, Integer> nominalDimensions(Document document) {
        final Map<Kind, Integer> dims = new EnumMap<>(Kind.class);
        dims.put(Kind.SEMANTIC, DEFAULT_SEMANTIC_DIMENSION);
        dims.put(Kind.STRUCTURAL, DEFAULT_STRUCTURAL_DIMENSION);
        dims.put(Kind.SAFETY, DEFAULT_SAFETY_DIMENSION);
        final Block types = document.block(BlockTag.TYPES);
        if (types == null) {
            return dims;
        }
        for (Statement s : types.statements()) {
            if (s instanceof Definition d && d.body() instanceof Power p && p.dimension() > 0) {
                switch (d.name()) {
                    case "V_H" -> dims.put(Kind.SEMANTIC, p.dimension());
                    case "V_L" -> dims.put(Kind.STRUCTURAL, p.dimension());
                    case "V_S" -> dims.put(Kind.SAFETY, p.dimension());
                    default -> { }
                }
            }
        }
        return dims;
    }
}
