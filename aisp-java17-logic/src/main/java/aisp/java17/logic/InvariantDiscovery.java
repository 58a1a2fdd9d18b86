package aisp.java17.logic;

import aisp.java17.parser.AispAst.Application;
import aisp.java17.parser.AispAst.Assertion;
import aisp.java17.parser.AispAst.Binary;
import aisp.java17.parser.AispAst.Block;
import aisp.java17.parser.AispAst.Definition;
import aisp.java17.parser.AispAst.Document;
import aisp.java17.parser.AispAst.Enumeration;
import aisp.java17.parser.AispAst.Expr;
import aisp.java17.parser.AispAst.Identifier;
import aisp.java17.parser.AispAst.Implication;
import aisp.java17.parser.AispAst.Lambda;
import aisp.java17.parser.AispAst.NumberLiteral;
import aisp.java17.parser.AispAst.Power;
import aisp.java17.parser.AispAst.Quantified;
import aisp.java17.parser.AispAst.QuantifiedRule;
import aisp.java17.parser.AispAst.Statement;
import aisp.java17.parser.AispAst.Tuple;
import aisp.java17.parser.AispAst.Unary;
import aisp.java17.parser.AstPrinter;
import aisp.java17.parser.BlockTag;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

import static aisp.java17.logic.LogicLogging.LOG;

/// Reads invariants off a document's own statements.
///
/// Confidence combines independent cues as `1 − Π(1 − wᵢ)`.
public final class InvariantDiscovery {

    static final double RANGE_LITERAL = 0.6;
    static final double ENUMERATION = 0.6;
    static final double TYPED_QUANTIFIER = 0.5;
    static final double STRUCTURAL_CHECK = 0.7;
    static final double FURTHER_OCCURRENCE = 0.2;

    private InvariantDiscovery() {}

    public static List<Invariant> discover(Document document) {
        Objects.requireNonNull(document, "document must not be null");
        final Translation translation = FormulaTranslator.translate(document);
        final Map<String, Formula> formulas = new HashMap<>();
        translation.rules().forEach(r -> {
            if (!r.selfReferential()) {
                formulas.put(key(r.block(), r.byteOffset()), r.formula());
            }
        });
        final Map<String, Formula> axioms = new HashMap<>();
        translation.axioms().forEach(a -> axioms.put(a.name(), a.formula()));

        final var typeCounts = new HashMap<String, Integer>();
        final var boundCounts = new HashMap<String, Integer>();
        final var memberCounts = new HashMap<String, Integer>();
        for (Statement s : document.statements()) {
            forEachExpr(expression(s), e -> {
                if (e instanceof Quantified q && q.domain() != null) {
                    typeCounts.merge(AstPrinter.render(q.domain()), 1, Integer::sum);
                }
                final String bounded = boundedTerm(e);
                if (bounded != null) {
                    boundCounts.merge(bounded, 1, Integer::sum);
                }
                if (e instanceof Binary b && "∈".equals(b.op())) {
                    memberCounts.merge(AstPrinter.render(b), 1, Integer::sum);
                }
            });
        }

        final var out = new ArrayList<Invariant>();
        for (Block block : document.blocks().values()) {
            for (Statement s : block.statements()) {
                if (s instanceof Definition d && d.body() instanceof Enumeration en && block.tag() == BlockTag.TYPES) {
                    out.add(new Invariant(Invariant.Kind.MEMBERSHIP,
                        "every " + d.name() + " is one of " + AstPrinter.render(en),
                        confidence(List.of(ENUMERATION)), axioms.get("enum-" + d.name()), block.tag(), s.byteOffset()));
                    continue;
                }
                final Expr expr = expression(s);
                if (expr == null) {
                    continue;
                }
                final Formula formula = formulas.get(key(s.block(), s.byteOffset()));
                if (expr instanceof Quantified q && "∀".equals(q.quantifier()) && q.domain() != null) {
                    final String domain = AstPrinter.render(q.domain());
                    final var cues = new ArrayList<Double>();
                    cues.add(TYPED_QUANTIFIER);
                    repeat(cues, FURTHER_OCCURRENCE, typeCounts.getOrDefault(domain, 1) - 1);
                    out.add(new Invariant(q.membership() ? Invariant.Kind.MEMBERSHIP : Invariant.Kind.TYPE_SAFETY,
                        AstPrinter.render(expr) + " holds for every " + q.variable() + (q.membership() ? "∈" : ":") + domain,
                        confidence(cues), formula, s.block(), s.byteOffset()));
                }
                forEachExpr(expr, e -> {
                    final String bounded = boundedTerm(e);
                    if (bounded != null) {
                        final var cues = new ArrayList<Double>();
                        cues.add(RANGE_LITERAL);
                        repeat(cues, FURTHER_OCCURRENCE, boundCounts.getOrDefault(bounded, 1) - 1);
                        out.add(new Invariant(Invariant.Kind.BOUNDS, AstPrinter.render(e), confidence(cues),
                            e == expr ? formula : null, s.block(), s.byteOffset()));
                    }
                });
                if (expr instanceof Binary b && "∈".equals(b.op())) {
                    final var cues = new ArrayList<Double>();
                    if (b.right() instanceof Enumeration) {
                        cues.add(ENUMERATION);
                    }
                    repeat(cues, FURTHER_OCCURRENCE, memberCounts.getOrDefault(AstPrinter.render(b), 1));
                    out.add(new Invariant(Invariant.Kind.MEMBERSHIP, AstPrinter.render(b), confidence(cues),
                        formula, s.block(), s.byteOffset()));
                }
            }
            out.add(structural(document, block));
        }
        StructuredLog.fine(LOG, "invariants", "count", out.size());
        return List.copyOf(out);
    }

    /// `1 − Π(1 − wᵢ)`, clamped to [0,1].
    static double confidence(List<Double> cues) {
        double miss = 1.0;
        for (double w : cues) {
            miss *= 1.0 - w;
        }
        return Math.max(0.0, Math.min(1.0, 1.0 - miss));
    }

    private static Invariant structural(Document document, Block block) {
        final var names = new HashSet<String>();
        final var duplicates = new LinkedHashSet<String>();
        final var applied = new LinkedHashSet<String>();
        for (Statement s : block.statements()) {
            if (s instanceof Definition d && !names.add(d.name())) {
                duplicates.add(d.name());
            }
            forEachExpr(expression(s), e -> {
                if (e instanceof Application a && a.function() instanceof Identifier id) {
                    applied.add(id.name());
                }
            });
        }
        final var defined = new HashSet<String>();
        document.statements().forEach(s -> {
            if (s instanceof Definition d) {
                defined.add(d.name());
            }
        });
        applied.removeAll(defined);
        applied.removeAll(FormulaTranslator.SELF_REFERENTIAL_NAMES);

        final var cues = new ArrayList<Double>();
        final var findings = new ArrayList<String>();
        if (duplicates.isEmpty()) {
            cues.add(STRUCTURAL_CHECK);
            findings.add("names unique");
        } else {
            findings.add("duplicate names " + String.join(",", duplicates));
        }
        if (applied.isEmpty()) {
            cues.add(STRUCTURAL_CHECK);
            findings.add("references resolve");
        } else {
            findings.add("unresolved " + String.join(",", applied));
        }
        if (!block.statements().isEmpty()) {
            cues.add(STRUCTURAL_CHECK);
            findings.add("non-empty");
        } else {
            findings.add("empty");
        }
        final String name = block.label().isEmpty() ? block.tag().label() : block.label();
        return new Invariant(Invariant.Kind.STRUCTURAL, name + ": " + String.join(", ", findings),
            confidence(cues), null, block.tag(), block.byteOffset());
    }

    /// Rendering of the term bounded by a `lo≤x∧x≤hi` style pair of numeric comparisons, or `null`.
    private static String boundedTerm(Expr e) {
        if (!(e instanceof Binary b) || !"∧".equals(b.op())) {
            return null;
        }
        final Bound first = bound(b.left());
        final Bound second = bound(b.right());
        if (first == null || second == null || !first.term().equals(second.term()) || first.lower() == second.lower()) {
            return null;
        }
        return first.term();
    }

    private record Bound(String term, boolean lower) {}

    private static Bound bound(Expr e) {
        if (!(e instanceof Binary b)) {
            return null;
        }
        final boolean upward = "≤".equals(b.op()) || "<".equals(b.op());
        final boolean downward = "≥".equals(b.op()) || ">".equals(b.op());
        if (!upward && !downward) {
            return null;
        }
        if (b.right() instanceof NumberLiteral && !(b.left() instanceof NumberLiteral)) {
            // x≤9 bounds from above
            return new Bound(AstPrinter.render(b.left()), downward);
        }
        if (b.left() instanceof NumberLiteral && !(b.right() instanceof NumberLiteral)) {
            // 0≤x bounds from below
            return new Bound(AstPrinter.render(b.right()), upward);
        }
        return null;
    }

    private static void repeat(List<Double> cues, double weight, int times) {
        for (int i = 0; i < times; i++) {
            cues.add(weight);
        }
    }

    private static String key(BlockTag tag, int offset) {
        return tag + "@" + offset;
    }

    private static Expr expression(Statement s) {
        if (s instanceof QuantifiedRule q) {
            return q.rule();
        }
        if (s instanceof Implication i) {
            return i.implication();
        }
        if (s instanceof Assertion a) {
            return a.expr();
        }
        if (s instanceof Definition d) {
            return d.body();
        }
        // evidence tuples carry no propositions
        return null;
    }

    private static void forEachExpr(Expr e, Consumer<Expr> visitor) {
        if (e == null) {
            return;
        }
        visitor.accept(e);
        if (e instanceof Binary b) {
            forEachExpr(b.left(), visitor);
            forEachExpr(b.right(), visitor);
        } else if (e instanceof Unary u) {
            forEachExpr(u.operand(), visitor);
        } else if (e instanceof Quantified q) {
            forEachExpr(q.domain(), visitor);
            forEachExpr(q.body(), visitor);
        } else if (e instanceof Application a) {
            forEachExpr(a.function(), visitor);
            a.args().forEach(x -> forEachExpr(x, visitor));
        } else if (e instanceof Lambda l) {
            forEachExpr(l.body(), visitor);
        } else if (e instanceof Tuple t) {
            t.elements().forEach(x -> forEachExpr(x, visitor));
        } else if (e instanceof Enumeration en) {
            en.elements().forEach(x -> forEachExpr(x, visitor));
        } else if (e instanceof Power p) {
            forEachExpr(p.base(), visitor);
        }
    }
}
