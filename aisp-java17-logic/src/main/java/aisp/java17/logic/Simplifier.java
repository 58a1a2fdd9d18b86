package aisp.java17.logic;

import aisp.java17.logic.Formula.And;
import aisp.java17.logic.Formula.Atom;
import aisp.java17.logic.Formula.Definition;
import aisp.java17.logic.Formula.Exists;
import aisp.java17.logic.Formula.Forall;
import aisp.java17.logic.Formula.Iff;
import aisp.java17.logic.Formula.Implies;
import aisp.java17.logic.Formula.Literal;
import aisp.java17.logic.Formula.Not;
import aisp.java17.logic.Formula.Or;
import aisp.java17.logic.Term.Apply;
import aisp.java17.logic.Term.Numeral;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// Equivalence-preserving reductions applied before retrying a query that timed out.
///
/// Folds constant arithmetic and comparisons, removes double negation and duplicate
/// conjuncts and disjuncts, and drops assumptions that share no symbol or sort with the goal.
public final class Simplifier {
    private Simplifier() {}

    public static Obligation simplify(Obligation obligation) {
        final Formula goal = simplify(obligation.goal());
        final var assumptions = new ArrayList<Axiom>(obligation.assumptions().size());
        obligation.assumptions().forEach(a -> assumptions.add(new Axiom(a.name(), simplify(a.formula()))));
        return new Obligation(obligation.id(), goal, relevant(goal, assumptions));
    }

    public static Formula simplify(Formula f) {
        return switch (f.kind()) {
            case FORALL -> {
                final var q = (Forall) f;
                final Formula body = simplify(q.body());
                yield body instanceof Literal ? body : new Forall(q.variable(), body);
            }
            case EXISTS -> {
                final var q = (Exists) f;
                final Formula body = simplify(q.body());
                yield body instanceof Literal ? body : new Exists(q.variable(), body);
            }
            case IMPLIES -> {
                final var i = (Implies) f;
                final Formula a = simplify(i.antecedent());
                final Formula c = simplify(i.consequent());
                if (a.equals(Literal.FALSE) || c.equals(Literal.TRUE) || a.equals(c)) {
                    yield Literal.TRUE;
                }
                if (a.equals(Literal.TRUE)) {
                    yield c;
                }
                yield c.equals(Literal.FALSE) ? Formulas.negate(a) : new Implies(a, c);
            }
            case IFF -> {
                final var i = (Iff) f;
                final Formula l = simplify(i.left());
                final Formula r = simplify(i.right());
                if (l.equals(r)) {
                    yield Literal.TRUE;
                }
                if (l instanceof Literal ll) {
                    yield ll.value() ? r : Formulas.negate(r);
                }
                if (r instanceof Literal rl) {
                    yield rl.value() ? l : Formulas.negate(l);
                }
                yield new Iff(l, r);
            }
            case AND -> Formula.and(dedupe(((And) f).conjuncts()));
            case OR -> Formula.or(dedupe(((Or) f).disjuncts()));
            case NOT -> {
                final Formula inner = simplify(((Not) f).operand());
                yield Formulas.negate(inner);
            }
            case ATOM -> atom((Atom) f);
            case DEFINITION -> {
                final var d = (Definition) f;
                yield new Definition(d.name(), d.params(), simplify(d.body()), d.predicate());
            }
            case LITERAL -> f;
        };
    }

    private static List<Formula> dedupe(List<Formula> parts) {
        final var out = new LinkedHashSet<Formula>();
        parts.forEach(p -> out.add(simplify(p)));
        return new ArrayList<>(out);
    }

    private static Formula atom(Atom a) {
        final var args = new ArrayList<Term>(a.args().size());
        a.args().forEach(t -> args.add(fold(t)));
        final Atom folded = new Atom(a.predicate(), args);
        if (folded.isComparison() && args.get(0) instanceof Numeral l && args.get(1) instanceof Numeral r) {
            final int cmp = l.value().compareTo(r.value());
            final boolean holds = switch (a.predicate()) {
                case Atom.EQ -> cmp == 0;
                case Atom.LT -> cmp < 0;
                case Atom.LE -> cmp <= 0;
                case Atom.GT -> cmp > 0;
                default -> cmp >= 0;
            };
            return holds ? Literal.TRUE : Literal.FALSE;
        }
        if (folded.isComparison() && args.get(0).equals(args.get(1))) {
            return switch (a.predicate()) {
                case Atom.EQ, Atom.LE, Atom.GE -> Literal.TRUE;
                default -> Literal.FALSE;
            };
        }
        return folded;
    }

    /// Constant folding of arithmetic over numerals.
    static Term fold(Term t) {
        if (!(t instanceof Apply a)) {
            return t;
        }
        final var args = new ArrayList<Term>(a.args().size());
        a.args().forEach(x -> args.add(fold(x)));
        if (a.isArithmetic() && args.stream().allMatch(x -> x instanceof Numeral)) {
            final BigDecimal result = evaluate(a.function(), args);
            if (result != null) {
                return new Numeral(result);
            }
        }
        return new Apply(a.function(), args, a.sort());
    }

    private static BigDecimal evaluate(String function, List<Term> args) {
        final BigDecimal x = ((Numeral) args.get(0)).value();
        if (args.size() == 1) {
            return "neg".equals(function) ? x.negate() : null;
        }
        final BigDecimal y = ((Numeral) args.get(1)).value();
        return switch (function) {
            case "+" -> x.add(y);
            case "-" -> x.subtract(y);
            case "*" -> x.multiply(y);
            case "/" -> y.signum() == 0 ? null : x.divide(y, MathContext.DECIMAL128);
            default -> null;
        };
    }

    /// Assumptions connected to the goal through shared symbols, transitively. Symbol-free
    /// assumptions such as domain axioms are kept when they share a sort with the goal.
    private static List<Axiom> relevant(Formula goal, List<Axiom> assumptions) {
        final Set<String> symbols = new HashSet<>(Formulas.symbols(goal));
        final Set<Sort> sorts = new HashSet<>(Formulas.sorts(goal));
        final var kept = new LinkedHashSet<Axiom>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Axiom a : assumptions) {
                if (kept.contains(a) || a.formula().equals(Literal.TRUE)) {
                    continue;
                }
                final Set<String> own = Formulas.symbols(a.formula());
                final Set<Sort> ownSorts = Formulas.sorts(a.formula());
                final boolean linked = own.stream().anyMatch(symbols::contains)
                    || ownSorts.stream().anyMatch(s -> !s.equals(Sort.OBJECT) && sorts.contains(s));
                if (linked) {
                    kept.add(a);
                    symbols.addAll(own);
                    sorts.addAll(ownSorts);
                    changed = true;
                }
            }
        }
        final var out = new ArrayList<Axiom>(kept.size());
        assumptions.forEach(a -> {
            if (kept.contains(a)) {
                out.add(a);
            }
        });
        return out;
    }
}
