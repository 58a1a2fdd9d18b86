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
import aisp.java17.logic.Term.Constant;
import aisp.java17.logic.Term.Numeral;
import aisp.java17.logic.Term.Var;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/// Structural operations over [Formula] and [Term]: canonical rendering, substitution,
/// symbol collection and negation normal form.
public final class Formulas {
    private Formulas() {}

    // ========== rendering ==========

    /// Canonical text of a formula. Equal formulas render equally, which makes the
    /// rendering usable as a cache key.
    public static String render(Formula f) {
        return switch (f.kind()) {
            case FORALL -> {
                final var q = (Forall) f;
                yield "∀" + q.variable().name() + ":" + q.variable().sort() + "." + render(q.body());
            }
            case EXISTS -> {
                final var q = (Exists) f;
                yield "∃" + q.variable().name() + ":" + q.variable().sort() + "." + render(q.body());
            }
            case IMPLIES -> {
                final var i = (Implies) f;
                yield "(" + render(i.antecedent()) + " ⇒ " + render(i.consequent()) + ")";
            }
            case IFF -> {
                final var i = (Iff) f;
                yield "(" + render(i.left()) + " ⇔ " + render(i.right()) + ")";
            }
            case AND -> ((And) f).conjuncts().stream().map(Formulas::render).collect(Collectors.joining(" ∧ ", "(", ")"));
            case OR -> ((Or) f).disjuncts().stream().map(Formulas::render).collect(Collectors.joining(" ∨ ", "(", ")"));
            case NOT -> "¬" + render(((Not) f).operand());
            case ATOM -> {
                final var a = (Atom) f;
                if (a.isComparison()) {
                    yield "(" + render(a.args().get(0)) + " " + a.predicate() + " " + render(a.args().get(1)) + ")";
                }
                if (Atom.HOLDS.equals(a.predicate()) && a.args().size() == 1) {
                    yield render(a.args().get(0));
                }
                yield a.predicate() + renderArgs(a.args());
            }
            case DEFINITION -> {
                final var d = (Definition) f;
                final String params = d.params().isEmpty() ? ""
                    : d.params().stream().map(Var::name).collect(Collectors.joining(",", "(", ")"));
                yield d.name() + params + " ≜ " + render(d.body());
            }
            case LITERAL -> ((Literal) f).value() ? "⊤" : "⊥";
        };
    }

    public static String render(Term t) {
        return switch (t.kind()) {
            case VAR -> ((Var) t).name();
            case CONSTANT -> ((Constant) t).name();
            case NUMERAL -> ((Numeral) t).value().toPlainString();
            case APPLY -> {
                final var a = (Apply) t;
                if ("neg".equals(a.function()) && a.args().size() == 1) {
                    yield "-" + render(a.args().get(0));
                }
                if (a.isArithmetic() && a.args().size() == 2) {
                    yield "(" + render(a.args().get(0)) + a.function() + render(a.args().get(1)) + ")";
                }
                yield a.function() + renderArgs(a.args());
            }
        };
    }

    private static String renderArgs(List<Term> args) {
        return args.stream().map(Formulas::render).collect(Collectors.joining(",", "(", ")"));
    }

    // ========== substitution ==========

    /// Replaces free occurrences of `v` by `replacement`.
    public static Formula substitute(Formula f, Var v, Term replacement) {
        return mapTerms(f, v, t -> substitute(t, v, replacement));
    }

    public static Term substitute(Term t, Var v, Term replacement) {
        return switch (t.kind()) {
            case VAR -> t.equals(v) ? replacement : t;
            case APPLY -> {
                final var a = (Apply) t;
                final var args = new ArrayList<Term>(a.args().size());
                a.args().forEach(arg -> args.add(substitute(arg, v, replacement)));
                yield new Apply(a.function(), args, a.sort());
            }
            case CONSTANT, NUMERAL -> t;
        };
    }

    /// Rebuilds `f` applying `op` to the top-level terms of every atom. Binders of `shadowed`
    /// stop the rewrite.
    private static Formula mapTerms(Formula f, Var shadowed, Function<Term, Term> op) {
        return switch (f.kind()) {
            case FORALL -> {
                final var q = (Forall) f;
                yield q.variable().equals(shadowed) ? f : new Forall(q.variable(), mapTerms(q.body(), shadowed, op));
            }
            case EXISTS -> {
                final var q = (Exists) f;
                yield q.variable().equals(shadowed) ? f : new Exists(q.variable(), mapTerms(q.body(), shadowed, op));
            }
            case IMPLIES -> {
                final var i = (Implies) f;
                yield new Implies(mapTerms(i.antecedent(), shadowed, op), mapTerms(i.consequent(), shadowed, op));
            }
            case IFF -> {
                final var i = (Iff) f;
                yield new Iff(mapTerms(i.left(), shadowed, op), mapTerms(i.right(), shadowed, op));
            }
            case AND -> new And(mapAll(((And) f).conjuncts(), shadowed, op));
            case OR -> new Or(mapAll(((Or) f).disjuncts(), shadowed, op));
            case NOT -> new Not(mapTerms(((Not) f).operand(), shadowed, op));
            case ATOM -> {
                final var a = (Atom) f;
                final var args = new ArrayList<Term>(a.args().size());
                a.args().forEach(t -> args.add(op.apply(t)));
                yield new Atom(a.predicate(), args);
            }
            case DEFINITION -> {
                final var d = (Definition) f;
                yield d.params().contains(shadowed) ? f
                    : new Definition(d.name(), d.params(), mapTerms(d.body(), shadowed, op), d.predicate());
            }
            case LITERAL -> f;
        };
    }

    private static List<Formula> mapAll(List<Formula> fs, Var shadowed, Function<Term, Term> op) {
        final var out = new ArrayList<Formula>(fs.size());
        fs.forEach(x -> out.add(mapTerms(x, shadowed, op)));
        return out;
    }

    /// Simultaneous substitution of definition parameters.
    static Formula instantiate(Formula body, List<Var> params, List<Term> args) {
        Formula out = body;
        // rename first so an argument mentioning a later parameter is not captured
        final var fresh = new ArrayList<Var>(params.size());
        for (int i = 0; i < params.size(); i++) {
            final Var p = params.get(i);
            final Var tmp = new Var(p.name() + "#" + i, p.sort());
            fresh.add(tmp);
            out = substitute(out, p, tmp);
        }
        for (int i = 0; i < fresh.size(); i++) {
            out = substitute(out, fresh.get(i), args.get(i));
        }
        return out;
    }

    // ========== symbols ==========

    /// Predicate, function and constant names occurring in `f`, excluding bound variables.
    public static Set<String> symbols(Formula f) {
        final var out = new LinkedHashSet<String>();
        collectSymbols(f, out);
        return out;
    }

    private static void collectSymbols(Formula f, Set<String> out) {
        if (f instanceof Definition d) {
            out.add(d.name());
        }
        visitAtoms(f, a -> {
            if (!a.isComparison() && !Atom.HOLDS.equals(a.predicate())) {
                out.add(a.predicate());
            }
            a.args().forEach(t -> collectSymbols(t, out));
        });
    }

    private static void collectSymbols(Term t, Set<String> out) {
        if (t instanceof Constant c) {
            out.add(c.name());
        } else if (t instanceof Apply a) {
            if (!a.isArithmetic()) {
                out.add(a.function());
            }
            a.args().forEach(arg -> collectSymbols(arg, out));
        }
    }

    /// Sorts of the variables and constants occurring in `f`.
    public static Set<Sort> sorts(Formula f) {
        final var out = new LinkedHashSet<Sort>();
        collectSorts(f, out);
        return out;
    }

    private static void collectSorts(Formula f, Set<Sort> out) {
        if (f instanceof Forall q) {
            out.add(q.variable().sort());
            collectSorts(q.body(), out);
        } else if (f instanceof Exists q) {
            out.add(q.variable().sort());
            collectSorts(q.body(), out);
        } else if (f instanceof Implies i) {
            collectSorts(i.antecedent(), out);
            collectSorts(i.consequent(), out);
        } else if (f instanceof Iff i) {
            collectSorts(i.left(), out);
            collectSorts(i.right(), out);
        } else if (f instanceof And a) {
            a.conjuncts().forEach(c -> collectSorts(c, out));
        } else if (f instanceof Or o) {
            o.disjuncts().forEach(c -> collectSorts(c, out));
        } else if (f instanceof Not n) {
            collectSorts(n.operand(), out);
        } else if (f instanceof Atom a) {
            a.args().forEach(t -> collectSorts(t, out));
        } else if (f instanceof Definition d) {
            d.params().forEach(p -> out.add(p.sort()));
            collectSorts(d.body(), out);
        }
    }

    private static void collectSorts(Term t, Set<Sort> out) {
        if (t instanceof Var || t instanceof Constant) {
            out.add(t.sort());
        } else if (t instanceof Apply a) {
            a.args().forEach(arg -> collectSorts(arg, out));
        }
    }

    /// Variable-free terms occurring in `f`, including subterms.
    static Set<Term> groundTerms(Formula f) {
        final var out = new LinkedHashSet<Term>();
        visitAtoms(f, a -> a.args().forEach(t -> collectGround(t, out)));
        return out;
    }

    private static void collectGround(Term t, Set<Term> out) {
        if (t instanceof Apply a) {
            a.args().forEach(arg -> collectGround(arg, out));
        }
        if (isGround(t)) {
            out.add(t);
        }
    }

    static boolean isGround(Term t) {
        if (t instanceof Var) {
            return false;
        }
        if (t instanceof Apply a) {
            return a.args().stream().allMatch(Formulas::isGround);
        }
        return true;
    }

    static void visitAtoms(Formula f, Consumer<Atom> visitor) {
        switch (f.kind()) {
            case FORALL -> visitAtoms(((Forall) f).body(), visitor);
            case EXISTS -> visitAtoms(((Exists) f).body(), visitor);
            case IMPLIES -> {
                visitAtoms(((Implies) f).antecedent(), visitor);
                visitAtoms(((Implies) f).consequent(), visitor);
            }
            case IFF -> {
                visitAtoms(((Iff) f).left(), visitor);
                visitAtoms(((Iff) f).right(), visitor);
            }
            case AND -> ((And) f).conjuncts().forEach(c -> visitAtoms(c, visitor));
            case OR -> ((Or) f).disjuncts().forEach(c -> visitAtoms(c, visitor));
            case NOT -> visitAtoms(((Not) f).operand(), visitor);
            case ATOM -> visitor.accept((Atom) f);
            case DEFINITION -> visitAtoms(((Definition) f).body(), visitor);
            case LITERAL -> { }
        }
    }

    // ========== normal forms ==========

    /// Negation normal form: implications and biconditionals expanded, negation pushed to atoms.
    /// Definitions are replaced by their closed axioms.
    static Formula nnf(Formula f, boolean negated) {
        return switch (f.kind()) {
            case FORALL -> {
                final var q = (Forall) f;
                final Formula body = nnf(q.body(), negated);
                yield negated ? new Exists(q.variable(), body) : new Forall(q.variable(), body);
            }
            case EXISTS -> {
                final var q = (Exists) f;
                final Formula body = nnf(q.body(), negated);
                yield negated ? new Forall(q.variable(), body) : new Exists(q.variable(), body);
            }
            case IMPLIES -> {
                final var i = (Implies) f;
                yield negated
                    ? Formula.and(nnf(i.antecedent(), false), nnf(i.consequent(), true))
                    : Formula.or(nnf(i.antecedent(), true), nnf(i.consequent(), false));
            }
            case IFF -> {
                final var i = (Iff) f;
                if (!negated) {
                    yield Formula.or(
                        Formula.and(nnf(i.left(), false), nnf(i.right(), false)),
                        Formula.and(nnf(i.left(), true), nnf(i.right(), true)));
                }
                yield Formula.or(
                    Formula.and(nnf(i.left(), false), nnf(i.right(), true)),
                    Formula.and(nnf(i.left(), true), nnf(i.right(), false)));
            }
            case AND -> {
                final var parts = new ArrayList<Formula>();
                ((And) f).conjuncts().forEach(c -> parts.add(nnf(c, negated)));
                yield negated ? Formula.or(parts) : Formula.and(parts);
            }
            case OR -> {
                final var parts = new ArrayList<Formula>();
                ((Or) f).disjuncts().forEach(c -> parts.add(nnf(c, negated)));
                yield negated ? Formula.and(parts) : Formula.or(parts);
            }
            case NOT -> nnf(((Not) f).operand(), !negated);
            case ATOM -> negated ? new Not(f) : f;
            case DEFINITION -> nnf(((Definition) f).asAxiom(), negated);
            case LITERAL -> ((Literal) f).value() != negated ? Literal.TRUE : Literal.FALSE;
        };
    }

    /// Logical negation with double negation removed.
    public static Formula negate(Formula f) {
        if (f instanceof Not n) {
            return n.operand();
        }
        if (f instanceof Literal l) {
            return l.value() ? Literal.FALSE : Literal.TRUE;
        }
        return new Not(f);
    }

    /// Definitions keyed by name; the first definition of a name wins.
    static Map<String, Definition> byName(List<Definition> defs) {
        final var out = new LinkedHashMap<String, Definition>();
        defs.forEach(d -> out.putIfAbsent(d.name(), d));
        return out;
    }
}
