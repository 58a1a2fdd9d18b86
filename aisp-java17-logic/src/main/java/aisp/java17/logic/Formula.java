package aisp.java17.logic;

import aisp.java17.logic.Term.Var;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Logical formula IR shared by the SMT engine and the natural-deduction prover.
///
/// Every node reports its [Kind] so consumers can switch exhaustively on JDK 17 without
/// pattern matching over types. Nodes are immutable and safe to share between threads.
public sealed interface Formula permits
        Formula.Forall,
        Formula.Exists,
        Formula.Implies,
        Formula.Iff,
        Formula.And,
        Formula.Or,
        Formula.Not,
        Formula.Atom,
        Formula.Definition,
        Formula.Literal {

    enum Kind { FORALL, EXISTS, IMPLIES, IFF, AND, OR, NOT, ATOM, DEFINITION, LITERAL }

    Kind kind();

    record Forall(Var variable, Formula body) implements Formula {
        public Forall {
            Objects.requireNonNull(variable, "variable must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.FORALL;
        }
    }

    record Exists(Var variable, Formula body) implements Formula {
        public Exists {
            Objects.requireNonNull(variable, "variable must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.EXISTS;
        }
    }

    record Implies(Formula antecedent, Formula consequent) implements Formula {
        public Implies {
            Objects.requireNonNull(antecedent, "antecedent must not be null");
            Objects.requireNonNull(consequent, "consequent must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.IMPLIES;
        }
    }

    record Iff(Formula left, Formula right) implements Formula {
        public Iff {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.IFF;
        }
    }

    record And(List<Formula> conjuncts) implements Formula {
        public And {
            Objects.requireNonNull(conjuncts, "conjuncts must not be null");
            conjuncts = List.copyOf(conjuncts); // defensive copy
        }

        @Override
        public Kind kind() {
            return Kind.AND;
        }
    }

    record Or(List<Formula> disjuncts) implements Formula {
        public Or {
            Objects.requireNonNull(disjuncts, "disjuncts must not be null");
            disjuncts = List.copyOf(disjuncts); // defensive copy
        }

        @Override
        public Kind kind() {
            return Kind.OR;
        }
    }

    record Not(Formula operand) implements Formula {
        public Not {
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.NOT;
        }
    }

    /// Predicate application. Interpreted predicates are the comparisons `= < <= > >=`,
    /// `member`, `subset` and `holds` (a Boolean term used as a formula).
    record Atom(String predicate, List<Term> args) implements Formula {
        public static final String EQ = "=";
        public static final String LT = "<";
        public static final String LE = "<=";
        public static final String GT = ">";
        public static final String GE = ">=";
        public static final String MEMBER = "member";
        public static final String SUBSET = "subset";
        public static final String HOLDS = "holds";

        public Atom {
            Objects.requireNonNull(predicate, "predicate must not be null");
            Objects.requireNonNull(args, "args must not be null");
            args = List.copyOf(args); // defensive copy
        }

        public static Atom of(String predicate, Term... args) {
            return new Atom(predicate, List.of(args));
        }

        public boolean isComparison() {
            return switch (predicate) {
                case EQ, LT, LE, GT, GE -> args.size() == 2;
                default -> false;
            };
        }

        @Override
        public Kind kind() {
            return Kind.ATOM;
        }
    }

    /// Context definition `name(params) ≜ body`.
    ///
    /// A predicate definition states `name(params) ⇔ body` and may be inlined. A value
    /// definition carries its defining equation as `body` and is used as an assumption.
    record Definition(String name, List<Var> params, Formula body, boolean predicate) implements Formula {
        public Definition {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(params, "params must not be null");
            Objects.requireNonNull(body, "body must not be null");
            params = List.copyOf(params); // defensive copy
        }

        /// The definition as a closed axiom.
        public Formula asAxiom() {
            Formula axiom = predicate
                ? new Iff(new Atom(name, new ArrayList<>(params)), body)
                : body;
            for (int i = params.size() - 1; i >= 0; i--) {
                axiom = new Forall(params.get(i), axiom);
            }
            return axiom;
        }

        @Override
        public Kind kind() {
            return Kind.DEFINITION;
        }
    }

    record Literal(boolean value) implements Formula {
        public static final Literal TRUE = new Literal(true);
        public static final Literal FALSE = new Literal(false);

        @Override
        public Kind kind() {
            return Kind.LITERAL;
        }
    }

    /// Conjunction that flattens nested `And` and collapses trivial cases.
    static Formula and(List<Formula> parts) {
        final var flat = new ArrayList<Formula>();
        for (Formula f : parts) {
            if (f instanceof And a) {
                flat.addAll(a.conjuncts());
            } else if (f.equals(Literal.FALSE)) {
                return Literal.FALSE;
            } else if (!f.equals(Literal.TRUE)) {
                flat.add(f);
            }
        }
        if (flat.isEmpty()) {
            return Literal.TRUE;
        }
        return flat.size() == 1 ? flat.get(0) : new And(flat);
    }

    static Formula or(List<Formula> parts) {
        final var flat = new ArrayList<Formula>();
        for (Formula f : parts) {
            if (f instanceof Or o) {
                flat.addAll(o.disjuncts());
            } else if (f.equals(Literal.TRUE)) {
                return Literal.TRUE;
            } else if (!f.equals(Literal.FALSE)) {
                flat.add(f);
            }
        }
        if (flat.isEmpty()) {
            return Literal.FALSE;
        }
        return flat.size() == 1 ? flat.get(0) : new Or(flat);
    }

    static Formula and(Formula... parts) {
        return and(List.of(parts));
    }

    static Formula or(Formula... parts) {
        return or(List.of(parts));
    }
}
