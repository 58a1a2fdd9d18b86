package aisp.java17.logic;

import aisp.java17.logic.Formula.And;
import aisp.java17.logic.Formula.Atom;
import aisp.java17.logic.Formula.Definition;
import aisp.java17.logic.Formula.Exists;
import aisp.java17.logic.Formula.Forall;
import aisp.java17.logic.Formula.Literal;
import aisp.java17.logic.Formula.Not;
import aisp.java17.logic.Formula.Or;
import aisp.java17.logic.Term.Apply;
import aisp.java17.logic.Term.Constant;
import aisp.java17.logic.Term.Numeral;
import aisp.java17.logic.Term.Var;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.UnaryOperator;

import static aisp.java17.logic.LogicLogging.LOG;

/// In-process refutation prover used when no external solver is available.
///
/// The negated goal and the assumptions are inlined, put in negation normal form and
/// skolemized. Universal quantifiers are then instantiated over the ground terms of matching
/// sort, and the ground problem is decided by DPLL with a theory of equalities and linear
/// single-term bounds.
///
/// Refutation is sound: `unsat` is reported as [Verdict.Proven]. A model is only trusted as a
/// counterexample when nothing was approximated; otherwise the answer is
/// [UnknownReason#INCOMPLETE].
public final class BuiltinBackend implements SmtBackend {

    static final int MAX_INSTANCES = 5_000;
    static final int INLINE_DEPTH = 8;
    static final int INSTANTIATION_ROUNDS = 2;

    @Override
    public String name() {
        return "builtin";
    }

    @Override
    public Verdict check(Obligation obligation, Deadline deadline) {
        final String script = SmtLibEmitter.validityScript(obligation);
        final String goal = Formulas.render(obligation.goal());
        final var search = new Search(deadline);
        final long started = System.nanoTime();
        try {
            final boolean sat = search.refute(obligation);
            StructuredLog.fine(LOG, "builtin.done", "obligation", obligation.id(), "sat", sat,
                "atoms", search.atoms.size(), "clauses", search.clauses.size(),
                "ms", (System.nanoTime() - started) / 1_000_000);
            if (!sat) {
                return new Verdict.Proven(new ProofObject.SmtCertificate(
                    "unsat", name(), script, obligation.assumptionNames(), "", goal));
            }
            if (!search.incomplete.isEmpty()) {
                return Verdict.unknown(UnknownReason.INCOMPLETE,
                    "model found under approximation: " + String.join(", ", search.incomplete));
            }
            final String model = search.model();
            return new Verdict.Disproven(model, new ProofObject.SmtCertificate(
                "sat", name(), script, obligation.assumptionNames(), model, goal));
        } catch (SearchAbortedException e) {
            StructuredLog.fine(LOG, "builtin.aborted", "obligation", obligation.id(), "reason", e.reason());
            final String detail = e.reason() == UnknownReason.TIMEOUT
                ? "builtin solver ran out of time" : "builtin solver was interrupted";
            return Verdict.unknown(e.reason(), detail);
        }
    }

    /// One refutation attempt. Not thread safe; each check gets its own instance.
    private static final class Search {
        private final Deadline deadline;
        final Set<String> incomplete = new TreeSet<>();
        final List<Atom> atoms = new ArrayList<>();
        final List<int[]> clauses = new ArrayList<>();
        private final Map<Atom, Integer> atomIds = new HashMap<>();
        private final Map<Sort, Constant> witnesses = new HashMap<>();
        private int skolems;
        private int instances;
        private int vars;
        private int[] value;
        private Theory theory;

        Search(Deadline deadline) {
            this.deadline = deadline;
        }

        /// @return `true` when the assumptions together with the negated goal are satisfiable
        boolean refute(Obligation obligation) {
            final var predicates = new HashMap<String, Definition>();
            final var parts = new ArrayList<Formula>();
            for (Axiom a : obligation.assumptions()) {
                if (a.formula() instanceof Definition d && d.predicate()) {
                    predicates.putIfAbsent(d.name(), d);
                } else {
                    parts.add(a.formula() instanceof Definition d ? d.asAxiom() : a.formula());
                }
            }
            parts.add(new Not(obligation.goal()));
            Formula f = inline(Formula.and(parts), predicates, 0);
            f = expandSets(f);
            f = skolemize(Formulas.nnf(f, false), List.of());
            final Formula ground = simplify(instantiate(f));
            deadline.check();
            if (ground instanceof Literal l) {
                return l.value();
            }
            encode(ground);
            theory = new Theory(atoms);
            return dpll();
        }

        // ========== preprocessing ==========

        private Formula inline(Formula f, Map<String, Definition> predicates, int depth) {
            if (predicates.isEmpty()) {
                return f;
            }
            deadline.check();
            return switch (f.kind()) {
                case FORALL -> new Forall(((Forall) f).variable(), inline(((Forall) f).body(), predicates, depth));
                case EXISTS -> new Exists(((Exists) f).variable(), inline(((Exists) f).body(), predicates, depth));
                case IMPLIES -> new Formula.Implies(inline(((Formula.Implies) f).antecedent(), predicates, depth),
                    inline(((Formula.Implies) f).consequent(), predicates, depth));
                case IFF -> new Formula.Iff(inline(((Formula.Iff) f).left(), predicates, depth),
                    inline(((Formula.Iff) f).right(), predicates, depth));
                case AND -> Formula.and(mapAll(((And) f).conjuncts(), x -> inline(x, predicates, depth)));
                case OR -> Formula.or(mapAll(((Or) f).disjuncts(), x -> inline(x, predicates, depth)));
                case NOT -> new Not(inline(((Not) f).operand(), predicates, depth));
                case ATOM -> {
                    final var a = (Atom) f;
                    final Definition d = predicates.get(a.predicate());
                    if (d == null || d.params().size() != a.args().size()) {
                        yield f;
                    }
                    if (depth >= INLINE_DEPTH) {
                        incomplete.add("definition depth");
                        yield f;
                    }
                    yield inline(Formulas.instantiate(d.body(), d.params(), a.args()), predicates, depth + 1);
                }
                case DEFINITION -> inline(((Definition) f).asAxiom(), predicates, depth);
                case LITERAL -> f;
            };
        }

        private Formula expandSets(Formula f) {
            return switch (f.kind()) {
                case FORALL -> new Forall(((Forall) f).variable(), expandSets(((Forall) f).body()));
                case EXISTS -> new Exists(((Exists) f).variable(), expandSets(((Exists) f).body()));
                case IMPLIES -> new Formula.Implies(expandSets(((Formula.Implies) f).antecedent()),
                    expandSets(((Formula.Implies) f).consequent()));
                case IFF -> new Formula.Iff(expandSets(((Formula.Iff) f).left()), expandSets(((Formula.Iff) f).right()));
                case AND -> Formula.and(mapAll(((And) f).conjuncts(), this::expandSets));
                case OR -> Formula.or(mapAll(((Or) f).disjuncts(), this::expandSets));
                case NOT -> new Not(expandSets(((Not) f).operand()));
                case ATOM -> member((Atom) f);
                case DEFINITION, LITERAL -> f;
            };
        }

        private Formula member(Atom a) {
            if (!Atom.MEMBER.equals(a.predicate()) || a.args().size() != 2) {
                return a;
            }
            final Term x = a.args().get(0);
            final Term set = a.args().get(1);
            if (set instanceof Constant c && "empty".equals(c.name()) && c.sort().equals(Sort.SET)) {
                return Literal.FALSE;
            }
            if (!(set instanceof Apply s)) {
                return a;
            }
            final List<Term> args = s.args();
            return switch (s.function()) {
                case "union" -> args.size() == 2
                    ? Formula.or(member(Atom.of(Atom.MEMBER, x, args.get(0))), member(Atom.of(Atom.MEMBER, x, args.get(1))))
                    : a;
                case "inter" -> args.size() == 2
                    ? Formula.and(member(Atom.of(Atom.MEMBER, x, args.get(0))), member(Atom.of(Atom.MEMBER, x, args.get(1))))
                    : a;
                case "diff" -> args.size() == 2
                    ? Formula.and(member(Atom.of(Atom.MEMBER, x, args.get(0))),
                        new Not(member(Atom.of(Atom.MEMBER, x, args.get(1)))))
                    : a;
                case "set" -> {
                    final var cases = new ArrayList<Formula>();
                    args.forEach(e -> cases.add(Atom.of(Atom.EQ, x, e)));
                    yield Formula.or(cases);
                }
                default -> a;
            };
        }

        /// Replaces existentials of an NNF formula by Skolem constants or functions of the
        /// enclosing universals.
        private Formula skolemize(Formula f, List<Var> universals) {
            return switch (f.kind()) {
                case FORALL -> {
                    final var q = (Forall) f;
                    final var inner = new ArrayList<>(universals);
                    inner.add(q.variable());
                    yield new Forall(q.variable(), skolemize(q.body(), inner));
                }
                case EXISTS -> {
                    final var q = (Exists) f;
                    final Var v = q.variable();
                    final String name = "sk!" + (skolems++) + "_" + v.name();
                    final Term witness = universals.isEmpty()
                        ? new Constant(name, v.sort())
                        : new Apply(name, new ArrayList<>(universals), v.sort());
                    yield skolemize(Formulas.substitute(q.body(), v, witness), universals);
                }
                case AND -> Formula.and(mapAll(((And) f).conjuncts(), x -> skolemize(x, universals)));
                case OR -> Formula.or(mapAll(((Or) f).disjuncts(), x -> skolemize(x, universals)));
                default -> f;
            };
        }

        /// Grounds every universal over the current universe of terms, twice, so Skolem terms
        /// produced by the first round are themselves instantiated.
        private Formula instantiate(Formula f) {
            if (!hasUniversal(f)) {
                return f;
            }
            incomplete.add("universal instantiation");
            Formula ground = f;
            final var universe = new LinkedHashSet<>(Formulas.groundTerms(f));
            for (int round = 0; round < INSTANTIATION_ROUNDS; round++) {
                instances = 0;
                ground = ground(f, universe);
                universe.addAll(Formulas.groundTerms(ground));
            }
            return ground;
        }

        private Formula ground(Formula f, Set<Term> universe) {
            deadline.check();
            return switch (f.kind()) {
                case FORALL -> {
                    final var q = (Forall) f;
                    final var candidates = new ArrayList<Term>();
                    for (Term t : universe) {
                        if (q.variable().sort().accepts(t.sort())) {
                            candidates.add(t);
                        }
                    }
                    if (candidates.isEmpty()) {
                        // sorts are non-empty
                        candidates.add(witnesses.computeIfAbsent(q.variable().sort(),
                            s -> new Constant("any!" + s.name(), s)));
                    }
                    final var parts = new ArrayList<Formula>();
                    for (Term t : candidates) {
                        if (instances >= MAX_INSTANCES) {
                            incomplete.add("instance limit");
                            break;
                        }
                        instances++;
                        parts.add(ground(Formulas.substitute(q.body(), q.variable(), t), universe));
                    }
                    yield Formula.and(parts);
                }
                case AND -> Formula.and(mapAll(((And) f).conjuncts(), x -> ground(x, universe)));
                case OR -> Formula.or(mapAll(((Or) f).disjuncts(), x -> ground(x, universe)));
                default -> f;
            };
        }

        private static boolean hasUniversal(Formula f) {
            return switch (f.kind()) {
                case FORALL -> true;
                case AND -> ((And) f).conjuncts().stream().anyMatch(Search::hasUniversal);
                case OR -> ((Or) f).disjuncts().stream().anyMatch(Search::hasUniversal);
                default -> false;
            };
        }

        /// Folds ground comparisons that need no search.
        private Formula simplify(Formula f) {
            return switch (f.kind()) {
                case AND -> Formula.and(mapAll(((And) f).conjuncts(), this::simplify));
                case OR -> Formula.or(mapAll(((Or) f).disjuncts(), this::simplify));
                case NOT -> {
                    final Formula inner = simplify(((Not) f).operand());
                    yield Formulas.negate(inner);
                }
                case ATOM -> {
                    final Boolean v = Theory.evaluate((Atom) f);
                    yield v == null ? f : (v ? Literal.TRUE : Literal.FALSE);
                }
                default -> f;
            };
        }

        // ========== CNF ==========

        /// Plaisted-Greenbaum encoding of a quantifier-free NNF formula.
        private void encode(Formula root) {
            if (root instanceof And a) {
                a.conjuncts().forEach(c -> clauses.add(new int[] {literal(c)}));
            } else {
                clauses.add(new int[] {literal(root)});
            }
        }

        private int literal(Formula f) {
            deadline.check();
            return switch (f.kind()) {
                case ATOM -> atomVar((Atom) f);
                case NOT -> -literal(((Not) f).operand());
                case AND -> {
                    final int v = ++vars;
                    for (Formula c : ((And) f).conjuncts()) {
                        clauses.add(new int[] {-v, literal(c)});
                    }
                    yield v;
                }
                case OR -> {
                    final int v = ++vars;
                    final List<Formula> ds = ((Or) f).disjuncts();
                    final int[] clause = new int[ds.size() + 1];
                    clause[0] = -v;
                    for (int i = 0; i < ds.size(); i++) {
                        clause[i + 1] = literal(ds.get(i));
                    }
                    clauses.add(clause);
                    yield v;
                }
                case LITERAL -> {
                    final int v = ++vars;
                    clauses.add(new int[] {((Literal) f).value() ? v : -v});
                    yield v;
                }
                default -> throw new IllegalStateException("not in ground NNF: " + Formulas.render(f));
            };
        }

        private int atomVar(Atom a) {
            final Integer id = atomIds.get(a);
            if (id != null) {
                return id;
            }
            final int v = ++vars;
            atomIds.put(a, v);
            while (atoms.size() < v) {
                atoms.add(null);
            }
            atoms.add(a);
            return v;
        }

        // ========== DPLL ==========

        private boolean dpll() {
            value = new int[vars + 1];
            final int[] trail = new int[vars + 1];
            final int[] size = {0};
            // decision: trail size before it, literal, flipped
            final Deque<int[]> decisions = new ArrayDeque<>();
            while (true) {
                deadline.check();
                final boolean conflict = !propagate(trail, size) || !theory.consistent(value, null);
                if (conflict) {
                    while (!decisions.isEmpty() && decisions.peek()[2] == 1) {
                        undo(trail, size, decisions.pop()[0]);
                    }
                    if (decisions.isEmpty()) {
                        return false;
                    }
                    final int[] d = decisions.peek();
                    undo(trail, size, d[0]);
                    d[2] = 1;
                    assign(-d[1], trail, size);
                    continue;
                }
                final int next = unassigned();
                if (next == 0) {
                    theory.consistent(value, incomplete);
                    return true;
                }
                decisions.push(new int[] {size[0], next, 0});
                assign(next, trail, size);
            }
        }

        private boolean propagate(int[] trail, int[] size) {
            boolean changed = true;
            while (changed) {
                deadline.check();
                changed = false;
                for (int[] clause : clauses) {
                    int open = 0;
                    int last = 0;
                    boolean satisfied = false;
                    for (int lit : clause) {
                        final int v = value[Math.abs(lit)];
                        if (v == 0) {
                            open++;
                            last = lit;
                        } else if ((v > 0) == (lit > 0)) {
                            satisfied = true;
                            break;
                        }
                    }
                    if (satisfied) {
                        continue;
                    }
                    if (open == 0) {
                        return false;
                    }
                    if (open == 1) {
                        assign(last, trail, size);
                        changed = true;
                    }
                }
            }
            return true;
        }

        private void assign(int lit, int[] trail, int[] size) {
            value[Math.abs(lit)] = lit > 0 ? 1 : -1;
            trail[size[0]++] = Math.abs(lit);
        }

        private void undo(int[] trail, int[] size, int to) {
            while (size[0] > to) {
                value[trail[--size[0]]] = 0;
            }
        }

        private int unassigned() {
            for (int v = 1; v <= vars; v++) {
                if (value[v] == 0) {
                    return v;
                }
            }
            return 0;
        }

        String model() {
            final var parts = new ArrayList<String>();
            for (int v = 1; v < atoms.size() && parts.size() < 50; v++) {
                final Atom a = atoms.get(v);
                if (a != null && value[v] != 0) {
                    parts.add(value[v] > 0 ? Formulas.render(a) : "¬" + Formulas.render(a));
                }
            }
            return parts.isEmpty() ? "⊤" : String.join("; ", parts);
        }

        private static List<Formula> mapAll(List<Formula> fs, UnaryOperator<Formula> op) {
            final var out = new ArrayList<Formula>(fs.size());
            fs.forEach(f -> out.add(op.apply(f)));
            return out;
        }
    }

    /// Equalities and linear single-term bounds over the assigned comparison atoms.
    static final class Theory {
        private static final MathContext MC = MathContext.DECIMAL128;
        private static final int ENUMERABLE_GAP = 64;

        private enum Shape { PAIR, SINGLE, OPAQUE, NONE }

        private record Constraint(Shape shape, Term left, Term right, BigDecimal bound, String op) {}

        private record Linear(Map<Term, BigDecimal> terms, BigDecimal constant) {}

        private final Map<Integer, Constraint> constraints = new LinkedHashMap<>();
        private final boolean uninterpretedStructure;

        Theory(List<Atom> atoms) {
            boolean structure = false;
            for (int v = 1; v < atoms.size(); v++) {
                final Atom a = atoms.get(v);
                if (a == null) {
                    continue;
                }
                if (a.isComparison()) {
                    constraints.put(v, constraint(a));
                } else if (!a.args().isEmpty()) {
                    structure = true;
                }
                if (a.args().stream().anyMatch(Theory::hasUninterpretedApply)) {
                    structure = true;
                }
            }
            this.uninterpretedStructure = structure;
        }

        private static boolean hasUninterpretedApply(Term t) {
            return t instanceof Apply a && (!a.isArithmetic() || a.args().stream().anyMatch(Theory::hasUninterpretedApply));
        }

        /// Truth value of a comparison that needs no assignment, or `null`.
        static Boolean evaluate(Atom a) {
            if (!a.isComparison()) {
                return null;
            }
            final Term l = a.args().get(0);
            final Term r = a.args().get(1);
            if (l.equals(r)) {
                return switch (a.predicate()) {
                    case Atom.EQ, Atom.LE, Atom.GE -> true;
                    default -> false;
                };
            }
            if (Atom.EQ.equals(a.predicate()) && isValue(l) && isValue(r) && !(l instanceof Numeral && r instanceof Numeral)) {
                return false;
            }
            if (!l.sort().numeric() || !r.sort().numeric()) {
                return null;
            }
            final Linear diff = difference(l, r);
            if (diff == null || !diff.terms().isEmpty()) {
                return null;
            }
            return holds(diff.constant().signum(), a.predicate());
        }

        private static boolean holds(int sign, String op) {
            return switch (op) {
                case Atom.EQ -> sign == 0;
                case Atom.LT -> sign < 0;
                case Atom.LE -> sign <= 0;
                case Atom.GT -> sign > 0;
                default -> sign >= 0;
            };
        }

        private static boolean isValue(Term t) {
            return t instanceof Numeral
                || t instanceof Constant c && c.sort().equals(Sort.STRING) && c.name().startsWith("\"");
        }

        private static Constraint constraint(Atom a) {
            final Term l = a.args().get(0);
            final Term r = a.args().get(1);
            if (!l.sort().numeric() || !r.sort().numeric()) {
                return Atom.EQ.equals(a.predicate())
                    ? new Constraint(Shape.PAIR, l, r, null, Atom.EQ)
                    : new Constraint(Shape.OPAQUE, l, r, null, a.predicate());
            }
            final Linear diff = difference(l, r);
            if (diff == null) {
                return new Constraint(Shape.OPAQUE, l, r, null, a.predicate());
            }
            if (diff.terms().isEmpty()) {
                return new Constraint(Shape.NONE, l, r, diff.constant(), a.predicate());
            }
            if (diff.terms().size() == 1) {
                final var e = diff.terms().entrySet().iterator().next();
                final BigDecimal c = e.getValue();
                final BigDecimal bound = diff.constant().negate().divide(c, MC);
                final String op = c.signum() < 0 ? flip(a.predicate()) : a.predicate();
                return new Constraint(Shape.SINGLE, e.getKey(), null, bound, op);
            }
            if (diff.terms().size() == 2 && diff.constant().signum() == 0 && Atom.EQ.equals(a.predicate())) {
                final var it = diff.terms().entrySet().iterator();
                final var x = it.next();
                final var y = it.next();
                if (x.getValue().add(y.getValue()).signum() == 0) {
                    return new Constraint(Shape.PAIR, x.getKey(), y.getKey(), null, Atom.EQ);
                }
            }
            return new Constraint(Shape.OPAQUE, l, r, null, a.predicate());
        }

        private static String flip(String op) {
            return switch (op) {
                case Atom.LT -> Atom.GT;
                case Atom.LE -> Atom.GE;
                case Atom.GT -> Atom.LT;
                case Atom.GE -> Atom.LE;
                default -> op;
            };
        }

        private static String negateOp(String op) {
            return switch (op) {
                case Atom.LT -> Atom.GE;
                case Atom.LE -> Atom.GT;
                case Atom.GT -> Atom.LE;
                case Atom.GE -> Atom.LT;
                case Atom.EQ -> "!=";
                default -> "!" + op;
            };
        }

        private static Linear difference(Term l, Term r) {
            final Linear a = linear(l);
            final Linear b = linear(r);
            if (a == null || b == null) {
                return null;
            }
            return add(a, scale(b, BigDecimal.ONE.negate()));
        }

        private static Linear linear(Term t) {
            if (t instanceof Numeral n) {
                return new Linear(Map.of(), n.value());
            }
            if (t instanceof Apply a && a.isArithmetic()) {
                final List<Term> args = a.args();
                switch (a.function()) {
                    case "neg" -> {
                        final Linear x = args.size() == 1 ? linear(args.get(0)) : null;
                        return x == null ? null : scale(x, BigDecimal.ONE.negate());
                    }
                    case "+", "-" -> {
                        if (args.size() != 2) {
                            return atomic(t);
                        }
                        final Linear x = linear(args.get(0));
                        final Linear y = linear(args.get(1));
                        if (x == null || y == null) {
                            return null;
                        }
                        return add(x, "+".equals(a.function()) ? y : scale(y, BigDecimal.ONE.negate()));
                    }
                    case "*" -> {
                        if (args.size() != 2) {
                            return atomic(t);
                        }
                        final Linear x = linear(args.get(0));
                        final Linear y = linear(args.get(1));
                        if (x != null && y != null && x.terms().isEmpty()) {
                            return scale(y, x.constant());
                        }
                        if (x != null && y != null && y.terms().isEmpty()) {
                            return scale(x, y.constant());
                        }
                        return atomic(t);
                    }
                    case "/" -> {
                        if (args.size() != 2) {
                            return atomic(t);
                        }
                        final Linear x = linear(args.get(0));
                        final Linear y = linear(args.get(1));
                        if (x != null && y != null && y.terms().isEmpty() && y.constant().signum() != 0) {
                            return scale(x, BigDecimal.ONE.divide(y.constant(), MC));
                        }
                        return atomic(t);
                    }
                    default -> {
                        return atomic(t);
                    }
                }
            }
            return atomic(t);
        }

        private static Linear atomic(Term t) {
            return new Linear(Map.of(t, BigDecimal.ONE), BigDecimal.ZERO);
        }

        private static Linear scale(Linear x, BigDecimal k) {
            final var terms = new LinkedHashMap<Term, BigDecimal>();
            x.terms().forEach((t, c) -> {
                final BigDecimal v = c.multiply(k, MC);
                if (v.signum() != 0) {
                    terms.put(t, v);
                }
            });
            return new Linear(terms, x.constant().multiply(k, MC));
        }

        private static Linear add(Linear x, Linear y) {
            final var terms = new LinkedHashMap<>(x.terms());
            y.terms().forEach((t, c) -> terms.merge(t, c, BigDecimal::add));
            terms.values().removeIf(c -> c.signum() == 0);
            return new Linear(terms, x.constant().add(y.constant()));
        }

        /// Whether the assigned constraints are jointly satisfiable. When `approximations` is
        /// given, the constraints the check could not decide are recorded there.
        boolean consistent(int[] value, Set<String> approximations) {
            final var parent = new HashMap<Term, Term>();
            final var disequal = new ArrayList<Term[]>();
            final var singles = new ArrayList<Constraint>();
            for (var e : constraints.entrySet()) {
                final int v = value[e.getKey()];
                if (v == 0) {
                    continue;
                }
                final Constraint c = e.getValue();
                final boolean positive = v > 0;
                switch (c.shape()) {
                    case PAIR -> {
                        if (positive) {
                            union(parent, c.left(), c.right());
                            if (approximations != null && uninterpretedStructure) {
                                approximations.add("congruence");
                            }
                        } else {
                            disequal.add(new Term[] {c.left(), c.right()});
                        }
                    }
                    case SINGLE -> singles.add(positive ? c
                        : new Constraint(Shape.SINGLE, c.left(), null, c.bound(), negateOp(c.op())));
                    case NONE -> {
                        if (holds(c.bound().signum(), c.op()) != positive) {
                            return false;
                        }
                    }
                    case OPAQUE -> {
                        if (approximations != null) {
                            approximations.add("non-linear arithmetic");
                        }
                    }
                }
            }
            final var ranges = new HashMap<Term, Range>();
            for (Term t : new ArrayList<>(parent.keySet())) {
                final Range r = ranges.computeIfAbsent(find(parent, t), k -> new Range());
                r.integral |= t.sort().integral();
                if (isValue(t)) {
                    if (r.value != null && !r.value.equals(t)) {
                        return false;
                    }
                    r.value = t;
                }
            }
            for (Constraint c : singles) {
                final Range r = ranges.computeIfAbsent(find(parent, c.left()), k -> new Range());
                r.integral |= c.left().sort().integral();
                r.constrain(c.op(), c.bound());
            }
            for (Range r : ranges.values()) {
                if (r.value instanceof Numeral n) {
                    r.constrain(Atom.EQ, n.value());
                }
                if (r.empty()) {
                    return false;
                }
            }
            for (Term[] pair : disequal) {
                final Term a = find(parent, pair[0]);
                final Term b = find(parent, pair[1]);
                if (a.equals(b)) {
                    return false;
                }
                final Range ra = ranges.get(a);
                final Range rb = ranges.get(b);
                if (ra != null && rb != null) {
                    final BigDecimal fa = ra.fixed();
                    final BigDecimal fb = rb.fixed();
                    if (fa != null && fb != null && fa.compareTo(fb) == 0) {
                        return false;
                    }
                }
            }
            return true;
        }

        private static Term find(Map<Term, Term> parent, Term t) {
            Term root = t;
            Term p;
            while ((p = parent.get(root)) != null && !p.equals(root)) {
                root = p;
            }
            parent.putIfAbsent(t, t);
            return root;
        }

        private static void union(Map<Term, Term> parent, Term a, Term b) {
            final Term ra = find(parent, a);
            final Term rb = find(parent, b);
            parent.putIfAbsent(ra, ra);
            parent.putIfAbsent(rb, rb);
            if (!ra.equals(rb)) {
                parent.put(ra, rb);
            }
        }
    }

    /// Feasible values of one equivalence class.
    private static final class Range {
        BigDecimal lo;
        boolean loStrict;
        BigDecimal hi;
        boolean hiStrict;
        final Set<BigDecimal> excluded = new HashSet<>();
        boolean integral;
        Term value;

        void constrain(String op, BigDecimal bound) {
            final BigDecimal b = bound.stripTrailingZeros();
            switch (op) {
                case Atom.EQ -> {
                    lower(b, false);
                    upper(b, false);
                }
                case Atom.LT -> upper(b, true);
                case Atom.LE -> upper(b, false);
                case Atom.GT -> lower(b, true);
                case Atom.GE -> lower(b, false);
                default -> excluded.add(b);
            }
        }

        private void lower(BigDecimal b, boolean strict) {
            final int cmp = lo == null ? 1 : b.compareTo(lo);
            if (cmp > 0 || cmp == 0 && strict) {
                lo = b;
                loStrict = strict;
            }
        }

        private void upper(BigDecimal b, boolean strict) {
            final int cmp = hi == null ? -1 : b.compareTo(hi);
            if (cmp < 0 || cmp == 0 && strict) {
                hi = b;
                hiStrict = strict;
            }
        }

        private BigDecimal tightLo() {
            if (lo == null || !integral) {
                return lo;
            }
            final BigDecimal floor = lo.setScale(0, RoundingMode.FLOOR);
            return loStrict ? floor.add(BigDecimal.ONE) : lo.setScale(0, RoundingMode.CEILING);
        }

        private BigDecimal tightHi() {
            if (hi == null || !integral) {
                return hi;
            }
            final BigDecimal ceil = hi.setScale(0, RoundingMode.CEILING);
            return hiStrict ? ceil.subtract(BigDecimal.ONE) : hi.setScale(0, RoundingMode.FLOOR);
        }

        BigDecimal fixed() {
            final BigDecimal l = tightLo();
            final BigDecimal h = tightHi();
            if (l == null || h == null || l.compareTo(h) != 0) {
                return null;
            }
            return !integral && (loStrict || hiStrict) ? null : l.stripTrailingZeros();
        }

        boolean empty() {
            final BigDecimal l = tightLo();
            final BigDecimal h = tightHi();
            if (l == null || h == null) {
                return false;
            }
            final int cmp = l.compareTo(h);
            if (cmp > 0) {
                return true;
            }
            if (!integral) {
                return cmp == 0 && (loStrict || hiStrict || excluded.contains(l.stripTrailingZeros()));
            }
            if (h.subtract(l).compareTo(BigDecimal.valueOf(Theory.ENUMERABLE_GAP)) > 0) {
                return false;
            }
            for (BigDecimal v = l; v.compareTo(h) <= 0; v = v.add(BigDecimal.ONE)) {
                if (!excluded.contains(v.stripTrailingZeros())) {
                    return false;
                }
            }
            return true;
        }
    }
}
