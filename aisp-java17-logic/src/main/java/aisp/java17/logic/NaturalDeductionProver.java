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
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static aisp.java17.logic.LogicLogging.LOG;

/// Goal-directed natural-deduction prover.
///
/// The proof context is an arena of assumption frames linked to their parent by index, so a
/// context is just the index of its innermost frame. Introduction rules are tried on the goal
/// first, then elimination rules on the hypotheses in scope. Steps recorded by a branch that
/// fails are dropped, so the returned derivation only holds steps that were actually derived.
///
/// When the goal cannot be derived the prover tries its negation with the remaining budget.
public final class NaturalDeductionProver {

    public static final int DEFAULT_STEP_LIMIT = 10_000;
    static final int MAX_DEPTH = 24;
    private static final int MAX_WITNESSES = 16;

    private final int stepLimit;

    public NaturalDeductionProver() {
        this(DEFAULT_STEP_LIMIT);
    }

    public NaturalDeductionProver(int stepLimit) {
        if (stepLimit <= 0) {
            throw new IllegalArgumentException("stepLimit must be > 0");
        }
        this.stepLimit = stepLimit;
    }

    public Verdict prove(Obligation obligation) {
        return prove(obligation, Deadline.none());
    }

    /// @throws UnsupportedConstructException when the goal contains a shape without rules
    public Verdict prove(Obligation obligation, Deadline deadline) {
        Objects.requireNonNull(obligation, "obligation must not be null");
        Objects.requireNonNull(deadline, "deadline must not be null");
        requireSupported(obligation.goal());
        final var search = new Search(obligation, deadline, stepLimit);
        try {
            final List<ProofStep> proof = search.attempt(obligation.goal());
            if (proof != null) {
                StructuredLog.fine(LOG, "nd.proven", "obligation", obligation.id(), "steps", proof.size(),
                    "searched", search.ticks);
                return new Verdict.Proven(new ProofObject.DeductionTree(proof));
            }
            final Formula negated = Formulas.negate(obligation.goal());
            final List<ProofStep> refutation = search.attempt(negated);
            if (refutation != null) {
                StructuredLog.fine(LOG, "nd.disproven", "obligation", obligation.id(), "steps", refutation.size());
                return new Verdict.Disproven("derivation of " + Formulas.render(negated),
                    new ProofObject.DeductionTree(refutation));
            }
            return Verdict.unknown(UnknownReason.INCOMPLETE, "no derivation found in " + search.ticks + " steps");
        } catch (StepLimitException e) {
            StructuredLog.fine(LOG, "nd.step_limit", "obligation", obligation.id(), "limit", stepLimit);
            return Verdict.unknown(UnknownReason.STEP_LIMIT, "step limit " + stepLimit + " reached");
        } catch (SearchAbortedException e) {
            return Verdict.unknown(e.reason(), "natural deduction stopped: " + e.reason());
        }
    }

    static void requireSupported(Formula f) {
        switch (f.kind()) {
            case FORALL -> requireSupported(((Forall) f).body());
            case EXISTS -> requireSupported(((Exists) f).body());
            case IMPLIES -> {
                requireSupported(((Implies) f).antecedent());
                requireSupported(((Implies) f).consequent());
            }
            case IFF -> {
                requireSupported(((Iff) f).left());
                requireSupported(((Iff) f).right());
            }
            case AND -> ((And) f).conjuncts().forEach(NaturalDeductionProver::requireSupported);
            case OR -> ((Or) f).disjuncts().forEach(NaturalDeductionProver::requireSupported);
            case NOT -> requireSupported(((Not) f).operand());
            case ATOM -> {
                final var a = (Atom) f;
                if ("self_reference".equals(a.predicate())) {
                    throw new UnsupportedConstructException(f);
                }
            }
            case DEFINITION -> throw new UnsupportedConstructException(f);
            case LITERAL -> { }
        }
    }

    private static final class StepLimitException extends RuntimeException {
        private static final long serialVersionUID = 1L;

        StepLimitException() {
            super("step limit", null, false, false);
        }
    }

    /// An assumption frame: `hypothesis` was introduced by step `step` on top of `parent`.
    private record Frame(int parent, Formula hypothesis, int step) {}

    private record Goal(int context, Formula goal) {}

    private static final class Search {
        private static final int ROOT = -1;

        private final Deadline deadline;
        private final int limit;
        private final List<Frame> frames = new ArrayList<>();
        private final List<ProofStep> steps = new ArrayList<>();
        private final Set<Goal> active = new HashSet<>();
        private final Set<Integer> splitting = new HashSet<>();
        private final int axiomContext;
        private int fresh;
        int ticks;

        Search(Obligation obligation, Deadline deadline, int limit) {
            this.deadline = deadline;
            this.limit = limit;
            int ctx = ROOT;
            for (Axiom a : obligation.assumptions()) {
                final Formula f = a.formula() instanceof Definition d ? d.asAxiom() : a.formula();
                ctx = push(ctx, f, step(List.of(), "axiom", f, a.name()));
            }
            this.axiomContext = ctx;
        }

        /// Derivation of `goal` from the assumptions, or `null`.
        List<ProofStep> attempt(Formula goal) {
            final int stepMark = steps.size();
            final int frameMark = frames.size();
            final int r = prove(goal, axiomContext, 0);
            if (r < 0) {
                truncate(stepMark, frameMark);
                return null;
            }
            if (r != steps.size() - 1) {
                step(List.of(r), "assumption", goal, "reiteration");
            }
            final List<ProofStep> proof = List.copyOf(steps);
            truncate(stepMark, frameMark);
            return proof;
        }

        private int prove(Formula goal, int ctx, int depth) {
            tick();
            if (depth > MAX_DEPTH) {
                return -1;
            }
            final var key = new Goal(ctx, goal);
            if (!active.add(key)) {
                return -1;
            }
            try {
                final int direct = direct(goal, ctx);
                if (direct >= 0) {
                    return direct;
                }
                final int stepMark = steps.size();
                final int frameMark = frames.size();
                final int intro = introduce(goal, ctx, depth);
                if (intro >= 0) {
                    return intro;
                }
                truncate(stepMark, frameMark);
                final int elim = eliminate(goal, ctx, depth);
                if (elim >= 0) {
                    return elim;
                }
                truncate(stepMark, frameMark);
                return -1;
            } finally {
                active.remove(key);
            }
        }

        // ========== closing rules ==========

        private int direct(Formula goal, int ctx) {
            for (int i = ctx; i != ROOT; i = frames.get(i).parent()) {
                if (frames.get(i).hypothesis().equals(goal)) {
                    return frames.get(i).step();
                }
            }
            if (goal.equals(Literal.TRUE)) {
                return step(List.of(), "⊤-intro", goal, "");
            }
            final Boolean ground = evaluate(goal);
            if (Boolean.TRUE.equals(ground)) {
                return step(List.of(), "numeral evaluation", goal, "");
            }
            if (goal instanceof Atom a && a.isComparison()) {
                final Term l = a.args().get(0);
                final Term r = a.args().get(1);
                final String op = a.predicate();
                if (l.equals(r) && (Atom.EQ.equals(op) || Atom.LE.equals(op) || Atom.GE.equals(op))) {
                    return step(List.of(), "reflexivity", goal, "");
                }
                if (Atom.GE.equals(op) && l.sort().isNat() && r.equals(Numeral.of(0))) {
                    return step(List.of(), "axiom", goal, Axiom.NAT_DOMAIN);
                }
            }
            return -1;
        }

        private static Boolean evaluate(Formula f) {
            if (f instanceof Not n) {
                final Boolean inner = evaluate(n.operand());
                return inner == null ? null : !inner;
            }
            if (!(f instanceof Atom a) || !a.isComparison()) {
                return null;
            }
            final Formula folded = Simplifier.simplify(a);
            return folded instanceof Literal l && !a.args().get(0).equals(a.args().get(1)) ? l.value() : null;
        }

        // ========== introduction rules ==========

        private int introduce(Formula goal, int ctx, int depth) {
            return switch (goal.kind()) {
                case AND -> {
                    final var premises = new ArrayList<Integer>();
                    for (Formula c : ((And) goal).conjuncts()) {
                        final int p = prove(c, ctx, depth + 1);
                        if (p < 0) {
                            yield -1;
                        }
                        premises.add(p);
                    }
                    yield step(premises, "∧-intro", goal, "");
                }
                case OR -> {
                    final List<Formula> ds = ((Or) goal).disjuncts();
                    for (int i = 0; i < ds.size(); i++) {
                        final int stepMark = steps.size();
                        final int frameMark = frames.size();
                        final int p = prove(ds.get(i), ctx, depth + 1);
                        if (p >= 0) {
                            yield step(List.of(p), i == 0 ? "∨-intro-left" : "∨-intro-right", goal, "");
                        }
                        truncate(stepMark, frameMark);
                    }
                    yield -1;
                }
                case IMPLIES -> {
                    final var i = (Implies) goal;
                    final int hyp = step(List.of(), "assumption", i.antecedent(), "hypothesis");
                    final int child = push(ctx, i.antecedent(), hyp);
                    final int c = prove(i.consequent(), child, depth + 1);
                    yield c < 0 ? -1 : step(List.of(hyp, c), "→-intro", goal, "discharge hypothesis " + hyp);
                }
                case IFF -> {
                    final var i = (Iff) goal;
                    final int forward = prove(new Implies(i.left(), i.right()), ctx, depth + 1);
                    if (forward < 0) {
                        yield -1;
                    }
                    final int backward = prove(new Implies(i.right(), i.left()), ctx, depth + 1);
                    yield backward < 0 ? -1 : step(List.of(forward, backward), "↔-intro", goal, "");
                }
                case NOT -> {
                    final Formula operand = ((Not) goal).operand();
                    final int hyp = step(List.of(), "assumption", operand, "hypothesis");
                    final int child = push(ctx, operand, hyp);
                    final int bottom = prove(Literal.FALSE, child, depth + 1);
                    yield bottom < 0 ? -1 : step(List.of(hyp, bottom), "¬-intro", goal, "discharge hypothesis " + hyp);
                }
                case FORALL -> {
                    final var q = (Forall) goal;
                    final Constant c = new Constant(q.variable().name() + "'" + (fresh++), q.variable().sort());
                    final int p = prove(Formulas.substitute(q.body(), q.variable(), c), ctx, depth + 1);
                    yield p < 0 ? -1 : step(List.of(p), "∀-intro", goal, "fresh " + c.name());
                }
                case EXISTS -> {
                    final var q = (Exists) goal;
                    for (Term t : witnesses(q.variable().sort(), goal, ctx)) {
                        final int stepMark = steps.size();
                        final int frameMark = frames.size();
                        final int p = prove(Formulas.substitute(q.body(), q.variable(), t), ctx, depth + 1);
                        if (p >= 0) {
                            yield step(List.of(p), "∃-intro", goal, "witness " + Formulas.render(t));
                        }
                        truncate(stepMark, frameMark);
                    }
                    yield -1;
                }
                default -> -1;
            };
        }

        private List<Term> witnesses(Sort sort, Formula goal, int ctx) {
            final var terms = new LinkedHashSet<Term>();
            terms.addAll(Formulas.groundTerms(goal));
            for (int i = ctx; i != ROOT; i = frames.get(i).parent()) {
                terms.addAll(Formulas.groundTerms(frames.get(i).hypothesis()));
            }
            final var out = new ArrayList<Term>();
            for (Term t : terms) {
                if (sort.accepts(t.sort()) && out.size() < MAX_WITNESSES) {
                    out.add(t);
                }
            }
            return out;
        }

        // ========== elimination rules ==========

        private int eliminate(Formula goal, int ctx, int depth) {
            for (int i = ctx; i != ROOT; i = frames.get(i).parent()) {
                final Frame frame = frames.get(i);
                final int stepMark = steps.size();
                final int frameMark = frames.size();
                final int r = useHypothesis(frame, i, goal, ctx, depth);
                if (r >= 0) {
                    return r;
                }
                truncate(stepMark, frameMark);
            }
            return -1;
        }

        private int useHypothesis(Frame frame, int index, Formula goal, int ctx, int depth) {
            final Formula h = frame.hypothesis();
            if (h.equals(Literal.FALSE)) {
                return step(List.of(frame.step()), "⊥-elim", goal, "");
            }
            if (Boolean.FALSE.equals(evaluate(h))) {
                final int bottom = step(List.of(frame.step()), "numeral evaluation", Literal.FALSE, "");
                return goal.equals(Literal.FALSE) ? bottom : step(List.of(bottom), "⊥-elim", goal, "");
            }
            return switch (h.kind()) {
                case IMPLIES -> {
                    final var imp = (Implies) h;
                    if (!imp.consequent().equals(goal)) {
                        yield -1;
                    }
                    final int a = prove(imp.antecedent(), ctx, depth + 1);
                    yield a < 0 ? -1 : step(List.of(frame.step(), a), "→-elim", goal, "modus ponens");
                }
                case IFF -> {
                    final var iff = (Iff) h;
                    final Formula other = iff.right().equals(goal) ? iff.left()
                        : iff.left().equals(goal) ? iff.right() : null;
                    if (other == null) {
                        yield -1;
                    }
                    final int a = prove(other, ctx, depth + 1);
                    yield a < 0 ? -1 : step(List.of(frame.step(), a), "↔-elim", goal, "");
                }
                case NOT -> {
                    if (!goal.equals(Literal.FALSE)) {
                        yield -1;
                    }
                    final int a = prove(((Not) h).operand(), ctx, depth + 1);
                    yield a < 0 ? -1 : step(List.of(frame.step(), a), "¬-elim", goal, "");
                }
                case OR -> splitting.contains(index) ? -1 : caseSplit(frame, index, (Or) h, goal, ctx, depth);
                case FORALL -> instantiate(frame, h, goal, ctx, depth);
                default -> -1;
            };
        }

        private int caseSplit(Frame frame, int index, Or h, Formula goal, int ctx, int depth) {
            splitting.add(index);
            try {
                final var premises = new ArrayList<Integer>();
                premises.add(frame.step());
                for (Formula d : h.disjuncts()) {
                    final int hyp = step(List.of(), "assumption", d, "case");
                    final int child = push(ctx, d, hyp);
                    final int p = prove(goal, child, depth + 1);
                    if (p < 0) {
                        return -1;
                    }
                    premises.add(p);
                }
                return step(premises, "∨-elim", goal, "");
            } finally {
                splitting.remove(index);
            }
        }

        /// Uses a universal hypothesis whose matrix, or the consequent or one side of it,
        /// matches the goal.
        private int instantiate(Frame frame, Formula h, Formula goal, int ctx, int depth) {
            final var vars = new ArrayList<Var>();
            Formula body = h;
            while (body instanceof Forall q) {
                vars.add(q.variable());
                body = q.body();
            }
            final Map<Var, Term> binding = new HashMap<>();
            if (match(body, goal, vars, binding) && binding.keySet().containsAll(vars)) {
                return step(List.of(frame.step()), "∀-elim", goal, describe(binding));
            }
            binding.clear();
            if (body instanceof Implies imp && match(imp.consequent(), goal, vars, binding)
                    && binding.keySet().containsAll(vars)) {
                final Formula antecedent = apply(imp.antecedent(), binding);
                final int inst = step(List.of(frame.step()), "∀-elim", new Implies(antecedent, goal), describe(binding));
                final int a = prove(antecedent, ctx, depth + 1);
                return a < 0 ? -1 : step(List.of(inst, a), "→-elim", goal, "modus ponens");
            }
            binding.clear();
            if (body instanceof Iff iff) {
                for (int side = 0; side < 2; side++) {
                    final Formula target = side == 0 ? iff.right() : iff.left();
                    final Formula source = side == 0 ? iff.left() : iff.right();
                    binding.clear();
                    if (match(target, goal, vars, binding) && binding.keySet().containsAll(vars)) {
                        final Formula instance = new Iff(apply(iff.left(), binding), apply(iff.right(), binding));
                        final int inst = step(List.of(frame.step()), "∀-elim", instance, describe(binding));
                        final int a = prove(apply(source, binding), ctx, depth + 1);
                        return a < 0 ? -1 : step(List.of(inst, a), "↔-elim", goal, "");
                    }
                }
            }
            return -1;
        }

        private static Formula apply(Formula f, Map<Var, Term> binding) {
            Formula out = f;
            for (var e : binding.entrySet()) {
                out = Formulas.substitute(out, e.getKey(), e.getValue());
            }
            return out;
        }

        private static String describe(Map<Var, Term> binding) {
            final var parts = new ArrayList<String>();
            binding.forEach((v, t) -> parts.add(v.name() + ":=" + Formulas.render(t)));
            parts.sort(null);
            return String.join(", ", parts);
        }

        // ========== matching ==========

        static boolean match(Formula pattern, Formula target, List<Var> vars, Map<Var, Term> binding) {
            if (pattern.kind() != target.kind()) {
                return false;
            }
            return switch (pattern.kind()) {
                case ATOM -> {
                    final var p = (Atom) pattern;
                    final var t = (Atom) target;
                    yield p.predicate().equals(t.predicate()) && matchAll(p.args(), t.args(), vars, binding);
                }
                case NOT -> match(((Not) pattern).operand(), ((Not) target).operand(), vars, binding);
                case AND -> matchFormulas(((And) pattern).conjuncts(), ((And) target).conjuncts(), vars, binding);
                case OR -> matchFormulas(((Or) pattern).disjuncts(), ((Or) target).disjuncts(), vars, binding);
                case IMPLIES -> match(((Implies) pattern).antecedent(), ((Implies) target).antecedent(), vars, binding)
                    && match(((Implies) pattern).consequent(), ((Implies) target).consequent(), vars, binding);
                case IFF -> match(((Iff) pattern).left(), ((Iff) target).left(), vars, binding)
                    && match(((Iff) pattern).right(), ((Iff) target).right(), vars, binding);
                default -> pattern.equals(target);
            };
        }

        private static boolean matchFormulas(List<Formula> ps, List<Formula> ts, List<Var> vars, Map<Var, Term> binding) {
            if (ps.size() != ts.size()) {
                return false;
            }
            for (int i = 0; i < ps.size(); i++) {
                if (!match(ps.get(i), ts.get(i), vars, binding)) {
                    return false;
                }
            }
            return true;
        }

        private static boolean matchAll(List<Term> ps, List<Term> ts, List<Var> vars, Map<Var, Term> binding) {
            if (ps.size() != ts.size()) {
                return false;
            }
            for (int i = 0; i < ps.size(); i++) {
                if (!matchTerm(ps.get(i), ts.get(i), vars, binding)) {
                    return false;
                }
            }
            return true;
        }

        private static boolean matchTerm(Term p, Term t, List<Var> vars, Map<Var, Term> binding) {
            if (p instanceof Var v && vars.contains(v)) {
                final Term bound = binding.get(v);
                if (bound != null) {
                    return bound.equals(t);
                }
                if (!v.sort().accepts(t.sort())) {
                    return false;
                }
                binding.put(v, t);
                return true;
            }
            if (p instanceof Apply pa && t instanceof Apply ta) {
                return pa.function().equals(ta.function()) && matchAll(pa.args(), ta.args(), vars, binding);
            }
            return p.equals(t);
        }

        // ========== arena ==========

        private int push(int parent, Formula hypothesis, int step) {
            frames.add(new Frame(parent, hypothesis, step));
            int ctx = frames.size() - 1;
            if (hypothesis instanceof And a) {
                // conjuncts are directly available
                for (Formula c : a.conjuncts()) {
                    ctx = push(ctx, c, step(List.of(step), "∧-elim", c, ""));
                }
            }
            return ctx;
        }

        private int step(List<Integer> premises, String rule, Formula conclusion, String justification) {
            steps.add(new ProofStep(premises, rule, conclusion, justification));
            return steps.size() - 1;
        }

        private void truncate(int stepMark, int frameMark) {
            while (steps.size() > stepMark) {
                steps.remove(steps.size() - 1);
            }
            while (frames.size() > frameMark) {
                frames.remove(frames.size() - 1);
            }
        }

        private void tick() {
            if (++ticks > limit) {
                throw new StepLimitException();
            }
            deadline.check();
        }
    }
}
