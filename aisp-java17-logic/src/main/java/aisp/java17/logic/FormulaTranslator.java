package aisp.java17.logic;

import aisp.java17.logic.Formula.Atom;
import aisp.java17.logic.Formula.Exists;
import aisp.java17.logic.Formula.Forall;
import aisp.java17.logic.Formula.Iff;
import aisp.java17.logic.Formula.Implies;
import aisp.java17.logic.Formula.Literal;
import aisp.java17.logic.Formula.Not;
import aisp.java17.logic.Term.Apply;
import aisp.java17.logic.Term.Constant;
import aisp.java17.logic.Term.Numeral;
import aisp.java17.logic.Term.Var;
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
import aisp.java17.parser.AispAst.SymbolConstant;
import aisp.java17.parser.AispAst.Text;
import aisp.java17.parser.AispAst.TierLiteral;
import aisp.java17.parser.AispAst.Tuple;
import aisp.java17.parser.AispAst.Unary;
import aisp.java17.parser.AstPrinter;
import aisp.java17.parser.BlockTag;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static aisp.java17.logic.LogicLogging.LOG;

/// Translates a parsed document into formula IR.
///
/// Types-block definitions introduce sorts: a number domain (`Index≜ℕ`) aliases that domain,
/// an enumeration (`Player≜{X,O}`) becomes an uninterpreted sort closed over its members,
/// anything else an uninterpreted sort. Definitions in the other blocks become context
/// [Formula.Definition]s. Every non-definition statement of the Meta, Rules, Errors and
/// Proofs blocks becomes a [TranslatedRule].
///
/// Membership in composite sets is expanded during translation (`x∈A∪B` becomes
/// `x∈A ∨ x∈B`); the set axioms used are cited on the rule.
public final class FormulaTranslator {

    /// Validation predicates a document may not use to reason about itself.
    static final Set<String> SELF_REFERENTIAL_NAMES = Set.of("Ambig", "Valid", "Density", "Tier", "δ", "Validate");
    /// Domain names that range over documents.
    static final Set<String> DOCUMENT_DOMAINS = Set.of("D", "Doc", "Docs", "Document", "Documents");

    private static final Set<BlockTag> RULE_BLOCKS = EnumSet.of(BlockTag.META, BlockTag.RULES, BlockTag.ERRORS, BlockTag.PROOFS);
    private static final Set<String> CONNECTIVES = Set.of("⇒", "→", "⇔", "↔", "∧", "∨");
    private static final Set<String> RELATIONS = Set.of("=", "≠", "<", "≤", ">", "≥", "≡", "∈", "∉", "⊆", "⊂", "⊇");
    private static final Set<String> ARITHMETIC = Set.of("+", "-", "*", "/");

    private final Document document;
    private final Map<String, Sort> typeSorts = new LinkedHashMap<>();
    private final Map<String, List<String>> enumerations = new LinkedHashMap<>();
    private final Map<String, List<String>> memberOwners = new HashMap<>();
    private final Map<String, Formula.Definition> definitions = new LinkedHashMap<>();
    private final List<TranslationException> failures = new ArrayList<>();

    private FormulaTranslator(Document document) {
        this.document = document;
    }

    public static Translation translate(Document document) {
        return translate(document, List.of());
    }

    /// Translates `document`, passing `invariants` to every rule as extra assumptions. An
    /// invariant is never an assumption of the statement it was read from.
    public static Translation translate(Document document, List<Invariant> invariants) {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(invariants, "invariants must not be null");
        final var translator = new FormulaTranslator(document);
        translator.readTypes();
        translator.readDefinitions();
        final List<TranslatedRule> rules = translator.readRules(invariants);
        final List<Axiom> axioms = translator.documentAxioms();
        StructuredLog.fine(LOG, "translate", "rules", rules.size(), "definitions", translator.definitions.size(),
            "axioms", axioms.size(), "failures", translator.failures.size());
        return new Translation(axioms, List.copyOf(translator.definitions.values()), rules, translator.failures);
    }

    // ========== sorts ==========

    private void readTypes() {
        final Block types = document.block(BlockTag.TYPES);
        if (types == null) {
            return;
        }
        for (Statement s : types.statements()) {
            if (!(s instanceof Definition d)) {
                continue;
            }
            final Expr body = d.body();
            if (body instanceof SymbolConstant c && Sort.forDomainGlyph(c.glyph()) != null) {
                typeSorts.putIfAbsent(d.name(), Sort.forDomainGlyph(c.glyph()));
            } else if (body instanceof Identifier alias && typeSorts.containsKey(alias.name())) {
                typeSorts.putIfAbsent(d.name(), typeSorts.get(alias.name()));
            } else if (body instanceof Enumeration e) {
                final var members = new ArrayList<String>();
                for (Expr element : e.elements()) {
                    if (element instanceof Identifier id) {
                        members.add(id.name());
                    }
                }
                typeSorts.putIfAbsent(d.name(), Sort.uninterpreted(d.name()));
                if (members.size() == e.elements().size() && !members.isEmpty()) {
                    enumerations.put(d.name(), List.copyOf(members));
                    members.forEach(m -> memberOwners.computeIfAbsent(m, k -> new ArrayList<>()).add(d.name()));
                }
            } else {
                typeSorts.putIfAbsent(d.name(), Sort.uninterpreted(d.name()));
            }
        }
        LOG.finer(() -> "Type sorts " + typeSorts + " enumerations " + enumerations.keySet());
    }

    // ========== definitions ==========

    private void readDefinitions() {
        for (Block block : document.blocks().values()) {
            if (block.tag() == BlockTag.TYPES || block.tag() == BlockTag.EVIDENCE) {
                continue;
            }
            for (Statement s : block.statements()) {
                if (s instanceof Definition d && !definitions.containsKey(d.name())) {
                    try {
                        definitions.put(d.name(), definition(d));
                    } catch (TranslationException e) {
                        LOG.fine(() -> "Skipping definition " + d.name() + ": " + e.getMessage());
                    }
                }
            }
        }
    }

    private Formula.Definition definition(Definition d) {
        Expr body = d.body();
        final var paramNames = new ArrayList<String>();
        while (body instanceof Lambda l) {
            paramNames.addAll(l.params());
            body = l.body();
        }
        final var cx = new RuleContext(d.block(), d.byteOffset(), AstPrinter.render(d));
        final var params = new ArrayList<Var>();
        for (String p : paramNames) {
            final Var v = new Var(p, inferSort(p, body));
            params.add(v);
            cx.bind(v);
        }
        if (isPropositional(body)) {
            return new Formula.Definition(d.name(), params, formula(body, cx), true);
        }
        final Term value = term(body, null, cx);
        final Term head = params.isEmpty()
            ? new Constant(d.name(), value.sort())
            : new Apply(d.name(), new ArrayList<>(params), value.sort());
        return new Formula.Definition(d.name(), params, Atom.of(Atom.EQ, head, value), false);
    }

    private static boolean isPropositional(Expr e) {
        if (e instanceof Binary b) {
            return CONNECTIVES.contains(b.op()) || RELATIONS.contains(b.op());
        }
        if (e instanceof Unary u) {
            return "¬".equals(u.op());
        }
        if (e instanceof SymbolConstant c) {
            return "⊤".equals(c.glyph()) || "⊥".equals(c.glyph());
        }
        return e instanceof Quantified;
    }

    // ========== rules ==========

    private List<TranslatedRule> readRules(List<Invariant> invariants) {
        final var rules = new ArrayList<TranslatedRule>();
        for (Block block : document.blocks().values()) {
            if (!RULE_BLOCKS.contains(block.tag())) {
                continue;
            }
            final List<Statement> statements = block.statements();
            for (int i = 0; i < statements.size(); i++) {
                final Statement s = statements.get(i);
                final Expr expr = proposition(s);
                if (expr == null) {
                    continue;
                }
                final String id = block.tag().label() + "#" + i;
                final var cx = new RuleContext(block.tag(), s.byteOffset(), AstPrinter.render(s));
                cx.selfReferential = mentionsSelf(expr);
                Formula f;
                try {
                    f = formula(expr, cx);
                } catch (TranslationException e) {
                    if (!cx.selfReferential) {
                        failures.add(e);
                        StructuredLog.fine(LOG, "translate.failure", "rule", id, "reason", e.getMessage());
                        continue;
                    }
                    f = new Atom("self_reference", List.of());
                }
                rules.add(new TranslatedRule(id, block.tag(), i, s.byteOffset(), cx.source, f,
                    assumptions(f, cx, invariants), List.copyOf(cx.cited), cx.selfReferential));
            }
        }
        return rules;
    }

    /// The proposition a statement asserts, or `null` for definitions and type signatures.
    private static Expr proposition(Statement s) {
        if (s instanceof QuantifiedRule q) {
            return q.rule();
        }
        if (s instanceof Implication i) {
            return i.implication();
        }
        if (s instanceof Assertion a) {
            return a.expr() instanceof Binary b && ":".equals(b.op()) ? null : a.expr();
        }
        return null;
    }

    private List<Axiom> assumptions(Formula goal, RuleContext cx, List<Invariant> invariants) {
        final var out = new ArrayList<Axiom>();
        final Set<String> symbols = new LinkedHashSet<>(Formulas.symbols(goal));
        // definitions reachable from the goal
        final Deque<String> pending = new ArrayDeque<>(symbols);
        final Set<String> included = new LinkedHashSet<>();
        while (!pending.isEmpty()) {
            final String name = pending.pop();
            final Formula.Definition d = definitions.get(name);
            if (d != null && included.add(name)) {
                out.add(new Axiom("def-" + name, d));
                Formulas.symbols(d.body()).forEach(pending::push);
                cx.sorts.addAll(Formulas.sorts(d));
            }
        }
        final Set<Sort> sorts = new LinkedHashSet<>(cx.sorts);
        sorts.addAll(Formulas.sorts(goal));
        for (Invariant inv : invariants) {
            if (inv.formula() == null || inv.derivedFrom(cx.block, cx.byteOffset)) {
                continue;
            }
            final Set<String> invSymbols = Formulas.symbols(inv.formula());
            final Set<Sort> invSorts = Formulas.sorts(inv.formula());
            invSymbols.retainAll(symbols);
            invSorts.retainAll(sorts);
            invSorts.removeIf(s -> s.equals(Sort.OBJECT));
            if (!invSymbols.isEmpty() || !invSorts.isEmpty()) {
                out.add(new Axiom("invariant-" + inv.kind().name().toLowerCase(Locale.ROOT) + "@" + inv.byteOffset(),
                    inv.formula()));
                sorts.addAll(Formulas.sorts(inv.formula()));
            }
        }
        out.addAll(sortAxioms(sorts));
        return out;
    }

    private List<Axiom> sortAxioms(Set<Sort> sorts) {
        final var out = new ArrayList<Axiom>();
        if (sorts.contains(Sort.NAT)) {
            out.add(natDomain());
        }
        enumerations.forEach((type, members) -> {
            final Sort sort = typeSorts.get(type);
            if (sorts.contains(sort)) {
                out.addAll(enumAxioms(type, sort, members));
            }
        });
        return out;
    }

    static Axiom natDomain() {
        final Var x = new Var("x", Sort.NAT);
        return new Axiom(Axiom.NAT_DOMAIN, new Forall(x, Atom.of(Atom.GE, x, Numeral.of(0))));
    }

    private static List<Axiom> enumAxioms(String type, Sort sort, List<String> members) {
        final Var x = new Var("x", sort);
        final var cases = new ArrayList<Formula>();
        members.forEach(m -> cases.add(Atom.of(Atom.EQ, x, new Constant(m, sort))));
        final var distinct = new ArrayList<Formula>();
        for (int i = 0; i < members.size(); i++) {
            for (int j = i + 1; j < members.size(); j++) {
                distinct.add(new Not(Atom.of(Atom.EQ, new Constant(members.get(i), sort), new Constant(members.get(j), sort))));
            }
        }
        final var out = new ArrayList<Axiom>();
        out.add(new Axiom("enum-" + type, new Forall(x, Formula.or(cases))));
        if (!distinct.isEmpty()) {
            out.add(new Axiom("distinct-" + type, Formula.and(distinct)));
        }
        return out;
    }

    private List<Axiom> documentAxioms() {
        final var out = new ArrayList<Axiom>();
        if (typeSorts.containsValue(Sort.NAT)) {
            out.add(natDomain());
        }
        enumerations.forEach((type, members) -> out.addAll(enumAxioms(type, typeSorts.get(type), members)));
        if (usesSets()) {
            out.addAll(setAxioms());
        }
        return out;
    }

    private boolean usesSets() {
        for (Statement s : document.statements()) {
            final String text = AstPrinter.render(s);
            if (text.contains("∈") || text.contains("∉") || text.contains("∪") || text.contains("∩")
                || text.contains("⊆") || text.contains("∅")) {
                return true;
            }
        }
        return false;
    }

    /// Set axioms over the generic element sort, for solvers that receive residual set terms.
    static List<Axiom> setAxioms() {
        final Var x = new Var("x", Sort.OBJECT);
        final Var a = new Var("a", Sort.SET);
        final Var b = new Var("b", Sort.SET);
        final Term empty = new Constant("empty", Sort.SET);
        final var out = new ArrayList<Axiom>();
        out.add(new Axiom(Axiom.SET_EMPTY, new Forall(x, new Not(Atom.of(Atom.MEMBER, x, empty)))));
        out.add(new Axiom(Axiom.SET_UNION, forallSets(x, a, b, new Iff(
            Atom.of(Atom.MEMBER, x, new Apply("union", List.of(a, b), Sort.SET)),
            Formula.or(Atom.of(Atom.MEMBER, x, a), Atom.of(Atom.MEMBER, x, b))))));
        out.add(new Axiom(Axiom.SET_INTER, forallSets(x, a, b, new Iff(
            Atom.of(Atom.MEMBER, x, new Apply("inter", List.of(a, b), Sort.SET)),
            Formula.and(Atom.of(Atom.MEMBER, x, a), Atom.of(Atom.MEMBER, x, b))))));
        out.add(new Axiom(Axiom.SET_DIFF, forallSets(x, a, b, new Iff(
            Atom.of(Atom.MEMBER, x, new Apply("diff", List.of(a, b), Sort.SET)),
            Formula.and(Atom.of(Atom.MEMBER, x, a), new Not(Atom.of(Atom.MEMBER, x, b)))))));
        out.add(new Axiom(Axiom.SET_SUBSET, new Forall(a, new Forall(b, new Iff(
            Atom.of(Atom.SUBSET, a, b),
            new Forall(x, new Implies(Atom.of(Atom.MEMBER, x, a), Atom.of(Atom.MEMBER, x, b))))))));
        return out;
    }

    private static Formula forallSets(Var x, Var a, Var b, Formula body) {
        return new Forall(x, new Forall(a, new Forall(b, body)));
    }

    // ========== formulas ==========

    private Formula formula(Expr e, RuleContext cx) {
        if (e instanceof Quantified q) {
            return quantified(q, cx);
        }
        if (e instanceof Binary b) {
            return binary(b, cx);
        }
        if (e instanceof Unary u && "¬".equals(u.op())) {
            return new Not(formula(u.operand(), cx));
        }
        if (e instanceof Application a) {
            final String name = functionName(a, cx);
            return new Atom(name, terms(a.args(), cx));
        }
        if (e instanceof Identifier id) {
            final Var bound = cx.lookup(id.name());
            if (bound != null) {
                if (!bound.sort().equals(Sort.BOOL)) {
                    throw cx.fail("variable " + id.name() + " of sort " + bound.sort() + " used as a proposition");
                }
                return Atom.of(Atom.HOLDS, bound);
            }
            return new Atom(id.name(), List.of());
        }
        if (e instanceof SymbolConstant c) {
            if ("⊤".equals(c.glyph())) {
                return Literal.TRUE;
            }
            if ("⊥".equals(c.glyph())) {
                return Literal.FALSE;
            }
        }
        throw cx.fail("not a proposition: " + AstPrinter.render(e));
    }

    private Formula quantified(Quantified q, RuleContext cx) {
        final Expr domain = q.domain();
        Sort sort;
        Expr guardSet = null;
        if (domain == null) {
            sort = inferSort(q.variable(), q.body());
        } else {
            sort = domainSort(domain, q.membership());
            if (sort == null) {
                if (!q.membership()) {
                    throw cx.fail("unsupported quantifier domain " + AstPrinter.render(domain));
                }
                sort = inferSort(q.variable(), q.body());
                guardSet = domain;
            }
        }
        final Var v = new Var(q.variable(), sort);
        cx.sorts.add(sort);
        final Formula guard = guardSet == null ? null : membership(v, guardSet, cx);
        cx.bind(v);
        final Formula body;
        try {
            body = formula(q.body(), cx);
        } finally {
            cx.unbind(v);
        }
        return switch (q.quantifier()) {
            case "∀" -> new Forall(v, guard == null ? body : new Implies(guard, body));
            case "∃" -> new Exists(v, guard == null ? body : Formula.and(guard, body));
            case "∃!" -> {
                final Var other = new Var(q.variable() + "'", sort);
                final Formula otherGuard = guard == null ? Literal.TRUE : Formulas.substitute(guard, v, other);
                final Formula otherBody = Formulas.substitute(body, v, other);
                final Formula unique = new Forall(other,
                    new Implies(Formula.and(otherGuard, otherBody), Atom.of(Atom.EQ, other, v)));
                yield new Exists(v, Formula.and(guard == null ? Literal.TRUE : guard, body, unique));
            }
            default -> throw cx.fail("unsupported quantifier " + q.quantifier());
        };
    }

    /// Sort named by a quantifier domain, or `null` when the domain is a set to guard with.
    /// An undeclared name is a sort of its own after `:` and a set after `∈`.
    private Sort domainSort(Expr domain, boolean membership) {
        if (domain instanceof SymbolConstant c) {
            return Sort.forDomainGlyph(c.glyph());
        }
        if (domain instanceof Identifier id) {
            final Sort known = typeSorts.get(id.name());
            if (known != null) {
                return known;
            }
            return membership ? null : Sort.uninterpreted(id.name());
        }
        if (domain instanceof Power p && p.base() instanceof SymbolConstant c && p.dimension() > 0) {
            return Sort.uninterpreted(Sort.forDomainGlyph(c.glyph()) + "^" + p.dimension());
        }
        return null;
    }

    private Formula binary(Binary b, RuleContext cx) {
        return switch (b.op()) {
            case "⇒", "→" -> new Implies(formula(b.left(), cx), formula(b.right(), cx));
            case "⇔", "↔" -> new Iff(formula(b.left(), cx), formula(b.right(), cx));
            case "∧" -> Formula.and(formula(b.left(), cx), formula(b.right(), cx));
            case "∨" -> Formula.or(formula(b.left(), cx), formula(b.right(), cx));
            case "∈" -> membership(term(b.left(), elementHint(b.right()), cx), b.right(), cx);
            case "∉" -> new Not(membership(term(b.left(), elementHint(b.right()), cx), b.right(), cx));
            case "⊆" -> subset(b.left(), b.right(), cx);
            case "⊇" -> subset(b.right(), b.left(), cx);
            case "⊂" -> {
                final Formula within = subset(b.left(), b.right(), cx);
                final Var w = new Var("w", setElementSort(b.left(), b.right()));
                final Formula extra = new Exists(w, Formula.and(membership(w, b.right(), cx), new Not(membership(w, b.left(), cx))));
                yield Formula.and(within, extra);
            }
            case "=", "≡", "≠", "<", "≤", ">", "≥" -> comparison(b, cx);
            case ":" -> throw cx.fail("type signature is not a proposition");
            default -> throw cx.fail("operator " + b.op() + " does not form a proposition");
        };
    }

    private Formula comparison(Binary b, RuleContext cx) {
        if ("≡".equals(b.op()) && isPropositional(b.left()) && isPropositional(b.right())) {
            return new Iff(formula(b.left(), cx), formula(b.right(), cx));
        }
        final boolean ordering = !"=".equals(b.op()) && !"≡".equals(b.op()) && !"≠".equals(b.op());
        Term left = term(b.left(), ordering ? Sort.INT : null, cx);
        Term right = term(b.right(), left.sort().equals(Sort.OBJECT) ? null : left.sort(), cx);
        if (left.sort().equals(Sort.OBJECT) && !right.sort().equals(Sort.OBJECT)) {
            left = term(b.left(), right.sort(), cx);
        }
        return switch (b.op()) {
            case "=", "≡" -> Atom.of(Atom.EQ, left, right);
            case "≠" -> new Not(Atom.of(Atom.EQ, left, right));
            case "<" -> Atom.of(Atom.LT, left, right);
            case "≤" -> Atom.of(Atom.LE, left, right);
            case ">" -> Atom.of(Atom.GT, left, right);
            default -> Atom.of(Atom.GE, left, right);
        };
    }

    private Formula subset(Expr sub, Expr sup, RuleContext cx) {
        cx.cite(Axiom.SET_SUBSET);
        final Var x = new Var("x", setElementSort(sub, sup));
        return new Forall(x, new Implies(membership(x, sub, cx), membership(x, sup, cx)));
    }

    private Sort setElementSort(Expr a, Expr b) {
        final Sort hint = elementHint(a);
        if (hint != null) {
            return hint;
        }
        final Sort other = elementHint(b);
        return other != null ? other : Sort.OBJECT;
    }

    /// Element sort suggested by a set expression.
    private Sort elementHint(Expr set) {
        if (set instanceof Identifier id) {
            return typeSorts.get(id.name());
        }
        if (set instanceof SymbolConstant c) {
            return Sort.forDomainGlyph(c.glyph());
        }
        if (set instanceof Binary b) {
            final Sort left = elementHint(b.left());
            return left != null ? left : elementHint(b.right());
        }
        return null;
    }

    /// `t ∈ set`, expanded structurally over set operators and enumerations.
    private Formula membership(Term t, Expr set, RuleContext cx) {
        if (set instanceof Identifier id) {
            final Var bound = cx.lookup(id.name());
            if (bound != null) {
                return Atom.of(Atom.MEMBER, t, bound);
            }
            final List<String> members = enumerations.get(id.name());
            final Sort typeSort = typeSorts.get(id.name());
            if (members != null) {
                cx.cite(Axiom.SET_ENUM);
                cx.sorts.add(typeSort);
                final var cases = new ArrayList<Formula>();
                members.forEach(m -> cases.add(Atom.of(Atom.EQ, t, new Constant(m, typeSort))));
                return Formula.or(cases);
            }
            if (typeSort != null) {
                return domainMembership(t, typeSort, id.name());
            }
            return Atom.of(Atom.MEMBER, t, new Constant(id.name(), Sort.SET));
        }
        if (set instanceof SymbolConstant c) {
            if ("∅".equals(c.glyph())) {
                cx.cite(Axiom.SET_EMPTY);
                return Literal.FALSE;
            }
            final Sort domain = Sort.forDomainGlyph(c.glyph());
            if (domain != null) {
                return domainMembership(t, domain, c.glyph());
            }
        }
        if (set instanceof Binary b && "∪".equals(b.op())) {
            cx.cite(Axiom.SET_UNION);
            return Formula.or(membership(t, b.left(), cx), membership(t, b.right(), cx));
        }
        if (set instanceof Binary b && "∩".equals(b.op())) {
            cx.cite(Axiom.SET_INTER);
            return Formula.and(membership(t, b.left(), cx), membership(t, b.right(), cx));
        }
        if (set instanceof Binary b && "∖".equals(b.op())) {
            cx.cite(Axiom.SET_DIFF);
            return Formula.and(membership(t, b.left(), cx), new Not(membership(t, b.right(), cx)));
        }
        if (set instanceof Enumeration e) {
            cx.cite(Axiom.SET_ENUM);
            final var cases = new ArrayList<Formula>();
            for (Expr element : e.elements()) {
                cases.add(Atom.of(Atom.EQ, t, term(element, t.sort(), cx)));
            }
            return Formula.or(cases);
        }
        return Atom.of(Atom.MEMBER, t, term(set, Sort.SET, cx));
    }

    private static Formula domainMembership(Term t, Sort domain, String domainName) {
        if (domain.isNat() && t.sort().numeric()) {
            return Atom.of(Atom.GE, t, Numeral.of(0));
        }
        if (domain.accepts(t.sort())) {
            return Literal.TRUE;
        }
        return Atom.of(Atom.MEMBER, t, new Constant(domainName, Sort.SET));
    }

    // ========== terms ==========

    private List<Term> terms(List<Expr> args, RuleContext cx) {
        final var out = new ArrayList<Term>(args.size());
        args.forEach(a -> out.add(term(a, null, cx)));
        return out;
    }

    private Term term(Expr e, Sort hint, RuleContext cx) {
        if (e instanceof NumberLiteral n) {
            return new Numeral(n.value());
        }
        if (e instanceof Identifier id) {
            return identifierTerm(id.name(), hint, cx);
        }
        if (e instanceof SymbolConstant c) {
            if ("∅".equals(c.glyph())) {
                cx.cite(Axiom.SET_EMPTY);
                return new Constant("empty", Sort.SET);
            }
            if (Sort.forDomainGlyph(c.glyph()) != null) {
                return new Constant(c.glyph(), Sort.SET);
            }
            throw cx.fail("constant " + c.glyph() + " has no term meaning");
        }
        if (e instanceof Binary b) {
            if (ARITHMETIC.contains(b.op())) {
                final Sort numeric = hint != null && hint.numeric() ? hint : Sort.INT;
                final Term l = term(b.left(), numeric, cx);
                final Term r = term(b.right(), numeric, cx);
                final Sort sort = l.sort().equals(Sort.REAL) || r.sort().equals(Sort.REAL) || "/".equals(b.op())
                    ? Sort.REAL : Sort.INT;
                return new Apply(b.op(), List.of(l, r), sort);
            }
            final String setFunction = switch (b.op()) {
                case "∪" -> Axiom.SET_UNION;
                case "∩" -> Axiom.SET_INTER;
                case "∖" -> Axiom.SET_DIFF;
                default -> null;
            };
            if (setFunction != null) {
                cx.cite(setFunction);
                final String function = setFunction.substring("set-".length());
                return new Apply(function, List.of(term(b.left(), Sort.SET, cx), term(b.right(), Sort.SET, cx)), Sort.SET);
            }
            return switch (b.op()) {
                case "×" -> new Apply("product", List.of(term(b.left(), Sort.SET, cx), term(b.right(), Sort.SET, cx)), Sort.SET);
                case "∘", "⊕", "⊗", "⊖", "·" ->
                    new Apply(b.op(), List.of(term(b.left(), null, cx), term(b.right(), null, cx)), Sort.OBJECT);
                default -> throw cx.fail("operator " + b.op() + " does not form a term");
            };
        }
        if (e instanceof Unary u) {
            if ("-".equals(u.op())) {
                final Term inner = term(u.operand(), Sort.INT, cx);
                return new Apply("neg", List.of(inner), inner.sort().equals(Sort.REAL) ? Sort.REAL : Sort.INT);
            }
            if ("‖".equals(u.op())) {
                return new Apply("norm", List.of(term(u.operand(), null, cx)), Sort.REAL);
            }
            throw cx.fail("operator " + u.op() + " does not form a term");
        }
        if (e instanceof Application a) {
            final String name = functionName(a, cx);
            return new Apply(name, terms(a.args(), cx), hint != null ? hint : Sort.OBJECT);
        }
        if (e instanceof Text t) {
            return new Constant("\"" + t.value() + "\"", Sort.STRING);
        }
        if (e instanceof TierLiteral t) {
            return new Constant(t.glyph(), Sort.OBJECT);
        }
        if (e instanceof Tuple t) {
            return new Apply("tuple", terms(t.elements(), cx), Sort.OBJECT);
        }
        if (e instanceof Enumeration en) {
            cx.cite(Axiom.SET_ENUM);
            return new Apply("set", terms(en.elements(), cx), Sort.SET);
        }
        throw cx.fail("no term meaning for " + AstPrinter.render(e));
    }

    private Term identifierTerm(String name, Sort hint, RuleContext cx) {
        final Var bound = cx.lookup(name);
        if (bound != null) {
            return bound;
        }
        final List<String> owners = memberOwners.get(name);
        if (owners != null) {
            Sort sort = typeSorts.get(owners.get(0));
            for (String owner : owners) {
                if (typeSorts.get(owner).equals(hint)) {
                    sort = hint;
                }
            }
            cx.sorts.add(sort);
            return new Constant(name, sort);
        }
        if (typeSorts.containsKey(name)) {
            return new Constant(name, Sort.SET);
        }
        return new Constant(name, hint != null ? hint : Sort.OBJECT);
    }

    private String functionName(Application a, RuleContext cx) {
        if (a.function() instanceof Identifier id) {
            return id.name();
        }
        throw cx.fail("higher-order application " + AstPrinter.render(a));
    }

    // ========== helpers ==========

    /// `Int` when `name` is used arithmetically in `body`, `Bool` when it is used as a
    /// proposition, otherwise the generic object sort.
    static Sort inferSort(String name, Expr body) {
        final var usage = new Sort[1];
        scanUsage(name, body, usage);
        return usage[0] != null ? usage[0] : Sort.OBJECT;
    }

    private static void scanUsage(String name, Expr e, Sort[] usage) {
        if (usage[0] != null) {
            return;
        }
        if (e instanceof Binary b) {
            final boolean numeric = ARITHMETIC.contains(b.op())
                || Set.of("<", "≤", ">", "≥").contains(b.op());
            final boolean logical = CONNECTIVES.contains(b.op());
            if (numeric && (isName(b.left(), name) || isName(b.right(), name))) {
                usage[0] = Sort.INT;
                return;
            }
            if (logical && (isName(b.left(), name) || isName(b.right(), name))) {
                usage[0] = Sort.BOOL;
                return;
            }
            scanUsage(name, b.left(), usage);
            scanUsage(name, b.right(), usage);
        } else if (e instanceof Unary u) {
            if ("¬".equals(u.op()) && isName(u.operand(), name)) {
                usage[0] = Sort.BOOL;
                return;
            }
            scanUsage(name, u.operand(), usage);
        } else if (e instanceof Quantified q && !q.variable().equals(name)) {
            scanUsage(name, q.body(), usage);
        } else if (e instanceof Application a) {
            a.args().forEach(arg -> scanUsage(name, arg, usage));
        } else if (e instanceof Lambda l && !l.params().contains(name)) {
            scanUsage(name, l.body(), usage);
        }
    }

    private static boolean isName(Expr e, String name) {
        return e instanceof Identifier id && id.name().equals(name);
    }

    /// Whether `e` reasons about the validation of its own document.
    static boolean mentionsSelf(Expr e) {
        if (e instanceof Quantified q) {
            final boolean overDocuments = q.domain() instanceof Identifier id && DOCUMENT_DOMAINS.contains(id.name())
                || q.domain() == null && DOCUMENT_DOMAINS.contains(q.variable());
            return overDocuments || mentionsSelf(q.body());
        }
        if (e instanceof Application a) {
            if (a.function() instanceof Identifier id && SELF_REFERENTIAL_NAMES.contains(id.name())) {
                return true;
            }
            return a.args().stream().anyMatch(FormulaTranslator::mentionsSelf);
        }
        if (e instanceof Identifier id) {
            return "δ".equals(id.name());
        }
        if (e instanceof Binary b) {
            return mentionsSelf(b.left()) || mentionsSelf(b.right());
        }
        if (e instanceof Unary u) {
            return mentionsSelf(u.operand());
        }
        return false;
    }

    /// Per-statement translation state: bound variables, cited axioms and sorts seen.
    private static final class RuleContext {
        private final BlockTag block;
        private final int byteOffset;
        private final String source;
        private final Deque<Var> bound = new ArrayDeque<>();
        private final Set<String> cited = new LinkedHashSet<>();
        private final Set<Sort> sorts = new LinkedHashSet<>();
        private boolean selfReferential;

        RuleContext(BlockTag block, int byteOffset, String source) {
            this.block = block;
            this.byteOffset = byteOffset;
            this.source = source;
        }

        void bind(Var v) {
            bound.push(v);
        }

        void unbind(Var v) {
            bound.removeFirstOccurrence(v);
        }

        Var lookup(String name) {
            for (Var v : bound) {
                if (v.name().equals(name)) {
                    return v;
                }
            }
            return null;
        }

        void cite(String axiom) {
            cited.add(axiom);
        }

        TranslationException fail(String message) {
            return new TranslationException(message, block, byteOffset, source);
        }
    }
}
