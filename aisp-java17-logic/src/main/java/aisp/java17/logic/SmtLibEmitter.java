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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/// Writes an [Obligation] as an SMT-LIB 2 validity query.
///
/// The script asserts every assumption and the negated goal, so `unsat` means the goal is valid.
/// A symbol used with more than one signature (an enumeration member shared by two types, or a
/// predicate applied to differently sorted arguments) is declared once per signature under a
/// mangled name such as `|X:Player|`.
public final class SmtLibEmitter {

    private static final Pattern SIMPLE_SYMBOL = Pattern.compile("[A-Za-z~!@$%^&*_+=<>.?/-][A-Za-z0-9~!@$%^&*_+=<>.?/-]*");

    private static final Set<String> RESERVED = Set.of(
        "and", "or", "not", "=>", "xor", "ite", "distinct", "true", "false", "forall", "exists", "let",
        "assert", "par", "_", "!", "as", "match", "+", "-", "*", "/", "<", "<=", ">", ">=", "=", "div",
        "mod", "abs", "to_real", "to_int", "is_int", "Int", "Real", "Bool", "String", "Array", "select",
        "store");

    private record Signature(List<String> args, String result) {}

    private final Map<String, Set<Signature>> signatures = new LinkedHashMap<>();
    private final Set<String> sorts = new LinkedHashSet<>();
    private final List<String> natConstants = new ArrayList<>();

    private SmtLibEmitter() {}

    /// The validity query for `obligation`: declarations, named assumptions, the negated goal,
    /// then `(check-sat)` and `(get-model)`.
    public static String validityScript(Obligation obligation) {
        final var emitter = new SmtLibEmitter();
        final var formulas = new ArrayList<Formula>();
        obligation.assumptions().forEach(a -> formulas.add(closed(a.formula())));
        formulas.add(obligation.goal());
        formulas.forEach(f -> emitter.declare(f, new HashSet<>()));

        final var sb = new StringBuilder();
        sb.append("; obligation ").append(sanitiseComment(obligation.id())).append('\n');
        sb.append("(set-option :produce-models true)\n");
        sb.append("(set-logic ALL)\n");
        emitter.sorts.forEach(s -> sb.append("(declare-sort ").append(symbol(s)).append(" 0)\n"));
        emitter.signatures.forEach((name, sigs) -> sigs.forEach(sig -> {
            final String declared = emitter.declaredName(name, sig);
            if (sig.args().isEmpty()) {
                sb.append("(declare-const ").append(declared).append(' ').append(sig.result()).append(")\n");
            } else {
                sb.append("(declare-fun ").append(declared).append(" (").append(String.join(" ", sig.args()))
                    .append(") ").append(sig.result()).append(")\n");
            }
        }));
        for (String c : emitter.natConstants) {
            sb.append("; ").append(Axiom.NAT_DOMAIN).append('\n');
            sb.append("(assert (>= ").append(emitter.reference(c, List.of(), Sort.NAT)).append(" 0))\n");
        }
        for (Axiom a : obligation.assumptions()) {
            sb.append("; ").append(sanitiseComment(a.name())).append('\n');
            sb.append("(assert ").append(emitter.formula(closed(a.formula()))).append(")\n");
        }
        sb.append("; goal\n");
        sb.append("(assert (not ").append(emitter.formula(obligation.goal())).append("))\n");
        sb.append("(check-sat)\n");
        sb.append("(get-model)\n");
        return sb.toString();
    }

    private static Formula closed(Formula f) {
        return f instanceof Definition d ? d.asAxiom() : f;
    }

    // ========== declarations ==========

    private void declare(Formula f, Set<Var> bound) {
        switch (f.kind()) {
            case FORALL -> {
                final var q = (Forall) f;
                declareSort(q.variable().sort());
                declareBound(q.variable(), q.body(), bound);
            }
            case EXISTS -> {
                final var q = (Exists) f;
                declareSort(q.variable().sort());
                declareBound(q.variable(), q.body(), bound);
            }
            case IMPLIES -> {
                declare(((Implies) f).antecedent(), bound);
                declare(((Implies) f).consequent(), bound);
            }
            case IFF -> {
                declare(((Iff) f).left(), bound);
                declare(((Iff) f).right(), bound);
            }
            case AND -> ((And) f).conjuncts().forEach(c -> declare(c, bound));
            case OR -> ((Or) f).disjuncts().forEach(c -> declare(c, bound));
            case NOT -> declare(((Not) f).operand(), bound);
            case ATOM -> {
                final var a = (Atom) f;
                a.args().forEach(t -> declare(t, bound));
                if (!a.isComparison() && !(Atom.HOLDS.equals(a.predicate()) && a.args().size() == 1)) {
                    addSignature(a.predicate(), argSorts(a.args()), "Bool");
                }
            }
            case DEFINITION -> declare(((Definition) f).asAxiom(), bound);
            case LITERAL -> { }
        }
    }

    private void declareBound(Var v, Formula body, Set<Var> bound) {
        final var inner = new HashSet<>(bound);
        inner.add(v);
        declare(body, inner);
    }

    private void declare(Term t, Set<Var> bound) {
        switch (t.kind()) {
            case VAR -> {
                if (!bound.contains(t)) {
                    declareConstant(((Var) t).name(), t.sort());
                }
            }
            case CONSTANT -> {
                final var c = (Constant) t;
                if (!isStringLiteral(c)) {
                    declareConstant(c.name(), c.sort());
                }
            }
            case NUMERAL -> { }
            case APPLY -> {
                final var a = (Apply) t;
                a.args().forEach(arg -> declare(arg, bound));
                if (!a.isArithmetic()) {
                    declareSort(a.sort());
                    addSignature(a.function(), argSorts(a.args()), a.sort().smtName());
                }
            }
        }
    }

    private void declareConstant(String name, Sort sort) {
        declareSort(sort);
        if (addSignature(name, List.of(), sort.smtName()) && sort.isNat()) {
            natConstants.add(name);
        }
    }

    private boolean addSignature(String name, List<String> args, String result) {
        return signatures.computeIfAbsent(name, k -> new LinkedHashSet<>()).add(new Signature(args, result));
    }

    private void declareSort(Sort sort) {
        if (!sort.interpreted()) {
            sorts.add(sort.name());
        }
    }

    private static List<String> argSorts(List<Term> args) {
        final var out = new ArrayList<String>(args.size());
        args.forEach(t -> out.add(t.sort().smtName()));
        return out;
    }

    private String declaredName(String name, Signature sig) {
        if (signatures.get(name).size() == 1) {
            return symbol(name);
        }
        if (sig.args().isEmpty()) {
            return symbol(name + ":" + sig.result());
        }
        return symbol(name + ":" + String.join(",", sig.args()) + "->" + sig.result());
    }

    private String reference(String name, List<Term> args, Sort result) {
        return declaredName(name, new Signature(argSorts(args), result.smtName()));
    }

    // ========== formulas and terms ==========

    private String formula(Formula f) {
        return switch (f.kind()) {
            case FORALL -> {
                final var q = (Forall) f;
                final Var v = q.variable();
                final String body = formula(q.body());
                final String guarded = v.sort().isNat() ? "(=> (>= " + symbol(v.name()) + " 0) " + body + ")" : body;
                yield "(forall ((" + symbol(v.name()) + " " + v.sort().smtName() + ")) " + guarded + ")";
            }
            case EXISTS -> {
                final var q = (Exists) f;
                final Var v = q.variable();
                final String body = formula(q.body());
                final String guarded = v.sort().isNat() ? "(and (>= " + symbol(v.name()) + " 0) " + body + ")" : body;
                yield "(exists ((" + symbol(v.name()) + " " + v.sort().smtName() + ")) " + guarded + ")";
            }
            case IMPLIES -> "(=> " + formula(((Implies) f).antecedent()) + " " + formula(((Implies) f).consequent()) + ")";
            case IFF -> "(= " + formula(((Iff) f).left()) + " " + formula(((Iff) f).right()) + ")";
            case AND -> "(and " + ((And) f).conjuncts().stream().map(this::formula).collect(Collectors.joining(" ")) + ")";
            case OR -> "(or " + ((Or) f).disjuncts().stream().map(this::formula).collect(Collectors.joining(" ")) + ")";
            case NOT -> "(not " + formula(((Not) f).operand()) + ")";
            case ATOM -> atom((Atom) f);
            case DEFINITION -> formula(((Definition) f).asAxiom());
            case LITERAL -> ((Literal) f).value() ? "true" : "false";
        };
    }

    private String atom(Atom a) {
        if (a.isComparison()) {
            final Term l = a.args().get(0);
            final Term r = a.args().get(1);
            final boolean real = l.sort().equals(Sort.REAL) || r.sort().equals(Sort.REAL);
            final boolean numeric = l.sort().numeric() && r.sort().numeric();
            final String ls = numeric ? arith(l, real) : term(l);
            final String rs = numeric ? arith(r, real) : term(r);
            return "(" + a.predicate() + " " + ls + " " + rs + ")";
        }
        if (Atom.HOLDS.equals(a.predicate()) && a.args().size() == 1) {
            return term(a.args().get(0));
        }
        final String name = reference(a.predicate(), a.args(), Sort.BOOL);
        if (a.args().isEmpty()) {
            return name;
        }
        return "(" + name + " " + a.args().stream().map(this::term).collect(Collectors.joining(" ")) + ")";
    }

    private String arith(Term t, boolean real) {
        if (t instanceof Numeral n) {
            return numeral(n, real);
        }
        final String s = term(t);
        return real && t.sort().integral() ? "(to_real " + s + ")" : s;
    }

    private String term(Term t) {
        return switch (t.kind()) {
            case VAR -> symbol(((Var) t).name());
            case CONSTANT -> {
                final var c = (Constant) t;
                yield isStringLiteral(c) ? stringLiteral(c.name()) : reference(c.name(), List.of(), c.sort());
            }
            case NUMERAL -> numeral((Numeral) t, false);
            case APPLY -> {
                final var a = (Apply) t;
                if (a.isArithmetic()) {
                    final boolean real = a.sort().equals(Sort.REAL)
                        || a.args().stream().anyMatch(x -> x.sort().equals(Sort.REAL));
                    final String op = "neg".equals(a.function()) ? "-" : a.function();
                    yield "(" + op + " " + a.args().stream().map(x -> arith(x, real || "/".equals(op)))
                        .collect(Collectors.joining(" ")) + ")";
                }
                final String name = reference(a.function(), a.args(), a.sort());
                yield a.args().isEmpty() ? name
                    : "(" + name + " " + a.args().stream().map(this::term).collect(Collectors.joining(" ")) + ")";
            }
        };
    }

    private static String numeral(Numeral n, boolean real) {
        final var abs = n.value().abs();
        String text = abs.toPlainString();
        if ((real || abs.scale() > 0) && !text.contains(".")) {
            text = text + ".0";
        }
        return n.value().signum() < 0 ? "(- " + text + ")" : text;
    }

    private static boolean isStringLiteral(Constant c) {
        return c.sort().equals(Sort.STRING) && c.name().length() >= 2 && c.name().startsWith("\"") && c.name().endsWith("\"");
    }

    private static String stringLiteral(String quoted) {
        return "\"" + quoted.substring(1, quoted.length() - 1).replace("\"", "\"\"") + "\"";
    }

    /// SMT-LIB symbol for `name`, quoted with `|...|` when it is not a simple symbol.
    static String symbol(String name) {
        if (RESERVED.contains(name)) {
            return name + "!u";
        }
        if (SIMPLE_SYMBOL.matcher(name).matches()) {
            return name;
        }
        return "|" + name.replace('|', '_').replace('\\', '_') + "|";
    }

    private static String sanitiseComment(String text) {
        return text.replace('\n', ' ').replace('\r', ' ');
    }
}
