package aisp.java17.parser;

import aisp.java17.parser.AispAst.Application;
import aisp.java17.parser.AispAst.Assertion;
import aisp.java17.parser.AispAst.Binary;
import aisp.java17.parser.AispAst.Definition;
import aisp.java17.parser.AispAst.Enumeration;
import aisp.java17.parser.AispAst.EvidenceTuple;
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

import java.util.List;
import java.util.stream.Collectors;

/// Canonical rendering of AST nodes.
///
/// Binary nodes are always parenthesised, numbers are normalised and layout is dropped, so two
/// trees render equally exactly when they have the same structure. The rendering is what
/// statement fingerprints hash.
public final class AstPrinter {
    private AstPrinter() {}

    public static String render(Statement statement) {
        if (statement instanceof Definition d) {
            return d.name() + d.op().glyph() + render(d.body());
        }
        if (statement instanceof QuantifiedRule q) {
            return render(q.rule());
        }
        if (statement instanceof Implication i) {
            return render(i.implication());
        }
        if (statement instanceof EvidenceTuple t) {
            return t.entries().stream().map(AstPrinter::render).collect(Collectors.joining(";", "⟨", "⟩"));
        }
        if (statement instanceof Assertion a) {
            return render(a.expr());
        }
        throw new IllegalStateException("unhandled statement " + statement);
    }

    public static String render(Expr e) {
        if (e instanceof Identifier id) {
            return id.name();
        }
        if (e instanceof NumberLiteral n) {
            return n.value().stripTrailingZeros().toPlainString();
        }
        if (e instanceof SymbolConstant c) {
            return c.glyph();
        }
        if (e instanceof TierLiteral t) {
            return t.glyph();
        }
        if (e instanceof Application a) {
            return render(a.function()) + join(a.args(), "(", ")");
        }
        if (e instanceof Binary b) {
            return "(" + render(b.left()) + b.op() + render(b.right()) + ")";
        }
        if (e instanceof Unary u) {
            return u.op() + render(u.operand());
        }
        if (e instanceof Quantified q) {
            final String domain = q.domain() == null ? "" : (q.membership() ? "∈" : ":") + render(q.domain());
            return q.quantifier() + q.variable() + domain + "." + render(q.body());
        }
        if (e instanceof Lambda l) {
            return "λ" + String.join(",", l.params()) + "." + render(l.body());
        }
        if (e instanceof Tuple t) {
            return join(t.elements(), "⟨", "⟩");
        }
        if (e instanceof Enumeration en) {
            return join(en.elements(), "{", "}");
        }
        if (e instanceof Power p) {
            return render(p.base()) + "^" + p.exponent();
        }
        if (e instanceof Text t) {
            return "\"" + t.value().replace("\"", "\\\"") + "\"";
        }
        throw new IllegalStateException("unhandled expression " + e);
    }

    /// Hex SHA-256 of the canonical rendering.
    public static String fingerprint(Statement statement) {
        return Sha256.hex(render(statement));
    }

    private static String join(List<Expr> items, String open, String close) {
        return items.stream().map(AstPrinter::render).collect(Collectors.joining(",", open, close));
    }
}
