package aisp.java17.parser;

import aisp.java17.parser.AispAst.Application;
import aisp.java17.parser.AispAst.Binary;
import aisp.java17.parser.AispAst.Definition;
import aisp.java17.parser.AispAst.DefinitionOp;
import aisp.java17.parser.AispAst.Document;
import aisp.java17.parser.AispAst.Enumeration;
import aisp.java17.parser.AispAst.EvidenceTuple;
import aisp.java17.parser.AispAst.Expr;
import aisp.java17.parser.AispAst.Identifier;
import aisp.java17.parser.AispAst.Power;
import aisp.java17.parser.AispAst.Quantified;
import aisp.java17.parser.AispAst.Statement;
import aisp.java17.parser.AispAst.Tuple;
import aisp.java17.parser.AispAst.Unary;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/// Dependency graph between `≜` definitions, used to reject documents whose definitions
/// require themselves.
///
/// Edges follow identifier references in a definition body. References inside lambda bodies
/// are recursion and are not edges; quantified variables shadow definitions of the same name.
final class DefinitionGraph {

    private DefinitionGraph() {}

    /// @throws ParseException with kind `CYCLIC_DEFINITION` when any definition reaches itself
    static void requireAcyclic(Document document) {
        final Map<String, Definition> definitions = new LinkedHashMap<>();
        for (Statement s : document.statements()) {
            if (s instanceof Definition d && d.op() == DefinitionOp.DEFINE) {
                definitions.putIfAbsent(d.name(), d);
            } else if (s instanceof EvidenceTuple t) {
                t.entries().forEach(d -> definitions.putIfAbsent(d.name(), d));
            }
        }
        final Map<String, Set<String>> edges = new HashMap<>();
        definitions.forEach((name, d) -> {
            final var refs = new LinkedHashSet<String>();
            references(d.body(), new HashSet<>(), refs);
            refs.retainAll(definitions.keySet());
            edges.put(name, refs);
        });

        final Set<String> done = new HashSet<>();
        for (String start : definitions.keySet()) {
            if (done.contains(start)) {
                continue;
            }
            // iterative DFS with an explicit path stack
            final Deque<String> path = new ArrayDeque<>();
            final Deque<java.util.Iterator<String>> pending = new ArrayDeque<>();
            final Set<String> onPath = new HashSet<>();
            path.push(start);
            onPath.add(start);
            pending.push(edges.get(start).iterator());
            while (!pending.isEmpty()) {
                final var it = pending.peek();
                if (!it.hasNext()) {
                    pending.pop();
                    final String finished = path.pop();
                    onPath.remove(finished);
                    done.add(finished);
                    continue;
                }
                final String next = it.next();
                if (onPath.contains(next)) {
                    final Definition d = definitions.get(next);
                    throw new ParseException(ParseException.Kind.CYCLIC_DEFINITION,
                        "definition '" + next + "' depends on itself", d.byteOffset(), d.block());
                }
                if (!done.contains(next)) {
                    path.push(next);
                    onPath.add(next);
                    pending.push(edges.get(next).iterator());
                }
            }
        }
    }

    private static void references(Expr e, Set<String> bound, Set<String> out) {
        if (e instanceof Identifier id) {
            if (!bound.contains(id.name())) {
                out.add(id.name());
            }
        } else if (e instanceof Application a) {
            references(a.function(), bound, out);
            a.args().forEach(x -> references(x, bound, out));
        } else if (e instanceof Binary b) {
            references(b.left(), bound, out);
            references(b.right(), bound, out);
        } else if (e instanceof Unary u) {
            references(u.operand(), bound, out);
        } else if (e instanceof Quantified q) {
            if (q.domain() != null) {
                references(q.domain(), bound, out);
            }
            final var inner = new HashSet<>(bound);
            inner.add(q.variable());
            references(q.body(), inner, out);
        } else if (e instanceof Tuple t) {
            t.elements().forEach(x -> references(x, bound, out));
        } else if (e instanceof Enumeration en) {
            en.elements().forEach(x -> references(x, bound, out));
        } else if (e instanceof Power p) {
            references(p.base(), bound, out);
        }
        // Lambda bodies, literals and constants contribute no edges.
    }
}
