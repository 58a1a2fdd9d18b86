package aisp.java17.parser;

import aisp.java17.parser.AispAst.Application;
import aisp.java17.parser.AispAst.Assertion;
import aisp.java17.parser.AispAst.Binary;
import aisp.java17.parser.AispAst.Block;
import aisp.java17.parser.AispAst.Definition;
import aisp.java17.parser.AispAst.DefinitionOp;
import aisp.java17.parser.AispAst.Document;
import aisp.java17.parser.AispAst.Enumeration;
import aisp.java17.parser.AispAst.EvidenceTuple;
import aisp.java17.parser.AispAst.Expr;
import aisp.java17.parser.AispAst.Header;
import aisp.java17.parser.AispAst.Identifier;
import aisp.java17.parser.AispAst.Implication;
import aisp.java17.parser.AispAst.Lambda;
import aisp.java17.parser.AispAst.Metadata;
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

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static aisp.java17.parser.ParserLogging.LOG;

/// Recursive descent parser from [Token]s to an [AispAst.Document].
///
/// Document layout:
/// - prose and markdown before the `𝔸` header and between blocks are skipped
/// - header `𝔸5.1.name#meta@date`, then optional `γ≔…` / `ρ≔…` metadata lines
/// - blocks `⟦glyph:Label⟧{…}`; the Evidence block may use a `⟨…⟩` body and omit its label
///
/// Inside a block body, statements are separated by `;` or by a newline at nesting depth zero.
/// A newline does not end a statement when the line ends with an operator or the next line
/// starts with a binary connective.
///
/// Connective precedence, loosest first: `⇔ ↔`, `⇒ →` (right associative), `∨`, `∧`, `¬`,
/// relations (chains desugar to conjunctions), `∪ ∩ ∖ × |`, `+ -`, `* / ∘ ⊕ ⊗ ⊖ ·`, unary
/// minus, then application and superscripts. Under [ParseStrategy#PERMISSIVE] the binary
/// connectives share one precedence level and associate left.
public final class AispParser {

    private static final Map<String, String> CLOSERS = Map.of(
        "⟦", "⟧",
        "{", "}",
        "⟨", "⟩",
        "(", ")",
        "[", "]"
    );
    private static final Set<String> CLOSING = Set.of("⟧", "}", "⟩", ")", "]");
    private static final Set<String> SET_OPS = Set.of("∪", "∩", "∖", "×", "|");
    private static final Set<String> ADDITIVE_OPS = Set.of("+", "-");
    private static final Set<String> MULTIPLICATIVE_OPS = Set.of("*", "/", "∘", "⊕", "⊗", "⊖", "·");
    private static final Set<String> FLAT_CONNECTIVES = Set.of("∧", "∨", "⇒", "→", "⇔", "↔");

    private final List<Token> tokens;
    private final ParseStrategy strategy;
    private int pos;

    private AispParser(List<Token> tokens, ParseStrategy strategy) {
        this.tokens = tokens;
        this.strategy = strategy;
    }

    /// Tokenizes and parses `text` with [ParseStrategy#STRICT].
    /// @throws LexException if the text cannot be tokenized
    /// @throws ParseException if the document is structurally invalid
    public static Document parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        return parse(AispLexer.tokenize(text), ParseStrategy.STRICT);
    }

    /// Parses a token stream with [ParseStrategy#STRICT].
    public static Document parse(List<Token> tokens) {
        return parse(tokens, ParseStrategy.STRICT);
    }

    /// Parses a token stream with the given strategy.
    /// @throws ParseException if the document is structurally invalid
    public static Document parse(List<Token> tokens, ParseStrategy strategy) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        LOG.fine(() -> "Parsing " + tokens.size() + " tokens with strategy " + strategy);
        final var document = new AispParser(tokens, strategy).parseDocument();
        DefinitionGraph.requireAcyclic(document);
        LOG.finer(() -> "Parsed blocks " + document.blocks().keySet() + " from " + tokens.size() + " tokens");
        return document;
    }

    private Document parseDocument() {
        final Header header = parseHeader();
        final List<Metadata> metadata = parseMetadata();
        final var blocks = new LinkedHashMap<BlockTag, Block>();
        while (pos < tokens.size()) {
            if (tokens.get(pos).is("⟦")) {
                parseBlock(blocks);
            } else {
                pos++; // prose between blocks
            }
        }
        for (BlockTag tag : BlockTag.values()) {
            if (tag.required() && !blocks.containsKey(tag)) {
                throw new ParseException(ParseException.Kind.MISSING_REQUIRED_BLOCK,
                    "required block " + tag.glyph() + ":" + tag.label() + " is missing", -1, tag);
            }
        }
        return new Document(header, metadata, blocks);
    }

    // ========== header and prelude ==========

    private Header parseHeader() {
        while (pos < tokens.size() && !tokens.get(pos).is("𝔸")) {
            pos++;
        }
        if (pos >= tokens.size()) {
            throw new ParseException(ParseException.Kind.MISSING_HEADER, "document has no 𝔸 header", -1, null);
        }
        final Token marker = tokens.get(pos++);
        final Token version = pos < tokens.size() ? tokens.get(pos) : null;
        if (version == null || version.kind() != TokenKind.NUMBER) {
            throw new ParseException(ParseException.Kind.UNEXPECTED_TOKEN, "header version expected after 𝔸",
                version == null ? marker.byteOffset() : version.byteOffset(), null);
        }
        pos++;
        if (pos < tokens.size() && tokens.get(pos).isPunct('.')) {
            pos++;
        }
        final String name = collectHeaderPart('#', '@');
        if (name.isEmpty()) {
            throw new ParseException(ParseException.Kind.UNEXPECTED_TOKEN, "header name expected", marker.byteOffset(), null);
        }
        String meta = "";
        if (pos < tokens.size() && tokens.get(pos).isPunct('#')) {
            pos++;
            meta = collectHeaderPart('@', '@');
        }
        String date = "";
        if (pos < tokens.size() && tokens.get(pos).isPunct('@')) {
            pos++;
            date = collectHeaderPart('\n', '\n');
        }
        return new Header(marker.glyph(), version.glyph(), name, meta, date, marker.byteOffset());
    }

    private String collectHeaderPart(char stopA, char stopB) {
        final var sb = new StringBuilder();
        while (pos < tokens.size()) {
            final Token t = tokens.get(pos);
            if (t.kind() == TokenKind.NEWLINE || t.is("⟦") || t.isPunct(stopA) || t.isPunct(stopB)) {
                break;
            }
            sb.append(t.glyph());
            pos++;
        }
        return sb.toString();
    }

    private List<Metadata> parseMetadata() {
        final var metadata = new ArrayList<Metadata>();
        while (true) {
            skipNewlines();
            if (pos + 1 >= tokens.size()) {
                return metadata;
            }
            final Token key = tokens.get(pos);
            final boolean nameLike = key.kind() == TokenKind.IDENTIFIER || key.role() == SymbolRole.GREEK;
            if (!nameLike || !isDefinitionOp(tokens.get(pos + 1))) {
                return metadata;
            }
            pos += 2;
            final int start = pos;
            while (pos < tokens.size() && tokens.get(pos).kind() != TokenKind.NEWLINE && !tokens.get(pos).is("⟦")) {
                pos++;
            }
            final List<Token> value = tokens.subList(start, pos);
            metadata.add(new Metadata(key.glyph(), metadataValue(value, key), key.byteOffset()));
        }
    }

    private Expr metadataValue(List<Token> value, Token key) {
        if (value.isEmpty()) {
            throw new ParseException(ParseException.Kind.UNEXPECTED_TOKEN, "metadata value expected", key.byteOffset(), null);
        }
        if (value.size() == 1 && value.get(0).kind() == TokenKind.IDENTIFIER) {
            return new Identifier(value.get(0).glyph());
        }
        if (value.get(0).is("⟨")) {
            return new ExprCursor(value, null).parseComplete();
        }
        final var sb = new StringBuilder();
        value.forEach(t -> sb.append(t.glyph()));
        return new Text(sb.toString());
    }

    // ========== blocks ==========

    private void parseBlock(Map<BlockTag, Block> blocks) {
        final Token open = tokens.get(pos);
        final int headerClose = matchingClose(pos, null);
        final List<Token> header = tokens.subList(pos + 1, headerClose);
        pos = headerClose + 1;
        if (header.isEmpty()) {
            throw new ParseException(ParseException.Kind.UNEXPECTED_TOKEN, "block glyph expected", open.byteOffset(), null);
        }
        final BlockTag tag = BlockTag.forGlyph(header.get(0).glyph());
        final var label = new StringBuilder();
        if (header.size() > 1) {
            if (!header.get(1).isPunct(':')) {
                throw new ParseException(ParseException.Kind.UNEXPECTED_TOKEN, "':' expected after block glyph",
                    header.get(1).byteOffset(), tag);
            }
            header.subList(2, header.size()).forEach(t -> label.append(t.glyph()));
        }
        skipNewlines();
        if (tag == null) {
            LOG.fine(() -> "Skipping unknown block " + header.get(0).glyph() + " at byte " + open.byteOffset());
            if (pos < tokens.size() && CLOSERS.containsKey(tokens.get(pos).glyph()) && !tokens.get(pos).is("⟦")) {
                pos = matchingClose(pos, null) + 1;
            }
            return;
        }
        if (label.length() == 0 && tag != BlockTag.EVIDENCE) {
            throw new ParseException(ParseException.Kind.UNEXPECTED_TOKEN, "block label required", open.byteOffset(), tag);
        }
        if (blocks.containsKey(tag)) {
            throw new ParseException(ParseException.Kind.DUPLICATE_BLOCK, "block appears more than once", open.byteOffset(), tag);
        }
        if (pos >= tokens.size() || !(tokens.get(pos).is("{") || tokens.get(pos).is("⟨"))) {
            final int at = pos < tokens.size() ? tokens.get(pos).byteOffset() : open.byteOffset();
            throw new ParseException(ParseException.Kind.UNEXPECTED_TOKEN, "block body expected", at, tag);
        }
        final int close = matchingClose(pos, tag);
        final List<Token> body = tokens.subList(pos + 1, close);
        pos = close + 1;
        final List<Statement> statements = parseBody(body, tag);
        if (tag.required() && statements.isEmpty()) {
            throw new ParseException(ParseException.Kind.EMPTY_REQUIRED_BLOCK, "required block has no statements",
                open.byteOffset(), tag);
        }
        blocks.put(tag, new Block(tag, label.toString(), statements, open.byteOffset()));
        LOG.finer(() -> "Parsed block " + tag + " with " + statements.size() + " statements");
    }

    /// Index of the token closing the bracket at `openIndex`, checking every pair in between.
    private int matchingClose(int openIndex, BlockTag tag) {
        final var expected = new ArrayDeque<String>();
        for (int i = openIndex; i < tokens.size(); i++) {
            final Token t = tokens.get(i);
            final String closer = CLOSERS.get(t.glyph());
            if (closer != null && t.kind() != TokenKind.STRING) {
                expected.push(closer);
            } else if (CLOSING.contains(t.glyph()) && t.kind() != TokenKind.STRING) {
                if (!t.glyph().equals(expected.peek())) {
                    throw new ParseException(ParseException.Kind.UNBALANCED_DELIMITER,
                        "'" + t.glyph() + "' does not close '" + opener(expected.peek()) + "'", t.byteOffset(), tag);
                }
                expected.pop();
                if (expected.isEmpty()) {
                    return i;
                }
            }
        }
        final Token open = tokens.get(openIndex);
        throw new ParseException(ParseException.Kind.UNBALANCED_DELIMITER,
            "'" + open.glyph() + "' is never closed", open.byteOffset(), tag);
    }

    private static String opener(String closer) {
        for (Map.Entry<String, String> e : CLOSERS.entrySet()) {
            if (e.getValue().equals(closer)) {
                return e.getKey();
            }
        }
        return "";
    }

    private List<Statement> parseBody(List<Token> body, BlockTag tag) {
        final var statements = new ArrayList<Statement>();
        for (List<Token> segment : splitStatements(body)) {
            for (Token t : segment) {
                if (t.kind() == TokenKind.PROSE) {
                    throw new ParseException(ParseException.Kind.PROSE_IN_BLOCK,
                        "free text '" + t.glyph() + "' inside block body", t.byteOffset(), tag);
                }
            }
            try {
                statements.add(parseStatement(segment, tag));
            } catch (ParseException e) {
                if (strategy != ParseStrategy.BACKTRACKING || e.kind() != ParseException.Kind.UNEXPECTED_TOKEN) {
                    throw e;
                }
                LOG.fine(() -> "Dropping unparseable statement: " + e.getMessage());
            }
        }
        return tag == BlockTag.EVIDENCE ? gatherEvidence(statements, tag) : statements;
    }

    private static List<Statement> gatherEvidence(List<Statement> statements, BlockTag tag) {
        final var entries = new ArrayList<Definition>();
        final var rest = new ArrayList<Statement>();
        int offset = -1;
        for (Statement s : statements) {
            if (s instanceof Definition d) {
                if (offset < 0) {
                    offset = d.byteOffset();
                }
                entries.add(d);
            } else {
                rest.add(s);
            }
        }
        if (entries.isEmpty()) {
            return statements;
        }
        final var out = new ArrayList<Statement>();
        out.add(new EvidenceTuple(entries, tag, offset));
        out.addAll(rest);
        return out;
    }

    private List<List<Token>> splitStatements(List<Token> body) {
        final var segments = new ArrayList<List<Token>>();
        var current = new ArrayList<Token>();
        int depth = 0;
        for (int i = 0; i < body.size(); i++) {
            final Token t = body.get(i);
            if (t.kind() != TokenKind.STRING && CLOSERS.containsKey(t.glyph())) {
                depth++;
            } else if (t.kind() != TokenKind.STRING && CLOSING.contains(t.glyph())) {
                depth--;
            }
            final boolean separator = depth == 0
                && (t.isPunct(';') || (t.kind() == TokenKind.NEWLINE && !continues(current, body, i)));
            if (separator) {
                if (!current.isEmpty()) {
                    segments.add(current);
                }
                current = new ArrayList<>();
            } else if (t.kind() != TokenKind.NEWLINE) {
                current.add(t);
            }
        }
        if (!current.isEmpty()) {
            segments.add(current);
        }
        return segments;
    }

    /// A newline continues the statement when the line ends with an operator or the next line
    /// starts with a binary connective or relation.
    private static boolean continues(List<Token> current, List<Token> body, int newlineIndex) {
        if (current.isEmpty()) {
            return false;
        }
        final Token last = current.get(current.size() - 1);
        if (isInfix(last) || last.isPunct(',') || last.isPunct(':')) {
            return true;
        }
        for (int j = newlineIndex + 1; j < body.size(); j++) {
            final Token next = body.get(j);
            if (next.kind() == TokenKind.NEWLINE) {
                continue;
            }
            return (next.role() == SymbolRole.CONNECTIVE && !next.is("¬")) || next.role() == SymbolRole.RELATION;
        }
        return false;
    }

    private static boolean isInfix(Token t) {
        return switch (t.role()) {
            case CONNECTIVE -> !t.is("¬");
            case RELATION, BINDER -> true;
            case OPERATOR -> t.kind() == TokenKind.SYMBOL;
            default -> false;
        };
    }

    private void skipNewlines() {
        while (pos < tokens.size() && tokens.get(pos).kind() == TokenKind.NEWLINE) {
            pos++;
        }
    }

    private static boolean isDefinitionOp(Token t) {
        return t.is("≜") || t.is("≔");
    }

    private Statement parseStatement(List<Token> segment, BlockTag tag) {
        final int offset = segment.get(0).byteOffset();
        final var cursor = new ExprCursor(segment, tag);
        final Definition definition = cursor.tryDefinition(offset);
        if (definition != null) {
            return definition;
        }
        Expr expr = cursor.parseExpr();
        if (cursor.peekPunct(':')) {
            cursor.pos++;
            expr = new Binary(":", expr, cursor.parseExpr());
        }
        cursor.expectEnd();
        if (expr instanceof Quantified q) {
            return new QuantifiedRule(q, tag, offset);
        }
        if (expr instanceof Binary b && Binary.isImplicationOp(b.op())) {
            return new Implication(b, tag, offset);
        }
        return new Assertion(expr, tag, offset);
    }

    // ========== expressions ==========

    /// Expression parser over one statement's tokens.
    private final class ExprCursor {
        private final List<Token> seg;
        private final BlockTag tag;
        private int pos;

        ExprCursor(List<Token> seg, BlockTag tag) {
            final var filtered = new ArrayList<Token>(seg.size());
            for (Token t : seg) {
                if (t.kind() != TokenKind.NEWLINE) {
                    filtered.add(t);
                }
            }
            this.seg = filtered;
            this.tag = tag;
        }

        Expr parseComplete() {
            final Expr e = parseExpr();
            expectEnd();
            return e;
        }

        Definition tryDefinition(int offset) {
            final int save = pos;
            final String name = parseName();
            if (name == null) {
                return null;
            }
            List<String> params = null;
            if (peekPunct('(')) {
                params = tryParams();
            }
            final Token op = peek();
            if (op == null || !isDefinitionOp(op)) {
                pos = save;
                return null;
            }
            pos++;
            Expr body = parseExpr();
            expectEnd();
            if (params != null) {
                body = new Lambda(params, body);
            }
            final DefinitionOp kind = op.is("≜") ? DefinitionOp.DEFINE : DefinitionOp.ASSIGN;
            return new Definition(name, kind, body, tag, offset);
        }

        private List<String> tryParams() {
            final int save = pos;
            pos++; // (
            final var params = new ArrayList<String>();
            while (true) {
                final String p = parseName();
                if (p == null) {
                    pos = save;
                    return null;
                }
                params.add(p);
                if (peekPunct(',')) {
                    pos++;
                } else if (peekPunct(')')) {
                    pos++;
                    return params;
                } else {
                    pos = save;
                    return null;
                }
            }
        }

        Expr parseExpr() {
            return strategy == ParseStrategy.PERMISSIVE ? parseFlat() : parseIff();
        }

        private Expr parseFlat() {
            Expr left = parseNot();
            while (peekAny(FLAT_CONNECTIVES)) {
                final String op = next().glyph();
                left = new Binary(op, left, parseNot());
            }
            return left;
        }

        private Expr parseIff() {
            Expr left = parseImplication();
            while (peekIs("⇔") || peekIs("↔")) {
                final String op = next().glyph();
                left = new Binary(op, left, parseImplication());
            }
            return left;
        }

        private Expr parseImplication() {
            final Expr left = parseOr();
            if (peekIs("⇒") || peekIs("→")) {
                final String op = next().glyph();
                return new Binary(op, left, parseImplication());
            }
            return left;
        }

        private Expr parseOr() {
            Expr left = parseAnd();
            while (peekIs("∨")) {
                next();
                left = new Binary("∨", left, parseAnd());
            }
            return left;
        }

        private Expr parseAnd() {
            Expr left = parseNot();
            while (peekIs("∧")) {
                next();
                left = new Binary("∧", left, parseNot());
            }
            return left;
        }

        private Expr parseNot() {
            if (peekIs("¬")) {
                next();
                return new Unary("¬", parseNot());
            }
            return parseRelation();
        }

        private Expr parseRelation() {
            final Expr first = parseSetOp();
            String op = relationOp();
            if (op == null) {
                return first;
            }
            Expr result = null;
            Expr left = first;
            while (op != null) {
                final Expr right = parseSetOp();
                final Expr link = new Binary(op, left, right);
                result = result == null ? link : new Binary("∧", result, link);
                left = right;
                op = relationOp();
            }
            return result;
        }

        /// Consumes and returns the next relation operator, normalising ASCII spellings.
        private String relationOp() {
            final Token t = peek();
            if (t == null) {
                return null;
            }
            if (t.role() == SymbolRole.RELATION) {
                pos++;
                return t.glyph();
            }
            if (t.isPunct('=')) {
                pos++;
                return "=";
            }
            if (t.isPunct('<') || t.isPunct('>') || t.isPunct('!')) {
                final Token after = pos + 1 < seg.size() ? seg.get(pos + 1) : null;
                final boolean withEquals = after != null && after.isPunct('=');
                if (t.isPunct('!') && !withEquals) {
                    return null;
                }
                pos += withEquals ? 2 : 1;
                if (t.isPunct('!')) {
                    return "≠";
                }
                if (t.isPunct('<')) {
                    return withEquals ? "≤" : "<";
                }
                return withEquals ? "≥" : ">";
            }
            return null;
        }

        private Expr parseSetOp() {
            Expr left = parseAdditive();
            while (peekAny(SET_OPS)) {
                final String op = next().glyph();
                left = new Binary(op, left, parseAdditive());
            }
            return left;
        }

        private Expr parseAdditive() {
            Expr left = parseMultiplicative();
            while (peekAny(ADDITIVE_OPS)) {
                final String op = next().glyph();
                left = new Binary(op, left, parseMultiplicative());
            }
            return left;
        }

        private Expr parseMultiplicative() {
            Expr left = parseUnary();
            while (peekAny(MULTIPLICATIVE_OPS)) {
                final String op = next().glyph();
                left = new Binary(op, left, parseUnary());
            }
            return left;
        }

        private Expr parseUnary() {
            if (peekPunct('-')) {
                next();
                return new Unary("-", parseUnary());
            }
            if (peekIs("¬")) {
                next();
                return new Unary("¬", parseUnary());
            }
            return parsePostfix();
        }

        private Expr parsePostfix() {
            Expr e = parsePrimary();
            while (true) {
                if (peekPunct('(')) {
                    next();
                    e = new Application(e, parseList(")"));
                } else if (peek() != null && peek().kind() == TokenKind.SUPERSCRIPT) {
                    e = new Power(e, superscriptRun());
                } else {
                    return e;
                }
            }
        }

        private String superscriptRun() {
            final var sb = new StringBuilder();
            while (peek() != null && peek().kind() == TokenKind.SUPERSCRIPT) {
                sb.append(asciiSuperscript(next().glyph()));
            }
            return sb.toString();
        }

        private Expr parsePrimary() {
            final Token t = peek();
            if (t == null) {
                throw unexpected("unexpected end of statement");
            }
            if (t.kind() == TokenKind.IDENTIFIER || t.role() == SymbolRole.GREEK || t.role() == SymbolRole.LABEL) {
                return new Identifier(parseName());
            }
            if (t.kind() == TokenKind.NUMBER) {
                next();
                return new NumberLiteral(t.glyph());
            }
            if (t.kind() == TokenKind.STRING) {
                next();
                return new Text(t.glyph());
            }
            if (t.role() == SymbolRole.DOMAIN || t.role() == SymbolRole.CONSTANT) {
                next();
                return new SymbolConstant(t.glyph());
            }
            if (t.is("◊")) {
                next();
                final var sb = new StringBuilder("◊");
                while (peekIs("⁺") || peekIs("⁻")) {
                    sb.append(next().glyph());
                }
                return new TierLiteral(sb.toString());
            }
            if (t.is("⊘")) {
                next();
                return new TierLiteral("⊘");
            }
            if (t.role() == SymbolRole.QUANTIFIER) {
                return parseQuantifier();
            }
            if (t.is("λ")) {
                return parseLambda();
            }
            if (t.isPunct('(')) {
                next();
                final List<Expr> items = parseList(")");
                if (items.size() == 1) {
                    return items.get(0);
                }
                return new Tuple(items);
            }
            if (t.is("⟨")) {
                next();
                return new Tuple(parseList("⟩"));
            }
            if (t.isPunct('[')) {
                next();
                return new Tuple(parseList("]"));
            }
            if (t.isPunct('{')) {
                next();
                return new Enumeration(parseEnumeration());
            }
            if (t.is("‖")) {
                next();
                final Expr inner = parseExpr();
                expect("‖");
                return new Unary("‖", inner);
            }
            if (t.role() == SymbolRole.OPERATOR && t.kind() == TokenKind.SYMBOL) {
                next();
                return new Unary(t.glyph(), parseUnary());
            }
            throw unexpected("unexpected '" + t.glyph() + "'");
        }

        private Expr parseQuantifier() {
            String quantifier = next().glyph();
            if (peekPunct('!')) {
                next();
                quantifier = quantifier + "!";
            }
            final var variables = new ArrayList<String>();
            variables.add(requireName());
            while (peekPunct(',')) {
                next();
                variables.add(requireName());
            }
            Expr domain = null;
            boolean membership = false;
            if (peekIs("∈")) {
                next();
                domain = parseSetOp();
                membership = true;
                expectSeparator();
            } else if (peekPunct(':')) {
                next();
                domain = tryDomain();
            } else if (peekPunct('.')) {
                next();
            } else {
                throw unexpected("':' '.' or '∈' expected after quantified variable");
            }
            final Expr body = parseExpr();
            Expr result = body;
            for (int i = variables.size() - 1; i >= 0; i--) {
                result = new Quantified(quantifier, variables.get(i), domain, membership, result);
            }
            return result;
        }

        /// Reads `D:` or `D.` as a domain; otherwise rewinds so the tokens are read as the body.
        private Expr tryDomain() {
            final int save = pos;
            try {
                final Expr candidate = parseSetOp();
                if (peekPunct(':') || peekPunct('.')) {
                    next();
                    return candidate;
                }
            } catch (ParseException notADomain) {
                LOG.finest(() -> "No quantifier domain at token " + save + ": " + notADomain.getMessage());
            }
            pos = save;
            return null;
        }

        private Expr parseLambda() {
            next(); // λ
            final var params = new ArrayList<String>();
            if (peekPunct('(')) {
                next();
                params.add(requireName());
                while (peekPunct(',')) {
                    next();
                    params.add(requireName());
                }
                expect(")");
            } else {
                params.add(requireName());
                while (peekPunct(',')) {
                    next();
                    params.add(requireName());
                }
            }
            if (peekPunct('.') || peekIs("↦")) {
                next();
            } else {
                throw unexpected("'.' expected after lambda parameters");
            }
            return new Lambda(params, parseExpr());
        }

        private List<Expr> parseList(String closer) {
            final var items = new ArrayList<Expr>();
            if (peekIs(closer)) {
                next();
                return items;
            }
            while (true) {
                items.add(parseListItem());
                if (peekPunct(',') || peekPunct(';')) {
                    next();
                } else if (peekIs(closer)) {
                    next();
                    return items;
                } else {
                    throw unexpected("',' or '" + closer + "' expected");
                }
            }
        }

        private Expr parseListItem() {
            final int save = pos;
            final String name = parseName();
            if (name != null && peek() != null && isDefinitionOp(peek())) {
                final String op = next().glyph();
                return new Binary(op, new Identifier(name), parseExpr());
            }
            pos = save;
            return parseExpr();
        }

        /// Comma separated or whitespace separated variants.
        private List<Expr> parseEnumeration() {
            final var items = new ArrayList<Expr>();
            while (true) {
                if (peekPunct('}')) {
                    next();
                    return items;
                }
                if (peek() == null) {
                    throw unexpected("'}' expected");
                }
                items.add(parseExpr());
                if (peekPunct(',')) {
                    next();
                }
            }
        }

        /// Identifier, Greek letter or label glyph, joined with directly adjacent `_suffix` parts.
        private String parseName() {
            final Token t = peek();
            if (t == null || !(t.kind() == TokenKind.IDENTIFIER || t.role() == SymbolRole.GREEK || t.role() == SymbolRole.LABEL)) {
                return null;
            }
            next();
            final var sb = new StringBuilder(t.glyph());
            Token prev = t;
            while (peek() != null && peek().kind() == TokenKind.IDENTIFIER && peek().glyph().startsWith("_")
                && peek().byteOffset() == prev.byteOffset() + prev.glyph().getBytes(StandardCharsets.UTF_8).length) {
                prev = next();
                sb.append(prev.glyph());
            }
            return sb.toString();
        }

        private String requireName() {
            final String name = parseName();
            if (name == null) {
                throw unexpected("variable name expected");
            }
            return name;
        }

        private void expectSeparator() {
            if (peekPunct(':') || peekPunct('.')) {
                next();
                return;
            }
            throw unexpected("':' or '.' expected before quantifier body");
        }

        private void expect(String glyph) {
            if (!peekIs(glyph)) {
                throw unexpected("'" + glyph + "' expected");
            }
            next();
        }

        void expectEnd() {
            if (pos < seg.size()) {
                throw unexpected("unexpected '" + seg.get(pos).glyph() + "' after statement");
            }
        }

        private ParseException unexpected(String message) {
            final int at = pos < seg.size() ? seg.get(pos).byteOffset()
                : seg.isEmpty() ? -1 : seg.get(seg.size() - 1).byteOffset();
            return new ParseException(ParseException.Kind.UNEXPECTED_TOKEN, message, at, tag);
        }

        private Token peek() {
            return pos < seg.size() ? seg.get(pos) : null;
        }

        private Token next() {
            return seg.get(pos++);
        }

        private boolean peekIs(String glyph) {
            final Token t = peek();
            return t != null && t.kind() != TokenKind.STRING && t.is(glyph);
        }

        boolean peekPunct(char c) {
            final Token t = peek();
            return t != null && t.isPunct(c);
        }

        private boolean peekAny(Set<String> glyphs) {
            final Token t = peek();
            return t != null && t.kind() != TokenKind.STRING && glyphs.contains(t.glyph());
        }
    }

    static String asciiSuperscript(String glyph) {
        return switch (glyph) {
            case "⁺" -> "+";
            case "⁻" -> "-";
            default -> String.valueOf("⁰¹²³⁴⁵⁶⁷⁸⁹".indexOf(glyph));
        };
    }
}
