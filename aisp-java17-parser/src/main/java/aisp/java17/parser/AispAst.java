package aisp.java17.parser;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// AST of an AISP document.
///
/// A document is a header, optional metadata lines and an ordered mapping from [BlockTag] to
/// [Block]. Blocks hold [Statement]s, statements own [Expr] trees. All nodes are immutable and
/// collections are defensively copied, so one AST can be shared between concurrent consumers.
///
/// Statement kinds:
/// - Definition: `name ≜ expr` or `name ≔ expr`
/// - QuantifiedRule: `∀x:D:P`, `∃x∈S:P`
/// - Implication: a top-level `⇒ → ⇔ ↔`
/// - EvidenceTuple: `⟨δ≜0.75;φ≜100;τ≜◊⁺⁺⟩`
/// - Assertion: any other proposition, e.g. `x≥0`
public sealed interface AispAst {

    /// Root of a parsed document. `blocks` keeps source order.
    record Document(Header header, List<Metadata> metadata, Map<BlockTag, Block> blocks) implements AispAst {
        public Document {
            Objects.requireNonNull(header, "header must not be null");
            Objects.requireNonNull(metadata, "metadata must not be null");
            Objects.requireNonNull(blocks, "blocks must not be null");
            metadata = List.copyOf(metadata); // defensive copy
            blocks = Collections.unmodifiableMap(new LinkedHashMap<>(blocks));
        }

        /// The block for `tag`, or `null` when the document has none.
        public Block block(BlockTag tag) {
            return blocks.get(tag);
        }

        /// All statements in block order.
        public List<Statement> statements() {
            final var all = new ArrayList<Statement>();
            blocks.values().forEach(b -> all.addAll(b.statements()));
            return Collections.unmodifiableList(all);
        }
    }

    /// `𝔸5.1.name#meta@2026-01-16`. `meta` is empty when absent.
    record Header(String marker, String version, String name, String meta, String date, int byteOffset) implements AispAst {
        public Header {
            Objects.requireNonNull(marker, "marker must not be null");
            Objects.requireNonNull(version, "version must not be null");
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(meta, "meta must not be null");
            Objects.requireNonNull(date, "date must not be null");
        }
    }

    /// Prelude declaration such as `γ≔tic.tac.toe` or `ρ≔⟨game,rules⟩`.
    record Metadata(String key, Expr value, int byteOffset) implements AispAst {
        public Metadata {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    record Block(BlockTag tag, String label, List<Statement> statements, int byteOffset) implements AispAst {
        public Block {
            Objects.requireNonNull(tag, "tag must not be null");
            Objects.requireNonNull(label, "label must not be null");
            Objects.requireNonNull(statements, "statements must not be null");
            statements = List.copyOf(statements); // defensive copy
        }
    }

    sealed interface Statement extends AispAst permits Definition, QuantifiedRule, Implication, EvidenceTuple, Assertion {
        BlockTag block();

        int byteOffset();
    }

    enum DefinitionOp {
        DEFINE("≜"),
        ASSIGN("≔");

        private final String glyph;

        DefinitionOp(String glyph) {
            this.glyph = glyph;
        }

        public String glyph() {
            return glyph;
        }
    }

    record Definition(String name, DefinitionOp op, Expr body, BlockTag block, int byteOffset) implements Statement {
        public Definition {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(body, "body must not be null");
            Objects.requireNonNull(block, "block must not be null");
        }
    }

    record QuantifiedRule(Quantified rule, BlockTag block, int byteOffset) implements Statement {
        public QuantifiedRule {
            Objects.requireNonNull(rule, "rule must not be null");
            Objects.requireNonNull(block, "block must not be null");
        }
    }

    record Implication(Binary implication, BlockTag block, int byteOffset) implements Statement {
        public Implication {
            Objects.requireNonNull(implication, "implication must not be null");
            Objects.requireNonNull(block, "block must not be null");
            if (!Binary.isImplicationOp(implication.op())) {
                throw new IllegalArgumentException("not an implication: " + implication.op());
            }
        }
    }

    record EvidenceTuple(List<Definition> entries, BlockTag block, int byteOffset) implements Statement {
        public EvidenceTuple {
            Objects.requireNonNull(entries, "entries must not be null");
            Objects.requireNonNull(block, "block must not be null");
            entries = List.copyOf(entries); // defensive copy
        }

        /// The entry bound to `key`, or `null`.
        public Definition entry(String key) {
            for (Definition d : entries) {
                if (d.name().equals(key)) {
                    return d;
                }
            }
            return null;
        }
    }

    record Assertion(Expr expr, BlockTag block, int byteOffset) implements Statement {
        public Assertion {
            Objects.requireNonNull(expr, "expr must not be null");
            Objects.requireNonNull(block, "block must not be null");
        }
    }

    /// Expression tree node.
    sealed interface Expr extends AispAst permits
            Identifier,
            NumberLiteral,
            SymbolConstant,
            TierLiteral,
            Application,
            Binary,
            Unary,
            Quantified,
            Lambda,
            Tuple,
            Enumeration,
            Power,
            Text {}

    record Identifier(String name) implements Expr {
        public Identifier {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    record NumberLiteral(String text) implements Expr {
        public NumberLiteral {
            Objects.requireNonNull(text, "text must not be null");
        }

        public BigDecimal value() {
            return new BigDecimal(text);
        }
    }

    /// Registry constant or domain glyph: `ℕ ℝ ∅ ⊤ ⊥ ∞`.
    record SymbolConstant(String glyph) implements Expr {
        public SymbolConstant {
            Objects.requireNonNull(glyph, "glyph must not be null");
        }
    }

    /// `◊⁺⁺`, `◊⁺`, `◊`, `◊⁻` or `⊘`.
    record TierLiteral(String glyph) implements Expr {
        public TierLiteral {
            Objects.requireNonNull(glyph, "glyph must not be null");
        }
    }

    record Application(Expr function, List<Expr> args) implements Expr {
        public Application {
            Objects.requireNonNull(function, "function must not be null");
            Objects.requireNonNull(args, "args must not be null");
            args = List.copyOf(args); // defensive copy
        }
    }

    record Binary(String op, Expr left, Expr right) implements Expr {
        public Binary {
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        public static boolean isImplicationOp(String op) {
            return "⇒".equals(op) || "→".equals(op) || "⇔".equals(op) || "↔".equals(op);
        }
    }

    record Unary(String op, Expr operand) implements Expr {
        public Unary {
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(operand, "operand must not be null");
        }
    }

    /// A quantified formula. `domain` is `null` when the quantifier is unrestricted; `membership`
    /// distinguishes `∀x∈S` from the typed form `∀x:T`.
    record Quantified(String quantifier, String variable, Expr domain, boolean membership, Expr body) implements Expr {
        public Quantified {
            Objects.requireNonNull(quantifier, "quantifier must not be null");
            Objects.requireNonNull(variable, "variable must not be null");
            Objects.requireNonNull(body, "body must not be null");
            if (membership && domain == null) {
                throw new IllegalArgumentException("membership quantifier requires a domain");
            }
        }
    }

    record Lambda(List<String> params, Expr body) implements Expr {
        public Lambda {
            Objects.requireNonNull(params, "params must not be null");
            Objects.requireNonNull(body, "body must not be null");
            if (params.isEmpty()) {
                throw new IllegalArgumentException("lambda requires at least one parameter");
            }
            params = List.copyOf(params); // defensive copy
        }
    }

    record Tuple(List<Expr> elements) implements Expr {
        public Tuple {
            Objects.requireNonNull(elements, "elements must not be null");
            elements = List.copyOf(elements); // defensive copy
        }
    }

    record Enumeration(List<Expr> elements) implements Expr {
        public Enumeration {
            Objects.requireNonNull(elements, "elements must not be null");
            elements = List.copyOf(elements); // defensive copy
        }
    }

    /// A base raised to a superscript: `ℝ⁷⁶⁸` has exponent `768`, `ℝ⁺` has exponent `+`.
    record Power(Expr base, String exponent) implements Expr {
        public Power {
            Objects.requireNonNull(base, "base must not be null");
            Objects.requireNonNull(exponent, "exponent must not be null");
        }

        /// Numeric exponent, or -1 when the superscript is a sign.
        public int dimension() {
            try {
                return Integer.parseInt(exponent);
            } catch (NumberFormatException e) {
                return -1;
            }
        }
    }

    record Text(String value) implements Expr {
        public Text {
            Objects.requireNonNull(value, "value must not be null");
        }
    }
}
