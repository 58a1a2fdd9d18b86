package aisp.java17.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import static aisp.java17.parser.SymbolCategory.CONTRACTOR;
import static aisp.java17.parser.SymbolCategory.DELIMITER;
import static aisp.java17.parser.SymbolCategory.DOMAIN;
import static aisp.java17.parser.SymbolCategory.INTENT;
import static aisp.java17.parser.SymbolCategory.QUANTIFIER;
import static aisp.java17.parser.SymbolCategory.RESERVED;
import static aisp.java17.parser.SymbolCategory.TOPOLOGIC;
import static aisp.java17.parser.SymbolCategory.TRANSMUTER;

/// Immutable registry of AISP glyphs.
///
/// It holds the subset of the Σ₅₁₂ alphabet that the parser and the analyzers act on:
/// delimiters, quantifiers, connectives, relations, operators, domains, tier markers,
/// superscripts, lower-case Greek and block labels. The rest of Σ₅₁₂, such as `∫`,
/// lexes as prose.
///
/// The table is built once from the literal rows below and looked up by binary search over a
/// sorted `int[]` of code points. It is a total function: code points that are not registered
/// resolve to `null` from [#lookup(int)] and are classified by the lexer as prose or ASCII.
///
/// The class also holds the adversarial screening sets used by [AispLexer]: bidirectional
/// controls, zero-width characters and the confusable glyphs that imitate registry symbols.
public final class SymbolTable {

    /// One registered glyph.
    public record Entry(int codePoint, String name, SymbolCategory category, SymbolRole role) {
        public String glyph() {
            return new String(Character.toChars(codePoint));
        }

        public boolean superscript() {
            return SUPERSCRIPTS.indexOf(codePoint) >= 0;
        }
    }

    private static final String SUPERSCRIPTS = "⁰¹²³⁴⁵⁶⁷⁸⁹⁺⁻";

    private static final int[] CODE_POINTS;
    private static final Entry[] ENTRIES;

    static {
        final var rows = new ArrayList<Entry>(160);
        // block delimiters and header marker
        row(rows, "⟦", "open-block", DELIMITER, SymbolRole.DELIMITER);
        row(rows, "⟧", "close-block", DELIMITER, SymbolRole.DELIMITER);
        row(rows, "⟨", "open-tuple", DELIMITER, SymbolRole.DELIMITER);
        row(rows, "⟩", "close-tuple", DELIMITER, SymbolRole.DELIMITER);
        row(rows, "𝔸", "aisp-marker", DELIMITER, SymbolRole.LABEL);
        // binders and quantifiers
        row(rows, "∀", "forall", QUANTIFIER, SymbolRole.QUANTIFIER);
        row(rows, "∃", "exists", QUANTIFIER, SymbolRole.QUANTIFIER);
        row(rows, "∄", "not-exists", QUANTIFIER, SymbolRole.QUANTIFIER);
        row(rows, "λ", "lambda", QUANTIFIER, SymbolRole.BINDER);
        row(rows, "≜", "define", TRANSMUTER, SymbolRole.BINDER);
        row(rows, "≔", "assign", TRANSMUTER, SymbolRole.BINDER);
        row(rows, "↦", "maps-to", TRANSMUTER, SymbolRole.OPERATOR);
        // connectives
        row(rows, "⇒", "implies", TRANSMUTER, SymbolRole.CONNECTIVE);
        row(rows, "→", "arrow", TRANSMUTER, SymbolRole.CONNECTIVE);
        row(rows, "⇔", "iff", TRANSMUTER, SymbolRole.CONNECTIVE);
        row(rows, "↔", "bi-arrow", TRANSMUTER, SymbolRole.CONNECTIVE);
        row(rows, "∧", "and", CONTRACTOR, SymbolRole.CONNECTIVE);
        row(rows, "∨", "or", CONTRACTOR, SymbolRole.CONNECTIVE);
        row(rows, "¬", "not", CONTRACTOR, SymbolRole.CONNECTIVE);
        row(rows, "∴", "therefore", CONTRACTOR, SymbolRole.NONE);
        row(rows, "∵", "because", CONTRACTOR, SymbolRole.NONE);
        // relations
        row(rows, "≡", "equivalent", CONTRACTOR, SymbolRole.RELATION);
        row(rows, "≢", "not-equivalent", CONTRACTOR, SymbolRole.RELATION);
        row(rows, "≠", "not-equal", CONTRACTOR, SymbolRole.RELATION);
        row(rows, "≈", "approximately", CONTRACTOR, SymbolRole.RELATION);
        row(rows, "≤", "less-equal", CONTRACTOR, SymbolRole.RELATION);
        row(rows, "≥", "greater-equal", CONTRACTOR, SymbolRole.RELATION);
        row(rows, "≪", "much-less", CONTRACTOR, SymbolRole.RELATION);
        row(rows, "≫", "much-greater", CONTRACTOR, SymbolRole.RELATION);
        row(rows, "⊢", "proves", CONTRACTOR, SymbolRole.RELATION);
        row(rows, "⊨", "models", CONTRACTOR, SymbolRole.RELATION);
        row(rows, "∈", "member", TOPOLOGIC, SymbolRole.RELATION);
        row(rows, "∉", "not-member", TOPOLOGIC, SymbolRole.RELATION);
        row(rows, "⊆", "subset-eq", TOPOLOGIC, SymbolRole.RELATION);
        row(rows, "⊇", "superset-eq", TOPOLOGIC, SymbolRole.RELATION);
        row(rows, "⊂", "subset", TOPOLOGIC, SymbolRole.RELATION);
        row(rows, "⊃", "superset", TOPOLOGIC, SymbolRole.RELATION);
        // operators
        row(rows, "∩", "intersection", TOPOLOGIC, SymbolRole.OPERATOR);
        row(rows, "∪", "union", TOPOLOGIC, SymbolRole.OPERATOR);
        row(rows, "∖", "set-minus", TOPOLOGIC, SymbolRole.OPERATOR);
        row(rows, "×", "product", TOPOLOGIC, SymbolRole.OPERATOR);
        row(rows, "∘", "compose", TRANSMUTER, SymbolRole.OPERATOR);
        row(rows, "⊕", "direct-sum", TRANSMUTER, SymbolRole.OPERATOR);
        row(rows, "⊖", "direct-difference", TRANSMUTER, SymbolRole.OPERATOR);
        row(rows, "⊗", "tensor", TRANSMUTER, SymbolRole.OPERATOR);
        row(rows, "·", "dot", TRANSMUTER, SymbolRole.OPERATOR);
        row(rows, "∑", "summation", TRANSMUTER, SymbolRole.OPERATOR);
        row(rows, "∏", "product-of", TRANSMUTER, SymbolRole.OPERATOR);
        row(rows, "√", "root", TRANSMUTER, SymbolRole.OPERATOR);
        row(rows, "∂", "partial", TRANSMUTER, SymbolRole.OPERATOR);
        row(rows, "‖", "norm", TRANSMUTER, SymbolRole.OPERATOR);
        row(rows, "⊥", "bottom", CONTRACTOR, SymbolRole.CONSTANT);
        row(rows, "⊤", "top", CONTRACTOR, SymbolRole.CONSTANT);
        row(rows, "∅", "empty-set", TOPOLOGIC, SymbolRole.CONSTANT);
        row(rows, "∞", "infinity", DOMAIN, SymbolRole.CONSTANT);
        row(rows, "∎", "qed", CONTRACTOR, SymbolRole.CONSTANT);
        // domains
        row(rows, "ℕ", "naturals", DOMAIN, SymbolRole.DOMAIN);
        row(rows, "ℤ", "integers", DOMAIN, SymbolRole.DOMAIN);
        row(rows, "ℝ", "reals", DOMAIN, SymbolRole.DOMAIN);
        row(rows, "ℚ", "rationals", DOMAIN, SymbolRole.DOMAIN);
        row(rows, "𝔹", "booleans", DOMAIN, SymbolRole.DOMAIN);
        row(rows, "𝕊", "strings", DOMAIN, SymbolRole.DOMAIN);
        row(rows, "𝔻", "documents", DOMAIN, SymbolRole.DOMAIN);
        row(rows, "𝒫", "powerset", DOMAIN, SymbolRole.DOMAIN);
        row(rows, "𝕍", "vector-spaces", DOMAIN, SymbolRole.DOMAIN);
        // tier markers and superscripts
        row(rows, "◊", "tier", INTENT, SymbolRole.TIER_MARKER);
        row(rows, "⊘", "reject", INTENT, SymbolRole.TIER_MARKER);
        row(rows, "⁺", "sup-plus", INTENT, SymbolRole.TIER_MARKER);
        row(rows, "⁻", "sup-minus", INTENT, SymbolRole.TIER_MARKER);
        final String digits = "⁰¹²³⁴⁵⁶⁷⁸⁹";
        for (int i = 0; i < digits.length(); i++) {
            row(rows, digits.substring(i, i + 1), "sup-" + i, INTENT, SymbolRole.OPERATOR);
        }
        // lower-case Greek used as variables and evidence keys
        final String greek = "αβγδεζηθικμνξπρσςτυφχψω";
        for (int i = 0; i < greek.length(); i++) {
            row(rows, greek.substring(i, i + 1), "greek-" + Character.getName(greek.charAt(i)).toLowerCase(java.util.Locale.ROOT)
                .replace("greek small letter ", ""), INTENT, SymbolRole.GREEK);
        }
        // block labels
        row(rows, "Ω", "omega-meta", RESERVED, SymbolRole.LABEL);
        row(rows, "Σ", "sigma-types", RESERVED, SymbolRole.LABEL);
        row(rows, "Γ", "gamma-rules", RESERVED, SymbolRole.LABEL);
        row(rows, "Λ", "lambda-functions", RESERVED, SymbolRole.LABEL);
        row(rows, "Ε", "epsilon-evidence", RESERVED, SymbolRole.LABEL);
        row(rows, "Χ", "chi-errors", RESERVED, SymbolRole.LABEL);
        row(rows, "Θ", "theta-proofs", RESERVED, SymbolRole.LABEL);
        row(rows, "ℭ", "categories", RESERVED, SymbolRole.LABEL);
        row(rows, "Δ", "delta-contract", RESERVED, SymbolRole.LABEL);
        row(rows, "Ψ", "psi-intent", RESERVED, SymbolRole.LABEL);
        row(rows, "Φ", "phi", RESERVED, SymbolRole.LABEL);
        row(rows, "Π", "pi-product", RESERVED, SymbolRole.LABEL);

        rows.sort(Comparator.comparingInt(Entry::codePoint));
        CODE_POINTS = new int[rows.size()];
        ENTRIES = new Entry[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            final var e = rows.get(i);
            if (i > 0 && CODE_POINTS[i - 1] == e.codePoint()) {
                throw new IllegalStateException("duplicate registry glyph " + e.glyph());
            }
            CODE_POINTS[i] = e.codePoint();
            ENTRIES[i] = e;
        }
    }

    private static final Map<Integer, String> CONFUSABLES = Map.ofEntries(
        Map.entry(0x2126, "Ω"),  // OHM SIGN
        Map.entry(0x2206, "Δ"),  // INCREMENT
        Map.entry(0x2C6F, "∀"),  // TURNED CAPITAL A
        Map.entry(0x018E, "∃"),  // REVERSED CAPITAL E
        Map.entry(0x03F5, "∈"),  // GREEK LUNATE EPSILON SYMBOL
        Map.entry(0x0454, "∈"),  // CYRILLIC SMALL LETTER UKRAINIAN IE
        Map.entry(0x301A, "⟦"),
        Map.entry(0x301B, "⟧"),
        Map.entry(0x2329, "⟨"),
        Map.entry(0x232A, "⟩"),
        Map.entry(0x3008, "⟨"),
        Map.entry(0x3009, "⟩"),
        Map.entry(0x0413, "Γ"),  // CYRILLIC CAPITAL LETTER GHE
        Map.entry(0x0245, "Λ")   // LATIN CAPITAL LETTER TURNED V
    );

    private SymbolTable() {}

    private static void row(List<Entry> rows, String glyph, String name, SymbolCategory category, SymbolRole role) {
        rows.add(new Entry(glyph.codePointAt(0), name, category, role));
    }

    /// Returns the registry entry for `codePoint`, or `null` when it is not a registry glyph.
    public static Entry lookup(int codePoint) {
        final int i = Arrays.binarySearch(CODE_POINTS, codePoint);
        return i >= 0 ? ENTRIES[i] : null;
    }

    public static boolean isRegistered(int codePoint) {
        return Arrays.binarySearch(CODE_POINTS, codePoint) >= 0;
    }

    /// Classification of an arbitrary scalar: the registry category, [SymbolCategory#PROSE] for
    /// other non-ASCII scalars and [SymbolCategory#NONE] for ASCII.
    public static SymbolCategory categoryOf(int codePoint) {
        final var e = lookup(codePoint);
        if (e != null) {
            return e.category();
        }
        return codePoint < 0x80 ? SymbolCategory.NONE : SymbolCategory.PROSE;
    }

    public static List<Entry> entries() {
        return Collections.unmodifiableList(Arrays.asList(ENTRIES));
    }

    public static int size() {
        return ENTRIES.length;
    }

    static boolean isBidiControl(int cp) {
        return (cp >= 0x202A && cp <= 0x202E)
            || (cp >= 0x2066 && cp <= 0x2069)
            || cp == 0x200E || cp == 0x200F || cp == 0x061C;
    }

    static boolean isZeroWidth(int cp) {
        return (cp >= 0x200B && cp <= 0x200D) || cp == 0x2060 || cp == 0xFEFF;
    }

    /// The registry glyph imitated by `cp`, or `null`.
    static String confusableFor(int cp) {
        return CONFUSABLES.get(cp);
    }
}
