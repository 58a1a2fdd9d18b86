package aisp.java17.logic;

import java.util.Objects;

/// Sort of a term. Built-in sorts map onto SMT-LIB theories; everything else is an
/// uninterpreted sort named after the AISP type that introduced it.
///
/// `Nat` is encoded as `Int` and guarded by the `nat-domain` axiom.
public record Sort(String name, boolean numeric, boolean integral, boolean interpreted) {

    public static final Sort NAT = new Sort("Nat", true, true, true);
    public static final Sort INT = new Sort("Int", true, true, true);
    public static final Sort REAL = new Sort("Real", true, false, true);
    public static final Sort BOOL = new Sort("Bool", false, false, true);
    public static final Sort STRING = new Sort("String", false, false, true);
    /// Sort of set-valued terms such as `union(A,B)` or `empty`.
    public static final Sort SET = new Sort("Set", false, false, false);
    /// Fallback for identifiers whose type is not declared.
    public static final Sort OBJECT = new Sort("Obj", false, false, false);

    public Sort {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("sort name must not be blank");
        }
    }

    public static Sort uninterpreted(String name) {
        return new Sort(name, false, false, false);
    }

    /// Sort for an AISP domain glyph, or `null` when the glyph is not a number or value domain.
    public static Sort forDomainGlyph(String glyph) {
        return switch (glyph) {
            case "ℕ" -> NAT;
            case "ℤ" -> INT;
            case "ℝ", "ℚ" -> REAL;
            case "𝔹" -> BOOL;
            case "𝕊" -> STRING;
            default -> null;
        };
    }

    /// Name used in SMT-LIB output.
    public String smtName() {
        return isNat() ? "Int" : name;
    }

    public boolean isNat() {
        return equals(NAT);
    }

    /// Whether a term of sort `other` may stand where this sort is expected.
    public boolean accepts(Sort other) {
        if (equals(other)) {
            return true;
        }
        if (numeric && other.numeric) {
            // Nat ⊆ Int ⊆ Real; a Nat slot only takes Nat terms
            return !isNat() && (!integral || other.integral);
        }
        return false;
    }

    @Override
    public String toString() {
        return name;
    }
}
