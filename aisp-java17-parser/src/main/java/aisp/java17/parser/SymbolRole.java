package aisp.java17.parser;

/// Syntactic role of a registry glyph. The parser dispatches on roles, never on raw code points.
public enum SymbolRole {
    QUANTIFIER,
    BINDER,
    DELIMITER,
    RELATION,
    CONNECTIVE,
    OPERATOR,
    TIER_MARKER,
    DOMAIN,
    CONSTANT,
    LABEL,
    GREEK,
    NONE
}
