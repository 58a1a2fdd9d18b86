package aisp.java17.parser;

/// Partition of the AISP glyph registry.
///
/// Each registered code point belongs to exactly one category. Tokens that are not
/// registry glyphs carry [#NONE], except unregistered non-ASCII text which is [#PROSE].
public enum SymbolCategory {
    /// Definition, transformation and implication glyphs: `≜ ≔ ⇒ ↦ ∘`
    TRANSMUTER,
    /// Set topology: `∈ ⊆ ∩ ∪ ∅`
    TOPOLOGIC,
    /// Binders over variables: `∀ ∃ λ`
    QUANTIFIER,
    /// Relations and connectives that narrow meaning: `≡ ≤ ∧ ¬ ⊢`
    CONTRACTOR,
    /// Carrier domains: `ℕ ℤ ℝ 𝔹 𝕊`
    DOMAIN,
    /// Tier markers, superscripts and Greek variables: `◊ ⁺ δ τ`
    INTENT,
    /// Bracket pairs: `⟦⟧ ⟨⟩`
    DELIMITER,
    /// Block labels and other glyphs with no operator meaning: `Ω Σ Γ`
    RESERVED,
    /// Unregistered non-ASCII text.
    PROSE,
    /// Not a registry glyph (identifiers, numbers, ASCII punctuation).
    NONE
}
