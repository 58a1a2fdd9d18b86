package aisp.java17.logic;

import aisp.java17.parser.BlockTag;

import java.util.List;
import java.util.Objects;

/// A document statement translated into a proof obligation.
///
/// @param id               stable identifier `Label#index`, e.g. `Rules#0`
/// @param index            position of the statement in its block
/// @param source           canonical rendering of the AISP statement
/// @param assumptions      axioms, definitions and invariants in scope for this rule
/// @param citedAxioms      axioms the translation itself relied on, e.g. `set-union`
/// @param selfReferential  the rule talks about the validation of its own document
public record TranslatedRule(
    String id,
    BlockTag block,
    int index,
    int byteOffset,
    String source,
    Formula formula,
    List<Axiom> assumptions,
    List<String> citedAxioms,
    boolean selfReferential
) {
    public TranslatedRule {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(block, "block must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(formula, "formula must not be null");
        Objects.requireNonNull(assumptions, "assumptions must not be null");
        Objects.requireNonNull(citedAxioms, "citedAxioms must not be null");
        assumptions = List.copyOf(assumptions); // defensive copy
        citedAxioms = List.copyOf(citedAxioms); // defensive copy
    }

    public Obligation obligation() {
        return new Obligation(id, formula, assumptions);
    }
}
