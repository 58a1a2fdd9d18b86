package aisp.java17.logic;

import java.util.List;
import java.util.Objects;

/// Formula IR for a whole document.
///
/// @param axioms      domain, enumeration and set axioms asserted for the document
/// @param definitions context definitions from every block except Types and Evidence
/// @param rules       one obligation per translatable rule statement
/// @param failures    statements that could not be translated
public record Translation(
    List<Axiom> axioms,
    List<Formula.Definition> definitions,
    List<TranslatedRule> rules,
    List<TranslationException> failures
) {
    public Translation {
        Objects.requireNonNull(axioms, "axioms must not be null");
        Objects.requireNonNull(definitions, "definitions must not be null");
        Objects.requireNonNull(rules, "rules must not be null");
        Objects.requireNonNull(failures, "failures must not be null");
        axioms = List.copyOf(axioms); // defensive copy
        definitions = List.copyOf(definitions); // defensive copy
        rules = List.copyOf(rules); // defensive copy
        failures = List.copyOf(failures); // defensive copy
    }
}
