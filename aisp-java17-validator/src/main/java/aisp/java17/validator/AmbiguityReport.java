package aisp.java17.validator;

import aisp.java17.parser.ParseStrategy;

import java.util.List;
import java.util.Objects;

/// Outcome of re-parsing a document under every [ParseStrategy].
///
/// @param unique      statements read the same way by every strategy that produced them
/// @param total       sum over statements of the distinct readings seen
/// @param strategies  strategies that produced a document
/// @param divergent   `Label#index` of each statement read more than one way
public record AmbiguityReport(double ambiguity, int unique, int total, List<ParseStrategy> strategies,
                              List<String> divergent) {
    public AmbiguityReport {
        Objects.requireNonNull(strategies, "strategies must not be null");
        Objects.requireNonNull(divergent, "divergent must not be null");
        strategies = List.copyOf(strategies); // defensive copy
        divergent = List.copyOf(divergent); // defensive copy
    }
}
