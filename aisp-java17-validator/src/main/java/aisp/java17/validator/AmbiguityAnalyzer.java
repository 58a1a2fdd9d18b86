package aisp.java17.validator;

import aisp.java17.logic.StructuredLog;
import aisp.java17.parser.AispAst.Block;
import aisp.java17.parser.AispAst.Document;
import aisp.java17.parser.AispParser;
import aisp.java17.parser.AstPrinter;
import aisp.java17.parser.ParseException;
import aisp.java17.parser.ParseStrategy;
import aisp.java17.parser.Token;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static aisp.java17.validator.ValidatorLogging.LOG;

/// Measures how many ways a document can be read: `1 − unique/total` over the statement
/// fingerprints produced by the strict, permissive and backtracking parses.
///
/// Statements are keyed by block tag and index; two blocks may carry the same free-text label.
public final class AmbiguityAnalyzer {
    private AmbiguityAnalyzer() {}

    public static AmbiguityReport analyze(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        final Map<String, Set<String>> readings = new LinkedHashMap<>();
        final var produced = new ArrayList<ParseStrategy>();
        for (ParseStrategy strategy : ParseStrategy.values()) {
            final Document document;
            try {
                document = AispParser.parse(tokens, strategy);
            } catch (ParseException e) {
                LOG.finer(() -> "Strategy " + strategy + " produced no document: " + e.getMessage());
                continue;
            }
            produced.add(strategy);
            for (Block block : document.blocks().values()) {
                for (int i = 0; i < block.statements().size(); i++) {
                    readings.computeIfAbsent(block.tag().label() + "#" + i, k -> new LinkedHashSet<>())
                        .add(AstPrinter.fingerprint(block.statements().get(i)));
                }
            }
        }
        int unique = 0;
        int total = 0;
        final var divergent = new ArrayList<String>();
        for (var entry : readings.entrySet()) {
            final int distinct = entry.getValue().size();
            total += distinct;
            if (distinct == 1) {
                unique++;
            } else {
                divergent.add(entry.getKey());
            }
        }
        final double ambiguity = total == 0 ? 0.0 : 1.0 - (double) unique / total;
        StructuredLog.fine(LOG, "ambiguity", "strategies", produced.size(), "unique", unique, "total", total,
            "ambiguity", ambiguity);
        return new AmbiguityReport(ambiguity, unique, total, produced, divergent);
    }
}
