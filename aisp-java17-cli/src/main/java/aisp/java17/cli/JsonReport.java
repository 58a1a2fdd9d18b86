package aisp.java17.cli;

import aisp.java17.logic.Invariant;
import aisp.java17.logic.Verdict;
import aisp.java17.validator.Diagnostic;
import aisp.java17.validator.RuleVerdict;
import aisp.java17.validator.TriVectorResult;
import aisp.java17.validator.ValidationResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.UncheckedIOException;
import java.util.Objects;

/// Renders a [ValidationResult] as the machine-readable report printed by `validate --json`.
///
/// The tree is built by hand so field names stay snake_case and independent of the
/// Java record accessors.
final class JsonReport {

    private final ObjectMapper mapper;

    JsonReport() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    JsonReport(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    ObjectNode toTree(ValidationResult result) {
        Objects.requireNonNull(result, "result must not be null");
        final ObjectNode root = mapper.createObjectNode();
        root.put("valid", result.valid());
        root.put("tier", result.tier().glyph());
        root.put("tier_name", result.tier().name());
        root.put("delta", result.delta());
        root.put("ambiguity", result.ambiguity());
        root.put("pure_density", result.pureDensity());

        final ArrayNode rules = root.putArray("rules");
        for (RuleVerdict r : result.ruleVerdicts()) {
            final ObjectNode node = rules.addObject();
            node.put("id", r.id());
            node.put("block", r.block().label());
            node.put("formula", r.formula());
            node.put("verdict", verdictName(r.verdict()));
            node.put("backend", r.backend());
            if (r.reason() == null) {
                node.putNull("reason");
            } else {
                node.put("reason", r.reason());
            }
        }

        final ArrayNode invariants = root.putArray("invariants");
        for (Invariant inv : result.invariants()) {
            invariants.addObject()
                .put("kind", inv.kind().name())
                .put("description", inv.description())
                .put("confidence", inv.confidence());
        }

        final TriVectorResult tv = result.triVector();
        if (tv == null) {
            root.putNull("tri_vector");
        } else {
            root.putObject("tri_vector")
                .put("semantic_safety_dim", tv.semanticSafety().dimension())
                .put("structural_safety_dim", tv.structuralSafety().dimension())
                .put("semantic_structural_dim", tv.semanticStructural().dimension())
                .put("max_inner_product", tv.maxInnerProduct());
        }

        final ArrayNode diagnostics = root.putArray("diagnostics");
        for (Diagnostic d : result.diagnostics()) {
            diagnostics.addObject()
                .put("kind", d.kind().name())
                .put("severity", d.severity().name())
                .put("location", d.location().toString())
                .put("message", d.message());
        }
        return root;
    }

    String render(ValidationResult result) {
        try {
            return mapper.writeValueAsString(toTree(result));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    static String verdictName(Verdict verdict) {
        if (verdict instanceof Verdict.Proven) {
            return "proven";
        }
        if (verdict instanceof Verdict.Disproven) {
            return "disproven";
        }
        return "unknown";
    }
}
