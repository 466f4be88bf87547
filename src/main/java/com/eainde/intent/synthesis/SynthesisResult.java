package com.eainde.intent.synthesis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * The TMF921 intent document together with the references it had to skip.
 */
public record SynthesisResult(ObjectNode intent, List<UnresolvedReference> unresolvedReferences) {

    public SynthesisResult {
        unresolvedReferences = unresolvedReferences != null ? List.copyOf(unresolvedReferences) : List.of();
    }

    public boolean isComplete() {
        return unresolvedReferences.isEmpty();
    }

    /**
     * The {@code icm:hasExpectation} map of the single intent node.
     */
    public JsonNode hasExpectation() {
        JsonNode root = intent.path("expression").path("expressionValue");
        JsonNode intentNode = root.path("ex:" + intent.path("name").asText());
        return intentNode.path("icm:hasExpectation");
    }
}
