package com.eainde.intent.catalog;

import com.eainde.intent.model.ServiceDependency;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts customer-facing dependencies from a catalog record's
 * {@code serviceSpecRelationship} list.
 *
 * <p>Only {@code dependsOn} relationships whose {@code serviceSpec.@referredType} is
 * {@code CustomerFacingServiceSpecification} are kept; resource-facing and other
 * relationship kinds are dropped.</p>
 */
public final class DependencyExtractor {

    public static final String DEPENDS_ON = "dependsOn";
    public static final String CUSTOMER_FACING_SPEC = "CustomerFacingServiceSpecification";

    private DependencyExtractor() {
    }

    public static List<ServiceDependency> extract(JsonNode serviceRecord) {
        List<ServiceDependency> dependencies = new ArrayList<>();
        JsonNode relationships = serviceRecord.path("serviceSpecRelationship");
        if (!relationships.isArray()) {
            return dependencies;
        }

        for (JsonNode relationship : relationships) {
            if (!DEPENDS_ON.equals(relationship.path("relationshipType").asText(null))) {
                continue;
            }
            JsonNode spec = relationship.path("serviceSpec");
            if (!CUSTOMER_FACING_SPEC.equals(spec.path("@referredType").asText(null))) {
                continue;
            }
            dependencies.add(new ServiceDependency(
                    text(spec, "name", "Unknown"),
                    text(spec, "id", "unknown"),
                    text(spec, "version", "1.0.0"),
                    text(spec, "href", "")
            ));
        }
        return dependencies;
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : fallback;
    }
}
