package com.eainde.intent.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A service the NLU collaborator recognised in the user's request.
 *
 * @param name       unique key within a negotiation
 * @param rationale  why the service was identified
 * @param properties constraints the user stated for this service only
 */
public record ServiceIdentification(
        @JsonProperty("name")       String name,
        @JsonProperty("rationale")  String rationale,
        @JsonProperty("properties") Map<String, PropertyValue> properties
) {

    public ServiceIdentification {
        rationale = rationale != null ? rationale : "";
        properties = properties != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(properties))
                : Map.of();
    }

    public static ServiceIdentification of(String name, String rationale) {
        return new ServiceIdentification(name, rationale, Map.of());
    }

    public boolean hasProperties() {
        return !properties.isEmpty();
    }
}
