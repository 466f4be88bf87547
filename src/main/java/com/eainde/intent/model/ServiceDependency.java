package com.eainde.intent.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A customer-facing service the candidate depends on, taken from the catalog record.
 */
public record ServiceDependency(
        @JsonProperty("name")    String name,
        @JsonProperty("id")      String id,
        @JsonProperty("version") String version,
        @JsonProperty("href")    String href
) {}
