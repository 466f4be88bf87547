package com.eainde.intent.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A catalog entry proposed for one identified service.
 *
 * @param serviceId    catalog id, used to derive target and expectation ids
 * @param name         catalog name
 * @param description  catalog description
 * @param score        retrieval similarity in [0, 1], rounded to 3 decimals
 * @param dependencies CFSS dependencies in catalog order
 */
public record ServiceCandidate(
        @JsonProperty("serviceId")    String serviceId,
        @JsonProperty("name")         String name,
        @JsonProperty("description")  String description,
        @JsonProperty("score")        double score,
        @JsonProperty("dependencies") List<ServiceDependency> dependencies
) {

    public ServiceCandidate {
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
    }
}
