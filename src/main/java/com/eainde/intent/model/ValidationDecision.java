package com.eainde.intent.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The user's answer to one round of proposals.
 *
 * @param type     overall verdict
 * @param selected identified service name → serviceId of the chosen candidate
 * @param refused  identified service names the user rejected
 * @param comment  free text, recorded in the session history when present
 */
public record ValidationDecision(
        @JsonProperty("type")     ValidationType type,
        @JsonProperty("selected") Map<String, String> selected,
        @JsonProperty("refused")  List<String> refused,
        @JsonProperty("comment")  String comment
) {

    public ValidationDecision {
        selected = selected != null ? Collections.unmodifiableMap(new LinkedHashMap<>(selected)) : Map.of();
        refused = refused != null ? List.copyOf(refused) : List.of();
    }

    public static ValidationDecision accept(Map<String, String> selected) {
        return new ValidationDecision(ValidationType.TOTAL, selected, List.of(), null);
    }

    public static ValidationDecision partial(Map<String, String> selected, List<String> refused, String comment) {
        return new ValidationDecision(ValidationType.PARTIAL, selected, refused, comment);
    }
}
