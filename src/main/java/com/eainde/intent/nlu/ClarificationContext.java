package com.eainde.intent.nlu;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Everything the NLU collaborator needs to propose replacements for refused services.
 *
 * @param validated      names already accepted, never to be proposed again
 * @param refused        names the user rejected
 * @param clarification  the user's free-text clarification
 * @param originalRequest the request that opened the negotiation
 * @param history        session history, oldest first
 */
public record ClarificationContext(
        Set<String> validated,
        Set<String> refused,
        String clarification,
        String originalRequest,
        List<String> history
) {

    public ClarificationContext {
        validated = validated != null ? Collections.unmodifiableSet(new LinkedHashSet<>(validated)) : Set.of();
        refused = refused != null ? Collections.unmodifiableSet(new LinkedHashSet<>(refused)) : Set.of();
        clarification = clarification != null ? clarification : "";
        originalRequest = originalRequest != null ? originalRequest : "";
        history = history != null ? List.copyOf(history) : List.of();
    }
}
