package com.eainde.intent.model;

import java.util.Locale;

/**
 * Routing category of an incoming request.
 */
public enum RequestCategory {
    TELECOM,
    GREETING,
    OUT_OF_SCOPE;

    /**
     * Maps a collaborator label to a category. Anything that is neither a greeting
     * nor explicitly out of scope is routed as a telecom request.
     */
    public static RequestCategory fromLabel(String label) {
        if (label == null) {
            return TELECOM;
        }
        String normalized = label.strip().toUpperCase(Locale.ROOT);
        if (normalized.equals(GREETING.name())) {
            return GREETING;
        }
        if (normalized.equals(OUT_OF_SCOPE.name())) {
            return OUT_OF_SCOPE;
        }
        return TELECOM;
    }
}
