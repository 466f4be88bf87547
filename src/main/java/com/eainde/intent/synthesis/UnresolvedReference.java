package com.eainde.intent.synthesis;

/**
 * A session inconsistency the synthesizer skipped over.
 *
 * @param name the service name involved
 * @param kind which side of the inconsistency it is on
 */
public record UnresolvedReference(String name, Kind kind) {

    public enum Kind {
        /** Validated, but no identification carries this name. */
        VALIDATED_WITHOUT_IDENTIFICATION,
        /** Identified with properties, but never validated. */
        IDENTIFIED_WITHOUT_VALIDATION
    }
}
