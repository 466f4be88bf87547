package com.eainde.intent.model;

/**
 * How the user answered a round of proposals.
 */
public enum ValidationType {
    TOTAL,
    PARTIAL,
    REFUSAL
}
