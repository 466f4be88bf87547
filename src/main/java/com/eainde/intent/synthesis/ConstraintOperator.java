package com.eainde.intent.synthesis;

/**
 * ICM comparison operators, rendered as {@code icm:<key>}.
 */
public enum ConstraintOperator {
    EQUALS("equals"),
    SMALLER("smaller"),
    GREATER("greater"),
    BETWEEN("between");

    private final String key;

    ConstraintOperator(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public String icmKey() {
        return "icm:" + key;
    }
}
