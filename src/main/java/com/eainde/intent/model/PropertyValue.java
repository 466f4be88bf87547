package com.eainde.intent.model;

/**
 * A property value attached to a {@link ServiceIdentification}.
 *
 * <p>The shape is inferred structurally by {@link PropertyValues#resolve} when an
 * identification is ingested, and never re-inspected downstream.</p>
 *
 * <ul>
 *   <li>{@link Scalar} — any literal (string, number, boolean, or an unrecognised mapping)</li>
 *   <li>{@link UnitValue} — a unit-tagged string such as {@code "10ms"} or {@code "99.9%"}</li>
 *   <li>{@link Range} — a mapping with both {@code min} and {@code max}</li>
 *   <li>{@link Bound} — a mapping with exactly one of {@code min} / {@code max}</li>
 * </ul>
 *
 * <p>Bounds keep the producer's literal: Long or Double for JSON numbers, String for text
 * (e.g. {@code "5ms"}), Boolean, null, or a {@code JsonNode} for anything structured.</p>
 */
public sealed interface PropertyValue {

    /**
     * @param value String, Number, Boolean or a Jackson {@code JsonNode} for structured literals
     */
    record Scalar(Object value) implements PropertyValue {
    }

    /**
     * @param value Long when the numeric text had no decimal point, Double otherwise
     * @param unit  unit letters or {@code %}
     * @param raw   the producer's original text, kept for lossless transport
     */
    record UnitValue(Number value, String unit, String raw) implements PropertyValue {
    }

    record Range(Object min, Object max, String unit) implements PropertyValue {
    }

    record Bound(Direction direction, Object value, String unit) implements PropertyValue {
    }

    enum Direction {
        MIN("min"),
        MAX("max");

        private final String key;

        Direction(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }
    }
}
