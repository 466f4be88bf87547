package com.eainde.intent.synthesis;

/**
 * A formal constraint on one property of a delivered service.
 *
 * <p>{@link ConstraintOperator#BETWEEN} carries {@code min} and {@code max}; every other
 * operator carries {@code value}. {@code unit} is null when the producer gave none.
 * Values and bounds are the producer's literals, so text such as {@code "5ms"} passes through.</p>
 */
public record Constraint(
        ConstraintOperator operator,
        String target,
        Object value,
        Object min,
        Object max,
        String unit
) {

    public static Constraint of(ConstraintOperator operator, String target, Object value, String unit) {
        return new Constraint(operator, target, value, null, null, unit);
    }

    public static Constraint between(String target, Object min, Object max, String unit) {
        return new Constraint(ConstraintOperator.BETWEEN, target, null, min, max, unit);
    }
}
