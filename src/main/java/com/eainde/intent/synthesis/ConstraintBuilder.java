package com.eainde.intent.synthesis;

import com.eainde.intent.model.PropertyValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.log4j.Log4j2;

import java.util.List;
import java.util.Locale;

/**
 * Maps a resolved {@link PropertyValue} to a formal ICM constraint.
 *
 * <h3>Shape → operator:</h3>
 * <ul>
 *   <li>unit-tagged value → operator inferred from the property name</li>
 *   <li>range → {@code between}</li>
 *   <li>lower bound → {@code greater}, upper bound → {@code smaller}</li>
 *   <li>anything else → {@code equals} on the literal</li>
 * </ul>
 */
@Log4j2
public class ConstraintBuilder {

    private static final List<String> SMALLER_IS_BETTER = List.of("latency", "latence", "delay", "jitter");
    private static final List<String> GREATER_IS_BETTER =
            List.of("bandwidth", "throughput", "availability", "debit", "disponibilite");

    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    public Constraint build(String propertyName, PropertyValue value) {
        if (value instanceof PropertyValue.UnitValue unitValue) {
            return Constraint.of(inferOperator(propertyName), propertyName, unitValue.value(), unitValue.unit());
        }
        if (value instanceof PropertyValue.Range range) {
            return Constraint.between(propertyName, range.min(), range.max(), range.unit());
        }
        if (value instanceof PropertyValue.Bound bound) {
            ConstraintOperator operator = bound.direction() == PropertyValue.Direction.MIN
                    ? ConstraintOperator.GREATER
                    : ConstraintOperator.SMALLER;
            return Constraint.of(operator, propertyName, bound.value(), bound.unit());
        }
        Object literal = value instanceof PropertyValue.Scalar scalar ? scalar.value() : null;
        return Constraint.of(ConstraintOperator.EQUALS, propertyName, literal, null);
    }

    /**
     * Case-insensitive substring match on the property name; the first matching category wins.
     */
    public ConstraintOperator inferOperator(String propertyName) {
        String lower = propertyName.toLowerCase(Locale.ROOT);
        if (SMALLER_IS_BETTER.stream().anyMatch(lower::contains)) {
            return ConstraintOperator.SMALLER;
        }
        if (GREATER_IS_BETTER.stream().anyMatch(lower::contains)) {
            return ConstraintOperator.GREATER;
        }
        log.debug("No operator keyword in property '{}', defaulting to equals", propertyName);
        return ConstraintOperator.EQUALS;
    }

    /**
     * Renders {@code {"icm:<op>": {"icm:ValueOf": "cem:<name>", ...}}}.
     *
     * <p>Between and bound constraints always carry {@code cem:unit}, empty when absent.
     * A literal equals carries none.</p>
     */
    public ObjectNode toIcm(Constraint constraint) {
        ObjectNode body = nodes.objectNode();
        body.put("icm:ValueOf", "cem:" + constraint.target());

        if (constraint.operator() == ConstraintOperator.BETWEEN) {
            body.set("icm:min", valueNode(constraint.min()));
            body.set("icm:max", valueNode(constraint.max()));
            body.put("cem:unit", constraint.unit() != null ? constraint.unit() : "");
        } else {
            body.set("icm:value", valueNode(constraint.value()));
            if (constraint.unit() != null) {
                body.put("cem:unit", constraint.unit());
            } else if (constraint.operator() != ConstraintOperator.EQUALS) {
                body.put("cem:unit", "");
            }
        }

        ObjectNode wrapper = nodes.objectNode();
        wrapper.set(constraint.operator().icmKey(), body);
        return wrapper;
    }

    public ObjectNode toIcm(String propertyName, PropertyValue value) {
        return toIcm(build(propertyName, value));
    }

    private JsonNode valueNode(Object value) {
        if (value == null) {
            return nodes.nullNode();
        }
        if (value instanceof JsonNode node) {
            return node.deepCopy();
        }
        if (value instanceof Long l) {
            return nodes.numberNode(l);
        }
        if (value instanceof Integer i) {
            return nodes.numberNode(i);
        }
        if (value instanceof Double d) {
            return nodes.numberNode(d);
        }
        if (value instanceof Number n) {
            return nodes.numberNode(n.doubleValue());
        }
        if (value instanceof Boolean b) {
            return nodes.booleanNode(b);
        }
        return nodes.textNode(value.toString());
    }
}
