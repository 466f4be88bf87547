package com.eainde.intent.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves raw JSON property values into {@link PropertyValue} shapes and writes them back.
 *
 * <h3>Detection order (first match wins):</h3>
 * <ol>
 *   <li>text matching {@code <number><unit>} whose number parses → {@link PropertyValue.UnitValue}</li>
 *   <li>mapping with both {@code min} and {@code max} → {@link PropertyValue.Range}</li>
 *   <li>mapping with exactly one of {@code min} / {@code max} → {@link PropertyValue.Bound}</li>
 *   <li>anything else → {@link PropertyValue.Scalar}</li>
 * </ol>
 */
@Log4j2
public final class PropertyValues {

    private static final Pattern UNIT_VALUE = Pattern.compile("^([0-9.]+)\\s*([a-zA-Z%]+)$");

    private static final String MIN = "min";
    private static final String MAX = "max";
    private static final String UNIT = "unit";

    private PropertyValues() {
    }

    public static PropertyValue resolve(JsonNode node) {
        if (node != null && node.isTextual()) {
            return parseUnitValue(node.textValue())
                    .<PropertyValue>map(v -> v)
                    .orElseGet(() -> new PropertyValue.Scalar(node.textValue()));
        }
        if (node != null && node.isObject()) {
            return resolveMapping(node);
        }
        return new PropertyValue.Scalar(literal(node));
    }

    /**
     * Parses strings such as {@code "10ms"}, {@code "100 Mbps"} or {@code "99.9%"}.
     * Returns empty when the text does not match or the number does not parse.
     */
    public static Optional<PropertyValue.UnitValue> parseUnitValue(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = UNIT_VALUE.matcher(text.strip());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String number = matcher.group(1);
        try {
            Number value = number.contains(".") ? Double.valueOf(number) : Long.valueOf(number);
            return Optional.of(new PropertyValue.UnitValue(value, matcher.group(2), text));
        } catch (NumberFormatException e) {
            log.debug("Unit-tagged value '{}' has an unparsable number, keeping it as a literal", text);
            return Optional.empty();
        }
    }

    private static PropertyValue resolveMapping(JsonNode node) {
        boolean hasMin = node.has(MIN);
        boolean hasMax = node.has(MAX);
        if (!hasMin && !hasMax) {
            return new PropertyValue.Scalar(node.deepCopy());
        }

        String unit = node.hasNonNull(UNIT) ? node.get(UNIT).asText() : null;
        if (hasMin && hasMax) {
            return new PropertyValue.Range(literal(node.get(MIN)), literal(node.get(MAX)), unit);
        }
        return hasMin
                ? new PropertyValue.Bound(PropertyValue.Direction.MIN, literal(node.get(MIN)), unit)
                : new PropertyValue.Bound(PropertyValue.Direction.MAX, literal(node.get(MAX)), unit);
    }

    /**
     * Plain Java value for a JSON literal; containers stay as a detached {@link JsonNode}.
     */
    static Object literal(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isIntegralNumber()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node.deepCopy();
    }

    /**
     * Jackson module registering the {@link PropertyValue} codec.
     * Serialization writes the producer's shape back, so a session snapshot round-trips.
     */
    public static SimpleModule jacksonModule() {
        SimpleModule module = new SimpleModule("PropertyValueModule");
        module.addSerializer(PropertyValue.class, new Serializer());
        module.addDeserializer(PropertyValue.class, new Deserializer());
        return module;
    }

    static final class Serializer extends JsonSerializer<PropertyValue> {

        @Override
        public void serialize(PropertyValue value, JsonGenerator gen, SerializerProvider serializers)
                throws IOException {
            if (value instanceof PropertyValue.UnitValue unitValue) {
                gen.writeString(unitValue.raw());
            } else if (value instanceof PropertyValue.Range range) {
                gen.writeStartObject();
                serializers.defaultSerializeField(MIN, range.min(), gen);
                serializers.defaultSerializeField(MAX, range.max(), gen);
                if (range.unit() != null) {
                    gen.writeStringField(UNIT, range.unit());
                }
                gen.writeEndObject();
            } else if (value instanceof PropertyValue.Bound bound) {
                gen.writeStartObject();
                serializers.defaultSerializeField(bound.direction().key(), bound.value(), gen);
                if (bound.unit() != null) {
                    gen.writeStringField(UNIT, bound.unit());
                }
                gen.writeEndObject();
            } else if (value instanceof PropertyValue.Scalar scalar) {
                serializers.defaultSerializeValue(scalar.value(), gen);
            }
        }
    }

    static final class Deserializer extends JsonDeserializer<PropertyValue> {

        @Override
        public PropertyValue deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
            JsonNode node = ctxt.readTree(parser);
            return resolve(node);
        }

        @Override
        public PropertyValue getNullValue(DeserializationContext ctxt) {
            return new PropertyValue.Scalar(null);
        }
    }
}
