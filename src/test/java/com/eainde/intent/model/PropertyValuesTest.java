package com.eainde.intent.model;

import com.eainde.intent.state.SessionState;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PropertyValuesTest {

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(PropertyValues.jacksonModule());

    private PropertyValue resolve(String json) throws Exception {
        return PropertyValues.resolve(objectMapper.readTree(json));
    }

    @Nested
    @DisplayName("Shape detection")
    class Detection {

        @Test
        @DisplayName("should read '10ms' as an integer unit value")
        void integerUnitValue() throws Exception {
            assertThat(resolve("\"10ms\""))
                    .isEqualTo(new PropertyValue.UnitValue(10L, "ms", "10ms"));
        }

        @Test
        @DisplayName("should read '99.9 %' as a decimal unit value, keeping the raw text")
        void decimalUnitValueWithSpace() throws Exception {
            assertThat(resolve("\"99.9 %\""))
                    .isEqualTo(new PropertyValue.UnitValue(99.9, "%", "99.9 %"));
        }

        @Test
        @DisplayName("should keep '1.2.3ms' as a literal")
        void unparsableUnitValue() throws Exception {
            assertThat(resolve("\"1.2.3ms\"")).isEqualTo(new PropertyValue.Scalar("1.2.3ms"));
        }

        @Test
        @DisplayName("should read plain words as literals")
        void plainText() throws Exception {
            assertThat(resolve("\"red\"")).isEqualTo(new PropertyValue.Scalar("red"));
            assertThat(resolve("\"Paris\"")).isEqualTo(new PropertyValue.Scalar("Paris"));
        }

        @Test
        @DisplayName("should read min and max as a range")
        void range() throws Exception {
            assertThat(resolve("{\"min\": 10, \"max\": 20, \"unit\": \"ms\"}"))
                    .isEqualTo(new PropertyValue.Range(10L, 20L, "ms"));
        }

        @Test
        @DisplayName("should read a single min as a lower bound without unit")
        void lowerBound() throws Exception {
            assertThat(resolve("{\"min\": 5}"))
                    .isEqualTo(new PropertyValue.Bound(PropertyValue.Direction.MIN, 5L, null));
        }

        @Test
        @DisplayName("should read a single max as an upper bound")
        void upperBound() throws Exception {
            assertThat(resolve("{\"max\": 2.5, \"unit\": \"ms\"}"))
                    .isEqualTo(new PropertyValue.Bound(PropertyValue.Direction.MAX, 2.5, "ms"));
        }

        @Test
        @DisplayName("should keep text bounds as written")
        void textualBounds() throws Exception {
            assertThat(resolve("{\"min\": \"10\", \"max\": \"20.5\"}"))
                    .isEqualTo(new PropertyValue.Range("10", "20.5", null));
        }

        @Test
        @DisplayName("should read unit-tagged text bounds as a range")
        void unitTaggedBounds() throws Exception {
            assertThat(resolve("{\"min\": \"5ms\", \"max\": \"10ms\"}"))
                    .isEqualTo(new PropertyValue.Range("5ms", "10ms", null));
        }

        @Test
        @DisplayName("should read a single non-numeric bound as a bound")
        void nonNumericBound() throws Exception {
            assertThat(resolve("{\"min\": \"low\"}"))
                    .isEqualTo(new PropertyValue.Bound(PropertyValue.Direction.MIN, "low", null));
        }

        @Test
        @DisplayName("should count a null bound as present")
        void nullBound() throws Exception {
            assertThat(resolve("{\"min\": null, \"max\": 20}"))
                    .isEqualTo(new PropertyValue.Range(null, 20L, null));
        }

        @Test
        @DisplayName("should keep numbers and booleans as typed literals")
        void numbersAndBooleans() throws Exception {
            assertThat(resolve("50")).isEqualTo(new PropertyValue.Scalar(50L));
            assertThat(resolve("0.75")).isEqualTo(new PropertyValue.Scalar(0.75));
            assertThat(resolve("true")).isEqualTo(new PropertyValue.Scalar(true));
        }
    }

    @Nested
    @DisplayName("Session snapshot transport")
    class Transport {

        @Test
        @DisplayName("should round-trip every session field through JSON")
        void sessionRoundTrip() throws Exception {
            Map<String, PropertyValue> properties = new LinkedHashMap<>();
            properties.put("latency", new PropertyValue.UnitValue(5L, "ms", "5ms"));
            properties.put("bandwidth", new PropertyValue.Range(100L, 200L, "Mbps"));
            properties.put("availability", new PropertyValue.Bound(PropertyValue.Direction.MIN, 99.9, null));
            properties.put("area", new PropertyValue.Scalar("Paris"));

            ServiceCandidate candidate = new ServiceCandidate("S1", "uRLLC slice", "low latency", 0.912,
                    List.of(new ServiceDependency("Edge", "D1", "2.0.0", "/spec/D1")));

            SessionState state = SessionState.create(3);
            state.startedWith("slice for drones");
            state.upsertIdentifications(List.of(new ServiceIdentification("slice", "drones", properties)));
            state.replaceCandidates("slice", List.of(candidate));
            state.validate("slice", candidate);
            state.addToHistory("User: slice for drones");
            state.advanceIteration();

            String json = objectMapper.writeValueAsString(state);
            SessionState restored = objectMapper.readValue(json, SessionState.class);

            assertThat(restored.getIteration()).isEqualTo(1);
            assertThat(restored.getMaxIterations()).isEqualTo(3);
            assertThat(restored.getOriginalRequest()).isEqualTo("slice for drones");
            assertThat(restored.getHistory()).containsExactly("User: slice for drones");
            assertThat(restored.getIdentified().get("slice").properties())
                    .containsExactlyEntriesOf(properties);
            assertThat(restored.getCandidatesByService().get("slice")).containsExactly(candidate);
            assertThat(restored.getValidated()).containsEntry("slice", candidate);
            assertThat(objectMapper.writeValueAsString(restored)).isEqualTo(json);
        }

        @Test
        @DisplayName("should write a unit value back as the producer's text")
        void unitValueWrittenRaw() throws Exception {
            assertThat(objectMapper.writeValueAsString(new PropertyValue.UnitValue(100L, "Mbps", "100 Mbps")))
                    .isEqualTo("\"100 Mbps\"");
        }

        @Test
        @DisplayName("should write text bounds back unchanged")
        void textBoundsWrittenBack() throws Exception {
            String json = objectMapper.writeValueAsString(new PropertyValue.Range("5ms", "10ms", null));

            assertThat(json).isEqualTo("{\"min\":\"5ms\",\"max\":\"10ms\"}");
            assertThat(objectMapper.readValue(json, PropertyValue.class))
                    .isEqualTo(new PropertyValue.Range("5ms", "10ms", null));
        }
    }
}
