package com.eainde.intent.nlu;

import com.eainde.intent.model.PropertyValue;
import com.eainde.intent.model.PropertyValues;
import com.eainde.intent.model.ServiceIdentification;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses the JSON returned by the decomposition agent into {@link ServiceIdentification}s.
 *
 * <p>Property values are resolved into {@link PropertyValue} shapes here, once.
 * Markdown fences around the JSON are tolerated, and both the current key names and the
 * legacy ones ({@code services_identifies}, {@code nom}, {@code raison}, {@code proprietes})
 * are accepted.</p>
 */
@Log4j2
public class DecompositionParser {

    private static final String[] SERVICE_ARRAY_KEYS = {"services", "services_identifies"};
    private static final String[] NAME_KEYS = {"name", "nom"};
    private static final String[] RATIONALE_KEYS = {"rationale", "raison"};
    private static final String[] PROPERTIES_KEYS = {"properties", "proprietes"};

    private final ObjectMapper objectMapper;

    public DecompositionParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws JsonProcessingException when the text is not JSON
     */
    public List<ServiceIdentification> parse(String json) throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(stripFences(json));
        JsonNode services = findServiceArray(root);

        List<ServiceIdentification> identifications = new ArrayList<>();
        for (JsonNode service : services) {
            String name = firstText(service, NAME_KEYS);
            if (name == null || name.isBlank()) {
                log.warn("Ignoring identified service without a name: {}", service);
                continue;
            }
            identifications.add(new ServiceIdentification(
                    name,
                    firstText(service, RATIONALE_KEYS),
                    parseProperties(first(service, PROPERTIES_KEYS))
            ));
        }
        return identifications;
    }

    /**
     * Parses a JSON array of strings. Non-text elements are skipped.
     */
    public List<String> parseNames(String json) throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(stripFences(json));
        List<String> names = new ArrayList<>();
        if (root.isArray()) {
            for (JsonNode element : root) {
                if (element.isTextual() && !element.textValue().isBlank()) {
                    names.add(element.textValue().strip());
                }
            }
        }
        return names;
    }

    private Map<String, PropertyValue> parseProperties(JsonNode node) {
        Map<String, PropertyValue> properties = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return properties;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            properties.put(field.getKey(), PropertyValues.resolve(field.getValue()));
        }
        return properties;
    }

    private JsonNode findServiceArray(JsonNode root) {
        for (String key : SERVICE_ARRAY_KEYS) {
            if (root.has(key) && root.get(key).isArray()) {
                return root.get(key);
            }
        }
        if (root.isArray()) {
            return root;
        }
        return objectMapper.createArrayNode();
    }

    private static JsonNode first(JsonNode node, String... keys) {
        for (String key : keys) {
            if (node.hasNonNull(key)) {
                return node.get(key);
            }
        }
        return null;
    }

    private static String firstText(JsonNode node, String... keys) {
        JsonNode value = first(node, keys);
        return value != null ? value.asText() : null;
    }

    static String stripFences(String text) {
        String trimmed = text == null ? "" : text.strip();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int closing = trimmed.lastIndexOf("```");
            if (firstNewline >= 0 && closing > firstNewline) {
                return trimmed.substring(firstNewline + 1, closing).strip();
            }
        }
        return trimmed.isEmpty() ? "{}" : trimmed;
    }
}
