package com.questrail.conformance.rules;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Parses JSON trigger values. In every {@code {"type": "octets", "value": ...}}
 * object the value is replaced with its Base64 encoding; the wrapper stays.
 *
 * <p>The value text is taken as Latin-1 bytes when every character fits in a
 * byte, and as UTF-8 otherwise.</p>
 */
final class OctetsJson
{
    private static final String TYPE = "type";
    private static final String VALUE = "value";
    private static final String OCTETS = "octets";

    private OctetsJson() {
    }

    static Optional<JsonNode> parse(ObjectMapper mapper, String text) {
        try {
            JsonNode root = mapper.readTree(text);
            if (root == null || root.isMissingNode()) {
                return Optional.empty();
            }
            return Optional.of(normalize(root));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    static JsonNode normalize(JsonNode node) {
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            if (isOctets(object)) {
                object.put(VALUE, encode(object.get(VALUE).asText()));
                return object;
            }
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                field.setValue(normalize(field.getValue()));
            }
            return object;
        }
        if (node.isArray()) {
            ArrayNode array = (ArrayNode) node;
            for (int i = 0; i < array.size(); i++) {
                array.set(i, normalize(array.get(i)));
            }
            return array;
        }
        return node;
    }

    private static boolean isOctets(ObjectNode object) {
        JsonNode type = object.get(TYPE);
        JsonNode value = object.get(VALUE);
        return type != null && OCTETS.equals(type.asText()) && value != null && value.isTextual();
    }

    static String encode(String value) {
        boolean latin1 = value.chars().allMatch(c -> c <= 0xFF);
        byte[] bytes = value.getBytes(latin1 ? StandardCharsets.ISO_8859_1 : StandardCharsets.UTF_8);
        return Base64.getEncoder().encodeToString(bytes);
    }
}
