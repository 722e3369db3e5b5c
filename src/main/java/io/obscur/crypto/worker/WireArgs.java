package io.obscur.crypto.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.obscur.error.ValidationException;
import io.obscur.util.Jsons;

import java.util.Base64;

final class WireArgs {
    private WireArgs() {
    }

    static ObjectNode object() {
        return Jsons.compact().createObjectNode();
    }

    static String base64(byte[] value) {
        return value == null ? null : Base64.getEncoder().encodeToString(value);
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    static byte[] bytes(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null) {
            return null;
        }
        try {
            return Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Field " + field + " is not valid base64", e);
        }
    }

    static <T> T value(JsonNode node, String field, Class<T> type) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        try {
            return Jsons.compact().treeToValue(value, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ValidationException("Field " + field + " is not a valid " + type.getSimpleName(), e);
        }
    }
}
