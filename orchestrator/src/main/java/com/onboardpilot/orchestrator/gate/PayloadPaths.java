package com.onboardpilot.orchestrator.gate;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Lookups into a stage output payload.
 */
final class PayloadPaths {

    private PayloadPaths() {}

    /**
     * Resolve a dotted path such as {@code accounts.email.created}.
     * Empty when any segment is absent or the leaf is JSON null.
     */
    static Optional<JsonNode> resolve(JsonNode root, String path) {
        if (root == null || path == null || path.isBlank()) return Optional.empty();
        JsonNode current = root;
        for (String segment : path.split("\\.")) {
            if (current == null || !current.isObject()) return Optional.empty();
            current = current.get(segment);
        }
        if (current == null || current.isNull() || current.isMissingNode()) return Optional.empty();
        return Optional.of(current);
    }

    /**
     * A required field counts as present only when it carries a real value:
     * not empty text, not an empty container, and not {@code false}.
     */
    static boolean hasValue(JsonNode root, String path) {
        return resolve(root, path).map(PayloadPaths::isMeaningful).orElse(false);
    }

    /**
     * Find a numeric metric by name: first at the top level of the payload,
     * then inside each direct child object. The first hit wins.
     */
    static OptionalDouble findMetric(JsonNode root, String name) {
        if (root == null || !root.isObject()) return OptionalDouble.empty();

        OptionalDouble direct = asNumber(root.get(name));
        if (direct.isPresent()) return direct;

        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            JsonNode child = fields.next().getValue();
            if (child.isObject()) {
                OptionalDouble nested = asNumber(child.get(name));
                if (nested.isPresent()) return nested;
            }
        }
        return OptionalDouble.empty();
    }

    static OptionalDouble asNumber(JsonNode node) {
        if (node == null || node.isNull()) return OptionalDouble.empty();
        if (node.isNumber()) return OptionalDouble.of(node.asDouble());
        if (node.isTextual()) {
            try {
                return OptionalDouble.of(Double.parseDouble(node.asText().trim()));
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }

    private static boolean isMeaningful(JsonNode node) {
        if (node.isBoolean())   return node.booleanValue();
        if (node.isTextual())   return !node.asText().isBlank();
        if (node.isContainerNode()) return node.size() > 0;
        return true;
    }
}
