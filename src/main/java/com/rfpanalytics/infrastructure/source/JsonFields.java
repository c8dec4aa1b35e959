package com.rfpanalytics.infrastructure.source;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Alias-aware reads over raw upstream rows.
 */
final class JsonFields {

    private JsonFields() {
    }

    /**
     * First alias holding a scalar with non-blank text, or null.
     */
    static String firstText(JsonNode row, List<String> aliases) {
        for (String alias : aliases) {
            String value = text(row.get(alias));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    static String firstText(JsonNode row, String... aliases) {
        return firstText(row, List.of(aliases));
    }

    /**
     * Every distinct non-blank scalar value across the aliases, in alias order.
     */
    static List<String> allTexts(JsonNode row, List<String> aliases) {
        List<String> values = new ArrayList<>();
        for (String alias : aliases) {
            String value = text(row.get(alias));
            if (value != null && !values.contains(value)) {
                values.add(value);
            }
        }
        return values;
    }

    /**
     * First alias whose node is present and not empty, for values whose shape varies.
     */
    static JsonNode firstPresent(JsonNode row, List<String> aliases) {
        for (String alias : aliases) {
            JsonNode node = row.get(alias);
            if (node != null && !node.isNull() && !(node.isTextual() && node.asText().isBlank())) {
                return node;
            }
        }
        return null;
    }

    static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value.trim();
    }
}
