package com.rfpanalytics.infrastructure.source;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Upstream responses wrap their rows in a named array ({"analyses": [...]}).
 */
final class Envelopes {

    private Envelopes() {
    }

    static List<JsonNode> rows(JsonNode body, String field) {
        List<JsonNode> rows = new ArrayList<>();
        if (body == null) {
            return rows;
        }
        JsonNode array = body.path(field);
        if (array.isArray()) {
            array.forEach(rows::add);
        }
        return rows;
    }
}
