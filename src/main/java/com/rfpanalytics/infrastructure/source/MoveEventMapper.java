package com.rfpanalytics.infrastructure.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rfpanalytics.domain.model.MoveEvent;
import com.rfpanalytics.domain.time.TimestampParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Extracts "moved into group" events from the board audit log.
 *
 * Row shape: { "event": "move_pulse_into_group", "created_at": "<100ns ticks>",
 * "data": "{\"pulse\":{\"id\":..},\"dest_group\":{\"id\":..,\"title\":..}}" }.
 * The data payload may also arrive already parsed. Rows that cannot be read
 * are skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MoveEventMapper {

    static final String MOVE_EVENT = "move_pulse_into_group";

    private final ObjectMapper objectMapper;
    private final TimestampParser timestampParser;

    public List<MoveEvent> map(List<JsonNode> logs) {
        List<MoveEvent> moves = new ArrayList<>();
        int skipped = 0;
        for (JsonNode row : logs) {
            if (row == null || !MOVE_EVENT.equals(row.path("event").asText())) {
                continue;
            }
            Optional<MoveEvent> move = map(row);
            if (move.isPresent()) {
                moves.add(move.get());
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.debug("Skipped {} unreadable move events", skipped);
        }
        return moves;
    }

    private Optional<MoveEvent> map(JsonNode row) {
        Optional<JsonNode> data = payload(row.get("data"));
        if (data.isEmpty()) {
            return Optional.empty();
        }
        JsonNode payload = data.get();
        String entityId = JsonFields.text(payload.path("pulse").get("id"));
        if (entityId == null) {
            entityId = JsonFields.firstText(payload, "pulse_id");
        }
        Optional<Instant> occurredAt = timestampParser.parseEpochTicks(JsonFields.text(row.get("created_at")));
        if (entityId == null || occurredAt.isEmpty()) {
            return Optional.empty();
        }
        JsonNode destination = payload.path("dest_group");
        return Optional.of(MoveEvent.builder()
                .entityId(entityId)
                .destinationGroupId(JsonFields.text(destination.get("id")))
                .destinationGroupTitle(JsonFields.text(destination.get("title")))
                .occurredAt(occurredAt.get())
                .build());
    }

    private Optional<JsonNode> payload(JsonNode data) {
        if (data == null || data.isNull()) {
            return Optional.empty();
        }
        if (data.isObject()) {
            return Optional.of(data);
        }
        if (!data.isTextual()) {
            return Optional.empty();
        }
        try {
            JsonNode parsed = objectMapper.readTree(data.asText());
            return parsed != null && parsed.isObject() ? Optional.of(parsed) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.debug("Unreadable move event payload: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
