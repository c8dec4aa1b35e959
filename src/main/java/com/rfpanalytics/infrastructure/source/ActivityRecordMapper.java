package com.rfpanalytics.infrastructure.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.rfpanalytics.domain.model.ActivityKind;
import com.rfpanalytics.domain.model.ActivityRecord;
import com.rfpanalytics.domain.time.TimestampParser;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns rows from the four activity feeds into {@link ActivityRecord}s using
 * the alias lists declared on {@link ActivityKind}.
 */
@Component
@RequiredArgsConstructor
public class ActivityRecordMapper {

    private final TimestampParser timestampParser;

    public List<ActivityRecord> map(ActivityKind kind, List<JsonNode> rows) {
        List<ActivityRecord> records = new ArrayList<>(rows.size());
        for (JsonNode row : rows) {
            if (row != null && row.isObject()) {
                records.add(map(kind, row));
            }
        }
        return records;
    }

    public ActivityRecord map(ActivityKind kind, JsonNode row) {
        JsonNode rawTimestamp = JsonFields.firstPresent(row, kind.getTimestampFields());
        return ActivityRecord.builder()
                .kind(kind)
                .occurredAt(timestampParser.parse(rawTimestamp).orElse(null))
                .actor(JsonFields.firstText(row, kind.getActorFields()))
                .entityIds(JsonFields.allTexts(row, kind.getEntityIdFields()))
                .entityTitle(JsonFields.firstText(row, kind.getTitleFields()))
                .build();
    }
}
