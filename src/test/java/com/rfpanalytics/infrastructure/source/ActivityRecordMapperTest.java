package com.rfpanalytics.infrastructure.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rfpanalytics.domain.model.ActivityKind;
import com.rfpanalytics.domain.model.ActivityRecord;
import com.rfpanalytics.domain.time.TimestampParser;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ActivityRecordMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ActivityRecordMapper mapper = new ActivityRecordMapper(new TimestampParser(ZoneOffset.UTC));

    @Test
    void testMap_AnalysisAliases() throws Exception {
        // Given
        JsonNode row = objectMapper.readTree("{\"createdAt\":\"2024-03-19T10:00:00Z\",\"userEmail\":\"jane@x.com\","
                + "\"rfp_id\":\"101\",\"itemId\":\"m-7\",\"rfpTitle\":\"Bridge Repair\"}");

        // When
        ActivityRecord record = mapper.map(ActivityKind.ANALYSIS, row);

        // Then
        assertEquals(Instant.parse("2024-03-19T10:00:00Z"), record.getOccurredAt());
        assertEquals("jane@x.com", record.getActor());
        assertEquals(List.of("101", "m-7"), record.getEntityIds());
        assertEquals("101", record.getEntityId());
        assertEquals("Bridge Repair", record.getEntityTitle());
    }

    @Test
    void testMap_ChatUsesTimestampAndAnalysisRfpId() throws Exception {
        JsonNode row = objectMapper.readTree("{\"timestamp\":{\"_seconds\":1710842400,\"_nanoseconds\":0},"
                + "\"createdAt\":\"2020-01-01T00:00:00Z\",\"userId\":\"bob\",\"analysisRfpId\":\"55\"}");

        ActivityRecord record = mapper.map(ActivityKind.CHAT_SESSION, row);

        assertEquals(Instant.ofEpochSecond(1710842400L), record.getOccurredAt());
        assertEquals("bob", record.getActor());
        assertEquals("55", record.getEntityId());
    }

    @Test
    void testMap_KeepsRecordsWithUnparsableTimestamps() throws Exception {
        List<JsonNode> rows = List.of(
                objectMapper.readTree("{\"createdAt\":\"yesterday\",\"reviewedBy\":\"amy\"}"),
                objectMapper.readTree("\"not an object\""));

        List<ActivityRecord> records = mapper.map(ActivityKind.PROPOSAL_REVIEW, rows);

        assertEquals(1, records.size());
        assertFalse(records.get(0).hasTimestamp());
        assertNull(records.get(0).getEntityId());
    }
}
