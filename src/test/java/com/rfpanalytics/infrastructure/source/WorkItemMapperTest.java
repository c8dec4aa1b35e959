package com.rfpanalytics.infrastructure.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rfpanalytics.domain.model.WorkItemSnapshot;
import com.rfpanalytics.domain.time.TimestampParser;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkItemMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final WorkItemMapper mapper = new WorkItemMapper(new TimestampParser(ZoneOffset.UTC));

    @Test
    void testMap_NestedGroupObject() throws Exception {
        // Given
        JsonNode row = objectMapper.readTree("{\"id\":\"101\",\"mondayId\":\"m-1\",\"name\":\"Bridge Repair\","
                + "\"group\":{\"id\":\"new_group6990\",\"title\":\"Not Pursuing\",\"color\":\"done_green\"},"
                + "\"projectStatus\":\"Not Pursuing\",\"createdAt\":\"2024-03-01T10:00:00Z\","
                + "\"rfpType\":\"RFP\",\"rfpTypeColor\":\"#ff0000\"}");

        // When
        List<WorkItemSnapshot> items = mapper.map(List.of(row));

        // Then
        assertEquals(1, items.size());
        WorkItemSnapshot item = items.get(0);
        assertEquals("101", item.getId());
        assertEquals("m-1", item.getExternalId());
        assertEquals("Bridge Repair", item.getTitle());
        assertEquals("new_group6990", item.getGroupId());
        assertEquals("Not Pursuing", item.getGroupTitle());
        assertEquals("done_green", item.getGroupColor());
        assertEquals("Not Pursuing", item.getLifecycleStatusText());
        assertEquals(Instant.parse("2024-03-01T10:00:00Z"), item.getCreatedAt());
        assertEquals("RFP", item.getTypeTag());
        assertEquals("#ff0000", item.getTypeColor());
    }

    @Test
    void testMap_FlatGroupFieldsWin() throws Exception {
        JsonNode row = objectMapper.readTree("{\"id\":\"102\",\"group\":\"Submitted\",\"groupId\":\"g-1\","
                + "\"groupColor\":\"grass_green\",\"createdAt\":\"garbage\"}");

        WorkItemSnapshot item = mapper.map(List.of(row)).get(0);

        assertEquals("Submitted", item.getGroupTitle());
        assertEquals("g-1", item.getGroupId());
        assertEquals("grass_green", item.getGroupColor());
        assertNull(item.getCreatedAt());
        assertEquals("Unknown Item", item.getDisplayTitle());
    }

    @Test
    void testMap_SkipsRowsWithoutId() throws Exception {
        List<JsonNode> rows = new ArrayList<>();
        rows.add(objectMapper.readTree("{\"title\":\"orphan\"}"));
        rows.add(null);

        assertTrue(mapper.map(rows).isEmpty());
    }
}
