package com.rfpanalytics.domain.service;

import com.rfpanalytics.domain.model.FlowGraph;
import com.rfpanalytics.domain.model.WorkItemSnapshot;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.rfpanalytics.domain.service.Fixtures.item;
import static org.junit.jupiter.api.Assertions.*;

class FlowGraphBuilderTest {

    private final FlowGraphBuilder builder = new FlowGraphBuilder(
            new ColorPalette(Map.of("done-green", "#00c875", "working_orange", "#fdab3d")),
            "Total RFPs",
            "#c4c4c4");

    @Test
    void testBuild_GroupsSortedByCountUnderRoot() {
        // Given
        List<WorkItemSnapshot> items = List.of(
                item("1", null).groupTitle("Active").groupColor("Working_Orange").build(),
                item("2", null).groupTitle("Submitted").groupColor("done_green").build(),
                item("3", null).groupTitle("Submitted").build(),
                item("4", null).lifecycleStatusText("Not Pursuing").groupColor("#123456").build(),
                item("5", null).groupTitle(" Submitted ").build(),
                item("6", null).build());

        // When
        FlowGraph graph = builder.build(items);

        // Then
        assertEquals("Total RFPs", graph.getNodes().get(0).getName());
        assertNull(graph.getNodes().get(0).getColor());

        assertEquals("Submitted", graph.getNodes().get(1).getName());
        assertEquals("#00c875", graph.getNodes().get(1).getColor());
        assertEquals(3, graph.getLinks().get(0).getValue());
        assertEquals(0, graph.getLinks().get(0).getSource());
        assertEquals(1, graph.getLinks().get(0).getTarget());

        // Ties keep first-seen order
        assertEquals("Active", graph.getNodes().get(2).getName());
        assertEquals("#fdab3d", graph.getNodes().get(2).getColor());
        assertEquals("Not Pursuing", graph.getNodes().get(3).getName());
        assertEquals("#123456", graph.getNodes().get(3).getColor());
        assertEquals("Unknown", graph.getNodes().get(4).getName());
        assertEquals("#c4c4c4", graph.getNodes().get(4).getColor());

        assertEquals(items.size(), graph.getLinks().stream().mapToInt(FlowGraph.Link::getValue).sum());
    }

    @Test
    void testBuild_EmptyBoardHasOnlyRoot() {
        FlowGraph graph = builder.build(List.of());

        assertEquals(1, graph.getNodes().size());
        assertTrue(graph.getLinks().isEmpty());
    }
}
