package com.rfpanalytics.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rfpanalytics.config.AnalyticsProperties;
import com.rfpanalytics.domain.model.ActivityKind;
import com.rfpanalytics.domain.model.SummaryResult;
import com.rfpanalytics.domain.time.TimestampParser;
import com.rfpanalytics.infrastructure.source.ActivityFeedClient;
import com.rfpanalytics.infrastructure.source.ActivityRecordMapper;
import com.rfpanalytics.infrastructure.source.BoardClient;
import com.rfpanalytics.infrastructure.source.FeedQuery;
import com.rfpanalytics.infrastructure.source.MoveEventMapper;
import com.rfpanalytics.infrastructure.source.SourceFetchException;
import com.rfpanalytics.infrastructure.source.WorkItemMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.rfpanalytics.domain.service.Fixtures.ZONE;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SummaryOrchestratorTest {

    private static final Instant NOW = Instant.parse("2024-03-20T12:00:00Z");

    @Mock
    private ActivityFeedClient activityFeedClient;

    @Mock
    private BoardClient boardClient;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private SummaryOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        AnalyticsProperties properties = new AnalyticsProperties();
        TimestampParser timestampParser = new TimestampParser(ZONE);
        EntityMatcher matcher = new EntityMatcher();
        LifecycleClassifier classifier = Fixtures.classifier();

        orchestrator = new SummaryOrchestrator(
                activityFeedClient,
                boardClient,
                new ActivityRecordMapper(timestampParser),
                new WorkItemMapper(timestampParser),
                new MoveEventMapper(objectMapper, timestampParser),
                classifier,
                matcher,
                new VolumeSeriesBuilder(ZONE),
                new BreakdownSeriesBuilder(classifier, matcher, ZONE),
                new FlowGraphBuilder(new ColorPalette(Map.of("done-green", "#00c875")), "Total RFPs", "#c4c4c4"),
                new RankingBuilder(ZONE, 8, 10, 3),
                timestampParser,
                Runnable::run,
                Clock.fixed(NOW, ZONE),
                ZONE,
                properties);
    }

    @Test
    void testCompute_BuildsFullSummary() throws Exception {
        // Given
        stubWindow(ActivityKind.ANALYSIS,
                "{\"createdAt\":\"2024-03-19T10:00:00Z\",\"submittedBy\":\"jane.doe@x.com\",\"rfpId\":\"101\"}",
                "{\"createdAt\":\"2024-03-20T09:00:00Z\",\"submittedBy\":\"jane.doe@x.com\",\"rfpId\":\"101\"}",
                "{\"createdAt\":\"2024-03-20T10:00:00Z\",\"userEmail\":\"jane_doe\",\"rfp_id\":\"101\"}");
        stubWindow(ActivityKind.PROPOSAL_REVIEW,
                "{\"createdAt\":\"2024-03-18T10:00:00Z\",\"reviewedBy\":\"jane.doe@x.com\",\"rfpId\":\"101\"}");
        stubWindow(ActivityKind.CHAT_SESSION,
                "{\"timestamp\":\"2024-03-20T08:00:00Z\",\"userId\":\"bob\",\"analysisRfpId\":\"202\"}");
        when(activityFeedClient.fetch(eq(ActivityKind.ANALYSIS), eq(FeedQuery.unbounded()))).thenReturn(rows(
                "{\"createdAt\":\"2024-03-10T10:00:00Z\"}",
                "{\"createdAt\":\"2024-03-12T10:00:00Z\"}"));
        when(boardClient.fetchItems()).thenReturn(rows(
                "{\"id\":\"101\",\"title\":\"Bridge Repair\",\"groupId\":\"new_group10961\",\"group\":\"Submitted\","
                        + "\"groupColor\":\"done_green\",\"createdAt\":\"2024-03-18T09:00:00Z\"}",
                "{\"id\":\"202\",\"title\":\"Road Work\",\"group\":\"Active\",\"createdAt\":\"2024-03-19T09:00:00Z\"}"));
        when(boardClient.fetchItemUpdates("101")).thenReturn(rows(
                "{\"createdAt\":\"2024-03-19T15:00:00Z\"}",
                "{\"createdAt\":\"2023-01-01T15:00:00Z\"}"));
        when(boardClient.fetchItemUpdates("202")).thenThrow(new SourceFetchException("board down"));

        // When
        SummaryResult result = orchestrator.compute(30, 500);

        // Then
        assertEquals(4, result.getTotalAnalyses());
        assertEquals(30, result.getVolumeSeries().size());
        assertEquals(0.2, result.getAveragePerDay());
        assertEquals(2, result.getUniqueAnalysts());
        assertEquals("Jane Doe", result.getTopAnalysts().get(0).getAnalyst());
        assertEquals(4, result.getTopAnalysts().get(0).getCount());
        assertEquals("2024-03-20", result.getBusiestDay().getDate());
        assertEquals(Instant.parse("2024-02-20T00:00:00Z"), result.getDateRange().getStartDate());

        assertEquals("101", result.getMostActiveItem().getItemId());
        assertEquals("Bridge Repair", result.getMostActiveItem().getItemTitle());
        assertEquals(5, result.getMostActiveItem().getTotalActivity());
        assertEquals(1, result.getMostActiveItem().getCounts().getUpdates());
        assertEquals(2, result.getMostActiveItems().size());
        assertEquals("Road Work", result.getMostActiveItems().get(1).getItemTitle());
        assertEquals(1, result.getMostActiveItems().get(1).getTotalActivity());

        assertEquals(List.of("7days", "3months", "12months", "allTime"),
                new ArrayList<>(result.getGroupedBreakdowns().keySet()));
        assertEquals(3, result.getFlowGraph().getNodes().size());
        assertEquals(NOW, result.getComputedAt());

        verify(boardClient).fetchActivityLogs(Instant.parse("2023-03-21T00:00:00Z"), 50000);
        verify(activityFeedClient).fetch(ActivityKind.FOIA_ANALYSIS, FeedQuery.builder()
                .startDate(Instant.parse("2024-02-20T00:00:00Z"))
                .endDate(Instant.parse("2024-03-20T23:59:59.999Z"))
                .limit(500)
                .build());
        verify(boardClient, never()).fetchItemTitle(anyString());
    }

    @Test
    void testCompute_PrimaryFailureAborts() {
        // Given
        when(boardClient.fetchItems()).thenThrow(new SourceFetchException("board down"));

        // When
        SummaryComputationException thrown =
                assertThrows(SummaryComputationException.class, () -> orchestrator.compute(30, 500));

        // Then: the original failure travels with the exception for the API layer to log
        assertInstanceOf(SourceFetchException.class, thrown.getCause());
        assertEquals("board down", thrown.getCause().getMessage());
    }

    @Test
    void testCompute_AuditLogFailureAborts() {
        when(boardClient.fetchActivityLogs(any(), anyInt())).thenThrow(new SourceFetchException("logs down"));

        assertThrows(SummaryComputationException.class, () -> orchestrator.compute(30, 500));
    }

    @Test
    void testCompute_HistoryFailureFallsBackToWindowAverage() throws Exception {
        // Given
        List<String> analyses = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            analyses.add("{\"createdAt\":\"2024-03-1" + i + "T10:00:00Z\",\"submittedBy\":\"amy\"}");
        }
        stubWindow(ActivityKind.ANALYSIS, analyses.toArray(new String[0]));
        when(activityFeedClient.fetch(eq(ActivityKind.FOIA_ANALYSIS), eq(FeedQuery.unbounded())))
                .thenThrow(new SourceFetchException("history down"));

        // When
        SummaryResult result = orchestrator.compute(30, 500);

        // Then
        assertEquals(6, result.getTotalAnalyses());
        assertEquals(0.2, result.getAveragePerDay());
        assertNull(result.getMostActiveItem());
        assertTrue(result.getMostActiveItems().isEmpty());
    }

    @Test
    void testCompute_LooksUpTitlesMissingFromBoard() throws Exception {
        stubWindow(ActivityKind.FOIA_ANALYSIS,
                "{\"createdAt\":\"2024-03-19T10:00:00Z\",\"analyzedBy\":\"amy\",\"itemId\":\"999\"}");
        when(boardClient.fetchItemTitle("999")).thenReturn(Optional.of("Archived RFP"));

        SummaryResult result = orchestrator.compute(7, 100);

        assertEquals("Archived RFP", result.getMostActiveItem().getItemTitle());
        assertEquals(1, result.getMostActiveItem().getCounts().getFoiaAnalyses());
        assertEquals(7, result.getVolumeSeries().size());
    }

    private void stubWindow(ActivityKind kind, String... json) throws Exception {
        when(activityFeedClient.fetch(eq(kind), argThat(query -> query != null && query.getLimit() != null)))
                .thenReturn(rows(json));
    }

    private List<JsonNode> rows(String... json) throws Exception {
        List<JsonNode> rows = new ArrayList<>();
        for (String row : json) {
            rows.add(objectMapper.readTree(row));
        }
        return rows;
    }
}
