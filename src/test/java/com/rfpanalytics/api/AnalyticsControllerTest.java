package com.rfpanalytics.api;

import com.rfpanalytics.config.AnalyticsProperties;
import com.rfpanalytics.domain.model.SummaryResult;
import com.rfpanalytics.domain.service.SummaryComputationException;
import com.rfpanalytics.domain.service.SummaryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AnalyticsControllerTest {

    @Mock
    private SummaryService summaryService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new AnalyticsController(summaryService, new AnalyticsProperties()))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void testGetSummary_UsesConfiguredDefaults() throws Exception {
        when(summaryService.getSummary(30, 500, false))
                .thenReturn(SummaryResult.builder().totalAnalyses(42).build());

        mockMvc.perform(get("/api/v1/analytics/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalAnalyses").value(42))
                .andExpect(jsonPath("$.weekOverWeekChange").doesNotExist());
    }

    @Test
    void testGetSummary_PassesRefresh() throws Exception {
        when(summaryService.getSummary(7, 100, true))
                .thenReturn(SummaryResult.builder().totalAnalyses(1).build());

        mockMvc.perform(get("/api/v1/analytics/summary")
                        .param("days", "7")
                        .param("limit", "100")
                        .param("refresh", "true"))
                .andExpect(status().isOk());

        verify(summaryService).getSummary(7, 100, true);
    }

    @Test
    void testGetSummary_ComputationFailureIsBadGateway() throws Exception {
        when(summaryService.getSummary(30, 500, false))
                .thenThrow(new SummaryComputationException("Failed to fetch analytics sources",
                        new IllegalStateException("board down")));

        mockMvc.perform(get("/api/v1/analytics/summary"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("Summary Unavailable"));
    }

    @Test
    void testGetSummary_InvalidWindowIsBadRequest() throws Exception {
        when(summaryService.getSummary(0, 500, false))
                .thenThrow(new IllegalArgumentException("windowDays must be at least 1, was 0"));

        mockMvc.perform(get("/api/v1/analytics/summary").param("days", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));
    }

    @Test
    void testGetSummary_NonNumericWindowIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/analytics/summary").param("days", "abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.error").value("Invalid Parameter"));

        verifyNoInteractions(summaryService);
    }

    @Test
    void testClearCache() throws Exception {
        mockMvc.perform(delete("/api/v1/analytics/summary/cache"))
                .andExpect(status().isNoContent());

        verify(summaryService).clearCache();
    }
}
