package com.rfpanalytics.api;

import com.rfpanalytics.config.AnalyticsProperties;
import com.rfpanalytics.domain.model.SummaryResult;
import com.rfpanalytics.domain.service.SummaryService;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for the analytics summary.
 *
 * Endpoints:
 * - GET    /api/v1/analytics/summary        - Cached or freshly computed summary
 * - DELETE /api/v1/analytics/summary/cache  - Drop the cached summary
 * - GET    /api/v1/analytics/health         - Liveness
 */
@Slf4j
@RestController
@Validated
@RequestMapping("/api/v1/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private final SummaryService summaryService;
    private final AnalyticsProperties properties;

    /**
     * GET /api/v1/analytics/summary?days=30&limit=500&refresh=false
     *
     * Query Parameters:
     * - days (optional): Size of the daily volume window (default: 30)
     * - limit (optional): Max rows requested per activity feed (default: 500)
     * - refresh (optional): Bypass the cache and recompute (default: false)
     */
    @GetMapping("/summary")
    public ResponseEntity<SummaryResult> getSummary(
            @RequestParam(required = false) @Min(1) Integer days,
            @RequestParam(required = false) @Min(1) Integer limit,
            @RequestParam(defaultValue = "false") boolean refresh) {

        int windowDays = days != null ? days : properties.getDefaultWindowDays();
        int itemLimit = limit != null ? limit : properties.getDefaultItemLimit();

        log.info("Get summary: days={}, limit={}, refresh={}", windowDays, itemLimit, refresh);

        return ResponseEntity.ok(summaryService.getSummary(windowDays, itemLimit, refresh));
    }

    @DeleteMapping("/summary/cache")
    public ResponseEntity<Void> clearCache() {
        log.info("Clear summary cache");

        summaryService.clearCache();

        return ResponseEntity.noContent().build();
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
