package com.rfpanalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * RFP Analytics Summary Backend
 *
 * Read-side reducer that joins the activity feeds with the project board and
 * serves one cached analytics summary to the dashboard.
 *
 * Architecture:
 * - REST API for the summary and cache invalidation
 * - Concurrent fan-out over the upstream feeds
 * - Pure builders for volume, breakdown, flow and ranking views
 * - Redis caching of the computed summary (24h TTL)
 */
@SpringBootApplication
public class RfpAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(RfpAnalyticsApplication.class, args);
    }
}
