package com.rfpanalytics.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings bound from the app.analytics tree of application.yml.
 */
@Data
@ConfigurationProperties(prefix = "app.analytics")
public class AnalyticsProperties {

    /** Zone used to decide which calendar day an instant belongs to. */
    private String zone = "UTC";

    private int defaultWindowDays = 30;
    private int defaultItemLimit = 500;

    private int leaderboardSize = 8;
    private int updateCandidateLimit = 10;
    private int mostActiveSize = 3;

    private int auditLogLookbackDays = 365;
    private int auditLogLimit = 50000;

    private int fetchPoolSize = 12;

    private Cache cache = new Cache();
    private Lifecycle lifecycle = new Lifecycle();
    private Flow flow = new Flow();
    private Sources sources = new Sources();

    @Data
    public static class Cache {
        private String key = "analytics:summary_30day_v2";
        private Duration ttl = Duration.ofHours(24);
    }

    @Data
    public static class Lifecycle {
        private List<String> submittedGroupIds = new ArrayList<>(List.of("new_group10961"));
        private List<String> declinedGroupIds = new ArrayList<>(List.of("new_group6990"));
        private List<String> submittedPhrases = new ArrayList<>(List.of("submitted", "submitted rfps"));
        private List<String> declinedPhrases = new ArrayList<>(List.of("not pursuing", "not pursuing rfps", "no pursuit"));
        private List<String> submittedMoveKeywords = new ArrayList<>(List.of("submitted"));
        private List<String> declinedMoveKeywords = new ArrayList<>(List.of("not pursuing", "foia"));
    }

    @Data
    public static class Flow {
        private String rootLabel = "Total RFPs";
        private String defaultColor = "#c4c4c4";
        private Map<String, String> palette = new LinkedHashMap<>();
    }

    @Data
    public static class Sources {
        private String activityBaseUrl = "http://localhost:8080/api";
        private String boardBaseUrl = "http://localhost:8080/api/monday";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);
    }
}
