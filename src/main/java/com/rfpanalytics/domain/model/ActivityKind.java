package com.rfpanalytics.domain.model;

import java.util.List;

/**
 * The four activity feeds the summary is built from.
 *
 * Each feed names the same logical fields differently, so every kind carries
 * its own ordered alias lists. The first alias that holds a value wins.
 */
public enum ActivityKind {

    ANALYSIS(
            List.of("createdAt"),
            List.of("submittedBy", "userEmail"),
            List.of("rfpId", "rfp_id", "rfpID", "itemId", "item_id"),
            true),
    PROPOSAL_REVIEW(
            List.of("createdAt"),
            List.of("reviewedBy"),
            List.of("rfpId", "rfp_id", "rfpID", "itemId", "item_id"),
            true),
    FOIA_ANALYSIS(
            List.of("createdAt"),
            List.of("analyzedBy"),
            List.of("rfpId", "rfp_id", "rfpID", "itemId", "item_id"),
            true),
    CHAT_SESSION(
            List.of("timestamp", "createdAt"),
            List.of("userId"),
            List.of("rfpId", "rfp_id", "analysisRfpId", "itemId", "item_id"),
            false);

    private static final List<String> TITLE_FIELDS = List.of("rfpTitle", "rfp_title", "title");

    private final List<String> timestampFields;
    private final List<String> actorFields;
    private final List<String> entityIdFields;
    private final boolean analysisLike;

    ActivityKind(List<String> timestampFields,
                 List<String> actorFields,
                 List<String> entityIdFields,
                 boolean analysisLike) {
        this.timestampFields = timestampFields;
        this.actorFields = actorFields;
        this.entityIdFields = entityIdFields;
        this.analysisLike = analysisLike;
    }

    public List<String> getTimestampFields() {
        return timestampFields;
    }

    public List<String> getActorFields() {
        return actorFields;
    }

    public List<String> getEntityIdFields() {
        return entityIdFields;
    }

    public List<String> getTitleFields() {
        return TITLE_FIELDS;
    }

    /**
     * Analyses, proposal reviews and FOIA analyses count toward daily volume. Chat does not.
     */
    public boolean isAnalysisLike() {
        return analysisLike;
    }
}
