package com.rfpanalytics.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Current state of one board item as seen at read time.
 */
@Value
@Builder
public class WorkItemSnapshot {

    String id;
    String externalId;
    String title;
    String groupId;
    String groupTitle;
    String groupColor;
    String lifecycleStatusText;
    Instant createdAt;
    String typeTag;
    String typeColor;

    public String getDisplayTitle() {
        return title != null && !title.isBlank() ? title : "Unknown Item";
    }
}
