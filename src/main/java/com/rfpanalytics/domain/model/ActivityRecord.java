package com.rfpanalytics.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * One normalized activity from any of the four feeds.
 *
 * occurredAt is null when the source timestamp could not be parsed; such
 * records never land in a period bucket.
 */
@Value
@Builder
public class ActivityRecord {

    ActivityKind kind;
    Instant occurredAt;
    String actor;

    // Every alias value present on the source row, in alias priority order
    @Singular
    List<String> entityIds;

    String entityTitle;

    public String getEntityId() {
        return entityIds.isEmpty() ? null : entityIds.get(0);
    }

    public boolean hasTimestamp() {
        return occurredAt != null;
    }
}
