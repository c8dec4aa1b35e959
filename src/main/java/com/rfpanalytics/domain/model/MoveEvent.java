package com.rfpanalytics.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * An audit-log entry recording that an item was moved into a board group.
 */
@Value
@Builder
public class MoveEvent {

    String entityId;
    String destinationGroupId;
    String destinationGroupTitle;
    Instant occurredAt;
}
