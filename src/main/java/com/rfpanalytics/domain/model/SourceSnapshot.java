package com.rfpanalytics.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything the primary fetch fan-out returned, normalized.
 *
 * allTimeAnalyses is null when the unfiltered history could not be fetched.
 */
@Value
@Builder
public class SourceSnapshot {

    List<ActivityRecord> activities;
    List<WorkItemSnapshot> items;
    List<MoveEvent> moveEvents;
    List<ActivityRecord> allTimeAnalyses;
}
