package com.rfpanalytics.domain.service;

import com.rfpanalytics.domain.model.ActivityKind;
import com.rfpanalytics.domain.model.ActivityRecord;
import com.rfpanalytics.domain.model.LifecycleState;
import com.rfpanalytics.domain.model.MoveEvent;
import com.rfpanalytics.domain.model.WorkItemSnapshot;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Shared builders for the domain service tests.
 */
final class Fixtures {

    static final ZoneId ZONE = ZoneOffset.UTC;
    static final String SUBMITTED_GROUP = "new_group10961";
    static final String DECLINED_GROUP = "new_group6990";

    private Fixtures() {
    }

    static LifecycleRules rules() {
        return LifecycleRules.builder()
                .groupIds(LifecycleState.SUBMITTED, List.of(SUBMITTED_GROUP))
                .groupIds(LifecycleState.DECLINED, List.of(DECLINED_GROUP))
                .phrases(LifecycleState.SUBMITTED, List.of("submitted", "submitted rfps"))
                .phrases(LifecycleState.DECLINED, List.of("not pursuing", "not pursuing rfps", "no pursuit"))
                .moveKeywords(LifecycleState.SUBMITTED, List.of("submitted"))
                .moveKeywords(LifecycleState.DECLINED, List.of("not pursuing", "foia"))
                .build();
    }

    static LifecycleClassifier classifier() {
        return new LifecycleClassifier(rules(), new EntityMatcher());
    }

    static WorkItemSnapshot.WorkItemSnapshotBuilder item(String id, String createdAt) {
        return WorkItemSnapshot.builder()
                .id(id)
                .title("RFP " + id)
                .createdAt(createdAt == null ? null : Instant.parse(createdAt));
    }

    static MoveEvent move(String itemId, String groupId, String groupTitle, String at) {
        return MoveEvent.builder()
                .entityId(itemId)
                .destinationGroupId(groupId)
                .destinationGroupTitle(groupTitle)
                .occurredAt(Instant.parse(at))
                .build();
    }

    static ActivityRecord activity(ActivityKind kind, String at, String actor, String... entityIds) {
        return ActivityRecord.builder()
                .kind(kind)
                .occurredAt(at == null ? null : Instant.parse(at))
                .actor(actor)
                .entityIds(List.of(entityIds))
                .build();
    }
}
