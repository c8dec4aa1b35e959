package com.rfpanalytics.domain.service;

import com.rfpanalytics.domain.model.ActivityRecord;
import com.rfpanalytics.domain.model.WorkItemSnapshot;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether an activity belongs to a work item.
 *
 * The feeds store the item reference under different field names, and the
 * board knows an item by its id and optionally an external id, so every
 * activity alias is compared against every item identifier.
 */
@Component
public class EntityMatcher {

    public boolean matches(ActivityRecord activity, WorkItemSnapshot item) {
        if (activity == null || item == null) {
            return false;
        }
        List<String> itemIds = identifiers(item);
        for (String activityId : activity.getEntityIds()) {
            if (itemIds.contains(activityId)) {
                return true;
            }
        }
        return false;
    }

    public boolean matchesId(String entityId, WorkItemSnapshot item) {
        return entityId != null && item != null && identifiers(item).contains(entityId);
    }

    /**
     * Primary id first, then the external id.
     */
    public List<String> identifiers(WorkItemSnapshot item) {
        List<String> ids = new ArrayList<>(2);
        if (item.getId() != null && !item.getId().isBlank()) {
            ids.add(item.getId());
        }
        if (item.getExternalId() != null && !item.getExternalId().isBlank()) {
            ids.add(item.getExternalId());
        }
        return ids;
    }
}
