package com.rfpanalytics.infrastructure.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.rfpanalytics.domain.model.WorkItemSnapshot;
import com.rfpanalytics.domain.time.TimestampParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps board item rows to {@link WorkItemSnapshot}s.
 *
 * The group arrives either as a plain title string or as an object with
 * id, title (or name) and color; flat groupId / groupColor fields win.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkItemMapper {

    private final TimestampParser timestampParser;

    public List<WorkItemSnapshot> map(List<JsonNode> rows) {
        List<WorkItemSnapshot> items = new ArrayList<>(rows.size());
        for (JsonNode row : rows) {
            String id = row == null ? null : JsonFields.firstText(row, "id");
            if (id == null) {
                log.debug("Skipping board item without id");
                continue;
            }
            items.add(map(row, id));
        }
        return items;
    }

    private WorkItemSnapshot map(JsonNode row, String id) {
        JsonNode group = row.path("group");
        String groupTitle;
        String nestedGroupId = null;
        String nestedGroupColor = null;
        if (group.isObject()) {
            groupTitle = JsonFields.firstText(group, "title", "name");
            nestedGroupId = JsonFields.firstText(group, "id");
            nestedGroupColor = JsonFields.firstText(group, "color");
        } else {
            groupTitle = JsonFields.text(group.isMissingNode() ? null : group);
        }

        String groupId = JsonFields.firstText(row, "groupId");
        String groupColor = JsonFields.firstText(row, "groupColor");

        return WorkItemSnapshot.builder()
                .id(id)
                .externalId(JsonFields.firstText(row, "externalId", "external_id", "mondayId"))
                .title(JsonFields.firstText(row, "title", "name", "fileName"))
                .groupId(groupId != null ? groupId : nestedGroupId)
                .groupTitle(groupTitle)
                .groupColor(groupColor != null ? groupColor : nestedGroupColor)
                .lifecycleStatusText(JsonFields.firstText(row, "projectStatus", "status"))
                .createdAt(timestampParser.parse(row.get("createdAt")).orElse(null))
                .typeTag(JsonFields.firstText(row, "rfpType", "rfp_type"))
                .typeColor(JsonFields.firstText(row, "rfpTypeColor", "rfp_type_color"))
                .build();
    }
}
