package com.rfpanalytics.domain.service;

import com.rfpanalytics.domain.model.FlowGraph;
import com.rfpanalytics.domain.model.WorkItemSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Current-state flow graph: one link from the root node to every live board
 * group, weighted by the number of items sitting in it.
 *
 * Reflects the snapshot only; move history is not consulted.
 */
@Slf4j
public class FlowGraphBuilder {

    static final String UNKNOWN_GROUP = "Unknown";

    private final ColorPalette palette;
    private final String rootLabel;
    private final String defaultColor;

    public FlowGraphBuilder(ColorPalette palette, String rootLabel, String defaultColor) {
        this.palette = palette;
        this.rootLabel = rootLabel;
        this.defaultColor = defaultColor;
    }

    public FlowGraph build(List<WorkItemSnapshot> items) {
        Map<String, GroupTally> groups = new LinkedHashMap<>();
        for (WorkItemSnapshot item : items) {
            GroupTally tally = groups.computeIfAbsent(groupName(item), name -> new GroupTally());
            tally.count++;
            if (tally.color == null) {
                tally.color = palette.resolve(item.getGroupColor()).orElse(null);
            }
        }

        // Stable sort keeps first-seen order among equal counts
        List<Map.Entry<String, GroupTally>> sorted = new ArrayList<>(groups.entrySet());
        sorted.sort(Comparator.comparingInt((Map.Entry<String, GroupTally> entry) -> entry.getValue().count).reversed());

        List<FlowGraph.Node> nodes = new ArrayList<>(sorted.size() + 1);
        List<FlowGraph.Link> links = new ArrayList<>(sorted.size());
        nodes.add(new FlowGraph.Node(rootLabel, null));

        for (Map.Entry<String, GroupTally> entry : sorted) {
            int target = nodes.size();
            GroupTally tally = entry.getValue();
            nodes.add(new FlowGraph.Node(entry.getKey(), tally.color != null ? tally.color : defaultColor));
            links.add(new FlowGraph.Link(0, target, tally.count));
        }

        log.debug("Flow graph built: {} items across {} groups", items.size(), sorted.size());
        return FlowGraph.builder()
                .nodes(nodes)
                .links(links)
                .build();
    }

    private static String groupName(WorkItemSnapshot item) {
        if (item.getGroupTitle() != null && !item.getGroupTitle().isBlank()) {
            return item.getGroupTitle().trim();
        }
        if (item.getLifecycleStatusText() != null && !item.getLifecycleStatusText().isBlank()) {
            return item.getLifecycleStatusText().trim();
        }
        return UNKNOWN_GROUP;
    }

    private static final class GroupTally {
        private int count;
        private String color;
    }
}
