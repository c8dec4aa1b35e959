package com.rfpanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Two-level flow graph: node 0 is the aggregate root, every other node is a
 * current board group ordered by descending member count.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlowGraph {

    @Builder.Default
    private List<Node> nodes = new ArrayList<>();

    @Builder.Default
    private List<Link> links = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Node {
        private String name;
        private String color;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Link {
        private int source;
        private int target;
        private int value;
    }
}
