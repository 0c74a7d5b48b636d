package com.kookykangaroo.persistence;

import java.util.List;

/**
 * Flattened form of a Markdown tree: one record per node in pre-order, one per
 * parent/child pair.
 */
public record GraphPlan(List<NodeRecord> nodes, List<EdgeRecord> edges) {

    public GraphPlan {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    /**
     * A node to persist. {@code level} is null for non-heading nodes.
     */
    public record NodeRecord(String id, String type, String content, Integer level, int position) {
    }

    /**
     * A CONTAINS relation from parent to child.
     */
    public record EdgeRecord(String parentId, String childId) {
    }
}
