package com.kookykangaroo.persistence;

import java.util.List;

/**
 * Read access to a persisted document graph.
 */
public interface Neo4jReader {

    /**
     * Finds the nodes of type {@code root}, ordered by id. A well-formed store holds exactly one.
     */
    List<StoredNode> findRootNodes(Neo4jConnection connection);

    /**
     * Finds the direct children of a node in document order.
     */
    List<StoredNode> findChildren(Neo4jConnection connection, String nodeId);
}
