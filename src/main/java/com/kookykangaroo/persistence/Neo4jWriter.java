package com.kookykangaroo.persistence;

import com.kookykangaroo.markdown.MarkdownNode;

/**
 * Writes Markdown trees as graphs.
 *
 * Provides both direct replacement in Neo4j and Cypher script generation.
 */
public interface Neo4jWriter {

    /**
     * Replaces the whole content of the store with the graph of the given tree.
     *
     * @param connection open connection to write through
     * @param root the tree to persist; ids are assigned as a side effect
     * @return counts and duration of the write
     * @throws GraphOperationException if any statement fails; the store is left unchanged
     */
    WriteResult replaceGraph(Neo4jConnection connection, MarkdownNode root);

    /**
     * Renders the statements {@link #replaceGraph} would run as a Cypher script.
     *
     * @param root the tree to render; ids are assigned as a side effect
     * @return the script text
     */
    String generateScript(MarkdownNode root);

    /**
     * Result of a graph write.
     */
    record WriteResult(int nodesWritten, int edgesWritten, long durationMs) {
    }
}
