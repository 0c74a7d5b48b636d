package com.kookykangaroo.persistence;

import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Value;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.types.Node;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Default implementation of Neo4jReader.
 *
 * Children are ordered by their {@code position} property, then by id, which keeps
 * sibling headings and paragraphs in the order they appeared in the document.
 */
@Slf4j
@Component
public class DefaultNeo4jReader implements Neo4jReader {

    static final String ROOT_QUERY = """
            MATCH (n:Node {type: 'root'}) \
            RETURN n \
            ORDER BY n.id""";

    static final String CHILDREN_QUERY = """
            MATCH (parent:Node {id: $nodeId})-[:CONTAINS]->(child:Node) \
            RETURN child \
            ORDER BY child.position, child.id""";

    @Override
    public List<StoredNode> findRootNodes(Neo4jConnection connection) {
        return query(connection, ROOT_QUERY, Map.of(), "n");
    }

    @Override
    public List<StoredNode> findChildren(Neo4jConnection connection, String nodeId) {
        return query(connection, CHILDREN_QUERY, Map.of("nodeId", nodeId), "child");
    }

    // ==================== Private Methods ====================

    private List<StoredNode> query(Neo4jConnection connection, String cypher,
                                   Map<String, Object> parameters, String column) {
        log.debug("Executing query: {}", cypher);
        try (var session = connection.openSession()) {
            return session.run(cypher, parameters)
                    .list(row -> toStoredNode(row.get(column).asNode()));
        } catch (Neo4jException e) {
            throw Neo4jFailures.translate("Failed to read graph", e);
        }
    }

    private StoredNode toStoredNode(Node node) {
        return new StoredNode(
                stringOrDefault(node.get("id"), ""),
                stringOrDefault(node.get("type"), ""),
                stringOrDefault(node.get("content"), ""),
                intOrNull(node.get("level"))
        );
    }

    private String stringOrDefault(Value value, String fallback) {
        return value == null || value.isNull() ? fallback : value.asString();
    }

    private Integer intOrNull(Value value) {
        return value == null || value.isNull() ? null : value.asInt();
    }
}
