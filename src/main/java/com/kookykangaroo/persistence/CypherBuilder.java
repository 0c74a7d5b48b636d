package com.kookykangaroo.persistence;

import com.kookykangaroo.markdown.MarkdownNode;
import com.kookykangaroo.markdown.TreeWalker;
import com.kookykangaroo.persistence.GraphPlan.EdgeRecord;
import com.kookykangaroo.persistence.GraphPlan.NodeRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds Cypher statements from Markdown trees.
 *
 * The same plan feeds both the parameterized statements run against Neo4j and the
 * literal script rendered for offline use.
 */
@Slf4j
@Component
public class CypherBuilder {

    static final String NODE_LABEL = "Node";

    static final String WIPE_QUERY = "MATCH (n) DETACH DELETE n";

    static final String NODE_QUERY =
            "CREATE (n:Node {id: $id, type: $type, content: $content, position: $position})";

    static final String HEADING_NODE_QUERY =
            "CREATE (n:Node {id: $id, type: $type, content: $content, position: $position, level: $level})";

    static final String EDGE_QUERY = """
            MATCH (parent:Node {id: $parentId}) \
            MATCH (child:Node {id: $childId}) \
            CREATE (parent)-[:CONTAINS]->(child)""";

    private static final String STATEMENT_DELIMITER = ";";

    // ==================== Public API ====================

    /**
     * Assigns ids to the tree and flattens it into node and edge records.
     */
    public GraphPlan plan(MarkdownNode root) {
        TreeWalker.assignIds(root);

        var nodes = new ArrayList<NodeRecord>();
        var edges = new ArrayList<EdgeRecord>();
        nodes.add(toNodeRecord(root, 0));

        TreeWalker.walk(root, (parent, child, position) -> {
            nodes.add(toNodeRecord(child, position));
            edges.add(new EdgeRecord(parent.getId(), child.getId()));
        });

        log.debug("Planned graph with {} nodes and {} edges", nodes.size(), edges.size());
        return new GraphPlan(nodes, edges);
    }

    /**
     * Builds the parameterized statements that replace the graph: wipe, nodes, then edges.
     */
    public List<CypherStatement> buildStatements(GraphPlan plan) {
        var statements = new ArrayList<CypherStatement>();
        statements.add(CypherStatement.of(WIPE_QUERY));
        plan.nodes().forEach(node -> statements.add(buildNodeStatement(node)));
        plan.edges().forEach(edge -> statements.add(buildEdgeStatement(edge)));
        return statements;
    }

    /**
     * Renders the plan as a standalone Cypher script with literal values.
     */
    public String buildScript(GraphPlan plan) {
        var lines = new ArrayList<String>();

        lines.add("// Clear existing graph");
        lines.add(WIPE_QUERY + STATEMENT_DELIMITER);
        lines.add("");

        lines.add("// Create nodes");
        plan.nodes().forEach(node -> lines.add(buildNodeScript(node)));
        lines.add("");

        lines.add("// Create relationships");
        plan.edges().forEach(edge -> lines.add(buildEdgeScript(edge)));

        return String.join("\n", lines);
    }

    // ==================== Statement Building ====================

    private NodeRecord toNodeRecord(MarkdownNode node, int position) {
        return new NodeRecord(
                node.getId(),
                node.getType().value(),
                node.getContent(),
                node.isHeading() ? node.getLevel() : null,
                position
        );
    }

    private CypherStatement buildNodeStatement(NodeRecord node) {
        if (node.level() == null) {
            return new CypherStatement(NODE_QUERY, Map.of(
                    "id", node.id(),
                    "type", node.type(),
                    "content", node.content(),
                    "position", node.position()
            ));
        }
        return new CypherStatement(HEADING_NODE_QUERY, Map.of(
                "id", node.id(),
                "type", node.type(),
                "content", node.content(),
                "position", node.position(),
                "level", node.level()
        ));
    }

    private CypherStatement buildEdgeStatement(EdgeRecord edge) {
        return new CypherStatement(EDGE_QUERY, Map.of(
                "parentId", edge.parentId(),
                "childId", edge.childId()
        ));
    }

    // ==================== Script Building ====================

    private String buildNodeScript(NodeRecord node) {
        var props = new StringBuilder();
        props.append("id: '%s', ".formatted(escape(node.id())));
        props.append("type: '%s', ".formatted(escape(node.type())));
        props.append("content: '%s', ".formatted(escape(node.content())));
        props.append("position: %d".formatted(node.position()));
        if (node.level() != null) {
            props.append(", level: %d".formatted(node.level()));
        }
        return "CREATE (%s:%s {%s})%s".formatted(node.id(), NODE_LABEL, props, STATEMENT_DELIMITER);
    }

    private String buildEdgeScript(EdgeRecord edge) {
        return """
                MATCH (parent:Node {id: '%s'})
                MATCH (child:Node {id: '%s'})
                CREATE (parent)-[:CONTAINS]->(child)%s"""
                .formatted(escape(edge.parentId()), escape(edge.childId()), STATEMENT_DELIMITER);
    }

    // ==================== Utility Methods ====================

    /**
     * Escapes a value for use inside a single-quoted Cypher string literal.
     */
    static String escape(String value) {
        if (value == null) {
            return "";
        }
        var sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\'' -> sb.append("\\'");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
