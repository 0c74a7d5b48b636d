package com.kookykangaroo.traversal;

import com.kookykangaroo.config.MetricsConfig.GraphMetrics;
import com.kookykangaroo.markdown.NodeType;
import com.kookykangaroo.persistence.Neo4jConnection;
import com.kookykangaroo.persistence.Neo4jReader;
import com.kookykangaroo.persistence.StoredNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Traverses a persisted document graph and renders it back into Markdown.
 *
 * <p>Depth-first, pre-order, starting below the root node. Each heading renders as
 * {@code level} hashes, a space and its content; each paragraph as its content. Both
 * are followed by a blank line. Other node types render nothing but are still descended
 * into.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphTraversal {

    private static final int DEFAULT_HEADING_LEVEL = 1;

    private final Neo4jReader reader;
    private final GraphMetrics graphMetrics;

    /**
     * Renders the stored graph.
     *
     * @return the Markdown text, or empty when the store has no root node
     */
    public Optional<String> traverse(Neo4jConnection connection) {
        log.info("Traversing graph");

        var roots = reader.findRootNodes(connection);
        if (roots.isEmpty()) {
            log.error("Root node not found in graph");
            return Optional.empty();
        }
        if (roots.size() > 1) {
            log.warn("Found {} root nodes, using {}", roots.size(), roots.get(0).id());
        }

        Supplier<String> rendering = () -> render(connection, roots.get(0));
        return Optional.of(graphMetrics.getTraverseTimer().record(rendering));
    }

    // ==================== Traversal ====================

    private String render(Neo4jConnection connection, StoredNode root) {
        var markdown = new StringBuilder();
        Set<String> visited = new HashSet<>();
        Deque<StoredNode> stack = new ArrayDeque<>();
        stack.push(root);

        while (!stack.isEmpty()) {
            var node = stack.pop();
            if (!visited.add(node.id())) {
                log.warn("Node {} reached more than once, skipping", node.id());
                continue;
            }
            if (node != root) {
                appendNode(node, markdown);
            }

            var children = reader.findChildren(connection, node.id());
            log.trace("Node {} has {} children", node.id(), children.size());
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }

        return markdown.toString();
    }

    // ==================== Rendering ====================

    private void appendNode(StoredNode node, StringBuilder markdown) {
        var type = node.nodeType().orElse(null);
        if (type == NodeType.HEADING) {
            int level = node.level() != null ? node.level() : DEFAULT_HEADING_LEVEL;
            appendLine(markdown, "#".repeat(level) + " " + node.content());
            appendLine(markdown, "");
        } else if (type == NodeType.PARAGRAPH) {
            appendLine(markdown, node.content());
            appendLine(markdown, "");
        }
    }

    private void appendLine(StringBuilder markdown, String line) {
        markdown.append(line).append('\n');
    }
}
