package com.kookykangaroo.traversal;

import com.kookykangaroo.config.MetricsConfig.GraphMetrics;
import com.kookykangaroo.persistence.Neo4jConnection;
import com.kookykangaroo.persistence.Neo4jReader;
import com.kookykangaroo.persistence.StoredNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GraphTraversalTest {

    @Mock
    private Neo4jReader reader;

    @Mock
    private Neo4jConnection connection;

    private GraphTraversal traversal;

    @BeforeEach
    void setUp() {
        traversal = new GraphTraversal(reader, new GraphMetrics(new SimpleMeterRegistry()));
    }

    @Test
    @DisplayName("Should render headings and paragraphs depth-first")
    void traverseAndPrint() {
        when(reader.findRootNodes(connection)).thenReturn(List.of(root()));
        when(reader.findChildren(connection, "node_0"))
                .thenReturn(List.of(new StoredNode("node_1", "heading", "Header 1", 1)));
        when(reader.findChildren(connection, "node_1")).thenReturn(List.of(
                new StoredNode("node_2", "paragraph", "Paragraph 1", null),
                new StoredNode("node_3", "heading", "Header 2", 2)));
        when(reader.findChildren(connection, "node_2")).thenReturn(List.of());
        when(reader.findChildren(connection, "node_3")).thenReturn(List.of());

        var markdown = traversal.traverse(connection);

        assertThat(markdown).contains("# Header 1\n\nParagraph 1\n\n## Header 2\n\n");
    }

    @Test
    void descendsIntoChildBeforeNextSibling() {
        when(reader.findRootNodes(connection)).thenReturn(List.of(root()));
        when(reader.findChildren(connection, "node_0")).thenReturn(List.of(
                new StoredNode("node_1", "heading", "A", 1),
                new StoredNode("node_3", "heading", "C", 1)));
        when(reader.findChildren(connection, "node_1"))
                .thenReturn(List.of(new StoredNode("node_2", "paragraph", "under A", null)));
        when(reader.findChildren(connection, "node_2")).thenReturn(List.of());
        when(reader.findChildren(connection, "node_3")).thenReturn(List.of());

        assertThat(traversal.traverse(connection)).contains("# A\n\nunder A\n\n# C\n\n");
    }

    @Test
    void unknownTypesRenderNothingButTheirChildrenDo() {
        when(reader.findRootNodes(connection)).thenReturn(List.of(root()));
        when(reader.findChildren(connection, "node_0"))
                .thenReturn(List.of(new StoredNode("node_1", "table", "ignored", null)));
        when(reader.findChildren(connection, "node_1"))
                .thenReturn(List.of(new StoredNode("node_2", "paragraph", "kept", null)));
        when(reader.findChildren(connection, "node_2")).thenReturn(List.of());

        assertThat(traversal.traverse(connection)).contains("kept\n\n");
    }

    @Test
    void headingWithoutLevelRendersAsLevelOne() {
        when(reader.findRootNodes(connection)).thenReturn(List.of(root()));
        when(reader.findChildren(connection, "node_0"))
                .thenReturn(List.of(new StoredNode("node_1", "heading", "Untitled", null)));
        when(reader.findChildren(connection, "node_1")).thenReturn(List.of());

        assertThat(traversal.traverse(connection)).contains("# Untitled\n\n");
    }

    @Test
    void emptyGraphRendersEmptyText() {
        when(reader.findRootNodes(connection)).thenReturn(List.of(root()));
        when(reader.findChildren(connection, "node_0")).thenReturn(List.of());

        assertThat(traversal.traverse(connection)).contains("");
    }

    @Test
    void missingRootYieldsEmptyResult() {
        when(reader.findRootNodes(connection)).thenReturn(List.of());

        assertThat(traversal.traverse(connection)).isEmpty();
        verify(reader, never()).findChildren(any(), anyString());
    }

    @Test
    void cyclesAreVisitedOnce() {
        when(reader.findRootNodes(connection)).thenReturn(List.of(root()));
        when(reader.findChildren(connection, "node_0"))
                .thenReturn(List.of(new StoredNode("node_1", "paragraph", "loop", null)));
        when(reader.findChildren(connection, "node_1")).thenReturn(List.of(root()));

        assertThat(traversal.traverse(connection)).contains("loop\n\n");
    }

    private StoredNode root() {
        return new StoredNode("node_0", "root", "", null);
    }
}
