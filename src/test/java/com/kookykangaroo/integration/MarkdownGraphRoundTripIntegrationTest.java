package com.kookykangaroo.integration;

import com.kookykangaroo.cli.CommandLineArguments;
import com.kookykangaroo.cli.GraphCommands;
import com.kookykangaroo.config.ConnectionSettings;
import com.kookykangaroo.markdown.MarkdownTreeBuilder;
import com.kookykangaroo.persistence.Neo4jConnectionFactory;
import com.kookykangaroo.persistence.Neo4jReader;
import com.kookykangaroo.persistence.Neo4jWriter;
import com.kookykangaroo.persistence.StoredNode;
import com.kookykangaroo.traversal.GraphTraversal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.Neo4jContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Round trip against a real Neo4j: Markdown → graph → Markdown.
 *
 * Skipped when Docker is not available.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class MarkdownGraphRoundTripIntegrationTest {

    private static final String PASSWORD = "kangaroo-test";

    @Container
    static Neo4jContainer<?> neo4jContainer = new Neo4jContainer<>("neo4j:5.15.0")
            .withAdminPassword(PASSWORD);

    @Autowired
    private MarkdownTreeBuilder treeBuilder;

    @Autowired
    private Neo4jConnectionFactory connectionFactory;

    @Autowired
    private Neo4jWriter writer;

    @Autowired
    private Neo4jReader reader;

    @Autowired
    private GraphTraversal traversal;

    @Autowired
    private GraphCommands commands;

    @TempDir
    Path tempDir;

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("kangaroo.neo4j.uri", neo4jContainer::getBoltUrl);
        registry.add("kangaroo.neo4j.username", () -> "neo4j");
        registry.add("kangaroo.neo4j.password", () -> PASSWORD);
    }

    private ConnectionSettings settings() {
        return new ConnectionSettings(neo4jContainer.getBoltUrl(), "neo4j", PASSWORD);
    }

    @Test
    @DisplayName("Should reproduce headings and paragraphs in document order")
    void roundTripPreservesDocumentOrder() {
        var markdown = """
                Preamble

                # Header 1
                Some paragraph

                ## Header 2
                Another paragraph

                Second paragraph under header 2
                # Header 3
                Last
                """;

        try (var connection = connectionFactory.open(settings())) {
            var result = writer.replaceGraph(connection, treeBuilder.parse(markdown));
            assertThat(result.nodesWritten()).isEqualTo(9);
            assertThat(result.edgesWritten()).isEqualTo(8);

            var rendered = traversal.traverse(connection);

            assertThat(rendered).contains("""
                    Preamble

                    # Header 1

                    Some paragraph

                    ## Header 2

                    Another paragraph

                    Second paragraph under header 2

                    # Header 3

                    Last

                    """);
        }
    }

    @Test
    void rewritingReplacesThePreviousGraph() {
        try (var connection = connectionFactory.open(settings())) {
            writer.replaceGraph(connection, treeBuilder.parse("# First\n\nOld text\n"));
            writer.replaceGraph(connection, treeBuilder.parse("# Second\n"));

            assertThat(reader.findRootNodes(connection)).hasSize(1);
            assertThat(reader.findChildren(connection, "node_0"))
                    .extracting(StoredNode::content)
                    .containsExactly("Second");
            assertThat(traversal.traverse(connection)).contains("# Second\n\n");
        }
    }

    @Test
    void commandsRoundTripThroughFiles() throws Exception {
        var file = Files.writeString(tempDir.resolve("doc.md"), "# Title\n\nBody text\n");

        int created = commands.createGraph(CommandLineArguments.parse("create-graph", "--file", file.toString()));
        assertThat(created).isEqualTo(GraphCommands.EXIT_SUCCESS);

        var stdout = new ByteArrayOutputStream();
        int traversed = commands.traverseGraph(CommandLineArguments.parse("traverse-graph"),
                new PrintStream(stdout, true, StandardCharsets.UTF_8));

        assertThat(traversed).isEqualTo(GraphCommands.EXIT_SUCCESS);
        assertThat(stdout.toString(StandardCharsets.UTF_8)).isEqualTo("# Title\n\nBody text\n\n");
    }

    @Test
    void wrongPasswordFailsTheCommand() {
        int exitCode = commands.traverseGraph(
                CommandLineArguments.parse("traverse-graph", "--password", "wrong"),
                new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));

        assertThat(exitCode).isEqualTo(GraphCommands.EXIT_FAILURE);
    }
}
