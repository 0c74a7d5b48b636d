package com.kookykangaroo.cli;

import com.kookykangaroo.cli.Command.Option;
import com.kookykangaroo.config.ConnectionSettings;
import com.kookykangaroo.config.KangarooConfig;
import com.kookykangaroo.markdown.MarkdownNode;
import com.kookykangaroo.markdown.MarkdownTreeBuilder;
import com.kookykangaroo.persistence.GraphOperationException;
import com.kookykangaroo.persistence.GraphOperationException.FailureKind;
import com.kookykangaroo.persistence.Neo4jConnectionFactory;
import com.kookykangaroo.persistence.Neo4jWriter;
import com.kookykangaroo.traversal.GraphTraversal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * The commands behind the command line.
 *
 * <p>Each command is the error boundary for everything it calls: any failure is logged
 * once at ERROR and turned into exit code {@value #EXIT_FAILURE}. Connections are closed
 * on every path.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphCommands {

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private final MarkdownTreeBuilder treeBuilder;
    private final Neo4jConnectionFactory connectionFactory;
    private final Neo4jWriter writer;
    private final GraphTraversal traversal;
    private final KangarooConfig config;

    // ==================== Commands ====================

    /**
     * Parses the file and replaces the stored graph with it.
     */
    public int createGraph(CommandLineArguments arguments) {
        try {
            var settings = resolveSettings(arguments);
            var root = parseFile(arguments.getRequiredOption(Option.FILE));

            try (var connection = connectionFactory.open(settings)) {
                writer.replaceGraph(connection, root);
            }
            return EXIT_SUCCESS;
        } catch (RuntimeException e) {
            return fail("Error creating graph", e);
        }
    }

    /**
     * Reads the stored graph and prints it as Markdown.
     */
    public int traverseGraph(CommandLineArguments arguments, PrintStream out) {
        try {
            var settings = resolveSettings(arguments);

            try (var connection = connectionFactory.open(settings)) {
                var markdown = traversal.traverse(connection);
                if (markdown.isEmpty()) {
                    // reported by the traversal
                    return EXIT_FAILURE;
                }
                out.print(markdown.get());
                out.flush();
            }
            return EXIT_SUCCESS;
        } catch (RuntimeException e) {
            return fail("Error traversing graph", e);
        }
    }

    /**
     * Parses the file and prints (or writes) the Cypher script that would create its graph.
     */
    public int cypherScript(CommandLineArguments arguments, PrintStream out) {
        try {
            var root = parseFile(arguments.getRequiredOption(Option.FILE));
            var script = writer.generateScript(root);

            var output = arguments.getOption(Option.OUTPUT);
            if (output.isPresent()) {
                writeFile(output.get(), script);
            } else {
                out.println(script);
                out.flush();
            }
            return EXIT_SUCCESS;
        } catch (RuntimeException e) {
            return fail("Error generating script", e);
        }
    }

    // ==================== Private Methods ====================

    private ConnectionSettings resolveSettings(CommandLineArguments arguments) {
        var settings = ConnectionSettings.resolve(
                arguments.getOption(Option.URI).orElse(null),
                arguments.getOption(Option.USERNAME).orElse(null),
                arguments.getOption(Option.PASSWORD).orElse(null),
                config.getNeo4j()
        );
        log.debug("Resolved connection settings: {}", settings);
        return settings;
    }

    private MarkdownNode parseFile(String file) {
        return treeBuilder.parse(readFile(file));
    }

    private String readFile(String file) {
        try {
            var content = Files.readString(Path.of(file), StandardCharsets.UTF_8);
            log.info("Read {} characters from {}", content.length(), file);
            return content;
        } catch (NoSuchFileException e) {
            throw new GraphOperationException(FailureKind.INPUT, "File not found: " + file, e);
        } catch (IOException | InvalidPathException e) {
            throw new GraphOperationException(FailureKind.INPUT,
                    "Cannot read file %s: %s".formatted(file, e.getMessage()), e);
        }
    }

    private void writeFile(String file, String content) {
        try {
            Files.writeString(Path.of(file), content + "\n", StandardCharsets.UTF_8);
            log.info("Wrote Cypher script to {}", file);
        } catch (IOException | InvalidPathException e) {
            throw new GraphOperationException(FailureKind.INPUT,
                    "Cannot write file %s: %s".formatted(file, e.getMessage()), e);
        }
    }

    private int fail(String action, RuntimeException e) {
        log.error("{}: {}", action, e.getMessage());
        if (e instanceof GraphOperationException failure) {
            log.debug("Failure kind: {}", failure.getKind(), e);
        } else {
            log.debug("Unexpected failure", e);
        }
        return EXIT_FAILURE;
    }
}
