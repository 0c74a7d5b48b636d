package com.kookykangaroo.persistence;

import com.kookykangaroo.config.MetricsConfig.GraphMetrics;
import com.kookykangaroo.markdown.MarkdownNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Transaction;
import org.neo4j.driver.exceptions.Neo4jException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Default implementation of Neo4jWriter.
 *
 * The wipe and every create run in one explicit transaction that is only committed
 * after the last statement, so a failed statement leaves the previous graph in place.
 * Nothing is retried.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultNeo4jWriter implements Neo4jWriter {

    private final CypherBuilder cypherBuilder;
    private final GraphMetrics graphMetrics;

    @Override
    public WriteResult replaceGraph(Neo4jConnection connection, MarkdownNode root) {
        log.info("Creating graph from markdown tree");

        var plan = cypherBuilder.plan(root);
        var statements = cypherBuilder.buildStatements(plan);

        long startTime = System.currentTimeMillis();
        try {
            runInTransaction(connection, statements);
        } catch (Neo4jException e) {
            graphMetrics.getWritesFailed().increment();
            throw Neo4jFailures.translate("Failed to write graph", e);
        }
        long duration = System.currentTimeMillis() - startTime;

        var result = new WriteResult(plan.nodes().size(), plan.edges().size(), duration);
        recordSuccess(result);
        return result;
    }

    @Override
    public String generateScript(MarkdownNode root) {
        return cypherBuilder.buildScript(cypherBuilder.plan(root));
    }

    // ==================== Private Methods ====================

    private void runInTransaction(Neo4jConnection connection, List<CypherStatement> statements) {
        try (var session = connection.openSession(); var tx = session.beginTransaction()) {
            statements.forEach(statement -> executeSingleStatement(tx, statement));
            tx.commit();
        }
    }

    private void executeSingleStatement(Transaction tx, CypherStatement statement) {
        log.debug("Executing query: {}", statement.query());
        log.trace("Parameters: {}", statement.parameters());
        tx.run(statement.query(), statement.parameters()).consume();
    }

    private void recordSuccess(WriteResult result) {
        graphMetrics.getNodesWritten().increment(result.nodesWritten());
        graphMetrics.getEdgesWritten().increment(result.edgesWritten());
        graphMetrics.getWriteTimer().record(Duration.ofMillis(result.durationMs()));
        log.info("Graph creation completed: {} nodes, {} edges in {}ms",
                result.nodesWritten(), result.edgesWritten(), result.durationMs());
    }
}
