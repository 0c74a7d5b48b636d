package com.kookykangaroo.persistence;

import com.kookykangaroo.config.ConnectionSettings;
import com.kookykangaroo.config.KangarooConfig;
import com.kookykangaroo.persistence.GraphOperationException.FailureKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.exceptions.Neo4jException;
import org.springframework.stereotype.Component;

/**
 * Opens Neo4j connections for resolved connection settings.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class Neo4jConnectionFactory {

    private final KangarooConfig config;

    public Neo4jConnection open(ConnectionSettings settings) {
        var driver = createDriver(settings);

        if (config.getNeo4j().isVerifyConnectivity()) {
            verify(driver, settings.uri());
        }

        log.info("Connected to Neo4j at {}", settings.uri());
        return new Neo4jConnection(driver, settings.uri());
    }

    // ==================== Private Methods ====================

    private Driver createDriver(ConnectionSettings settings) {
        try {
            return GraphDatabase.driver(settings.uri(),
                    AuthTokens.basic(settings.username(), settings.password()));
        } catch (IllegalArgumentException e) {
            throw new GraphOperationException(FailureKind.CONNECTION,
                    "Invalid Neo4j URI '%s': %s".formatted(settings.uri(), e.getMessage()), e);
        }
    }

    private void verify(Driver driver, String uri) {
        try {
            driver.verifyConnectivity();
        } catch (Neo4jException e) {
            driver.close();
            throw Neo4jFailures.translate("Failed to connect to Neo4j at " + uri, e);
        }
    }
}
