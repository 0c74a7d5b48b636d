package com.kookykangaroo.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Application configuration for KookyKangaroo.
 *
 * Connection defaults come from {@code application.yml}, which resolves the
 * {@code NEO4J_*} environment variables (or an optional {@code .env} file).
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "kangaroo")
public class KangarooConfig {

    /**
     * Neo4j connection defaults, overridden per command by CLI flags.
     */
    private Neo4j neo4j = new Neo4j();

    @Getter
    @Setter
    public static class Neo4j {

        /**
         * Bolt URI of the Neo4j server.
         */
        private String uri = ConnectionSettings.DEFAULT_URI;

        private String username = ConnectionSettings.DEFAULT_USERNAME;

        private String password = ConnectionSettings.DEFAULT_PASSWORD;

        /**
         * Verify connectivity right after opening the driver, so that an unreachable
         * server fails before any statement is issued.
         */
        private boolean verifyConnectivity = true;
    }
}
