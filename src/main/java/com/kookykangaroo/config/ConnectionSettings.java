package com.kookykangaroo.config;

/**
 * Resolved Neo4j connection parameters for a single command.
 */
public record ConnectionSettings(String uri, String username, String password) {

    public static final String DEFAULT_URI = "bolt://localhost:7687";
    public static final String DEFAULT_USERNAME = "neo4j";
    public static final String DEFAULT_PASSWORD = "neo4j";

    /**
     * Resolves each parameter in priority order: explicit flag, configured value
     * (environment), built-in default. Blank values count as absent.
     */
    public static ConnectionSettings resolve(String uriFlag, String usernameFlag, String passwordFlag,
                                             KangarooConfig.Neo4j configured) {
        return new ConnectionSettings(
                firstPresent(uriFlag, configured.getUri(), DEFAULT_URI),
                firstPresent(usernameFlag, configured.getUsername(), DEFAULT_USERNAME),
                firstPresent(passwordFlag, configured.getPassword(), DEFAULT_PASSWORD)
        );
    }

    private static String firstPresent(String flag, String configured, String fallback) {
        if (flag != null && !flag.isBlank()) {
            return flag;
        }
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        return fallback;
    }

    @Override
    public String toString() {
        return "ConnectionSettings[uri=%s, username=%s, password=****]".formatted(uri, username);
    }
}
