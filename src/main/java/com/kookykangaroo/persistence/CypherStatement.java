package com.kookykangaroo.persistence;

import java.util.Map;

/**
 * A parameterized Cypher statement.
 */
public record CypherStatement(String query, Map<String, Object> parameters) {

    public CypherStatement {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    public static CypherStatement of(String query) {
        return new CypherStatement(query, Map.of());
    }
}
