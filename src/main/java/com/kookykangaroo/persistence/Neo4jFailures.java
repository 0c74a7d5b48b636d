package com.kookykangaroo.persistence;

import com.kookykangaroo.persistence.GraphOperationException.FailureKind;
import org.neo4j.driver.exceptions.AuthenticationException;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;

/**
 * Translates driver exceptions into {@link GraphOperationException}.
 */
final class Neo4jFailures {

    private Neo4jFailures() {
    }

    static GraphOperationException translate(String action, Neo4jException e) {
        return new GraphOperationException(kindOf(e), action + ": " + e.getMessage(), e);
    }

    static FailureKind kindOf(Neo4jException e) {
        if (e instanceof ServiceUnavailableException
                || e instanceof AuthenticationException
                || e instanceof SessionExpiredException) {
            return FailureKind.CONNECTION;
        }
        return FailureKind.STATEMENT;
    }
}
