package com.kookykangaroo.persistence;

import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Session;

/**
 * An open Neo4j driver scoped to one command. Close it with try-with-resources.
 */
@Slf4j
public class Neo4jConnection implements AutoCloseable {

    private final Driver driver;
    private final String uri;

    public Neo4jConnection(Driver driver, String uri) {
        this.driver = driver;
        this.uri = uri;
    }

    public Session openSession() {
        return driver.session();
    }

    @Override
    public void close() {
        driver.close();
        log.info("Disconnected from Neo4j at {}", uri);
    }
}
