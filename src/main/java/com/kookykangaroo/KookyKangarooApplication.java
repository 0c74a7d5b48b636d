package com.kookykangaroo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.neo4j.Neo4jAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * KookyKangaroo Application - Entry point for the command line.
 *
 * Parses Markdown documents into heading/paragraph graphs stored in Neo4j, and
 * traverses stored graphs back into Markdown. The process exit code is the
 * exit code of the command that ran.
 */
@SpringBootApplication(exclude = Neo4jAutoConfiguration.class)
@ConfigurationPropertiesScan("com.kookykangaroo.config")
public class KookyKangarooApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(KookyKangarooApplication.class, args)));
    }
}
