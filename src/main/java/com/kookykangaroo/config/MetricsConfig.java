package com.kookykangaroo.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.Getter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration for KookyKangaroo.
 *
 * Metrics stay in process; the command layer logs the figures it needs.
 */
@Configuration
public class MetricsConfig {

    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public GraphMetrics graphMetrics(MeterRegistry registry) {
        return new GraphMetrics(registry);
    }

    /**
     * Counters and timers for graph writes and traversals.
     */
    @Getter
    public static class GraphMetrics {

        // Counters
        private final Counter nodesWritten;
        private final Counter edgesWritten;
        private final Counter writesFailed;

        // Timers
        private final Timer writeTimer;
        private final Timer traverseTimer;

        public GraphMetrics(MeterRegistry registry) {
            this.nodesWritten = Counter.builder("kangaroo.graph.nodes.written")
                    .description("Number of nodes written to Neo4j")
                    .register(registry);

            this.edgesWritten = Counter.builder("kangaroo.graph.edges.written")
                    .description("Number of CONTAINS relations written to Neo4j")
                    .register(registry);

            this.writesFailed = Counter.builder("kangaroo.graph.writes.failed")
                    .description("Number of failed graph writes")
                    .register(registry);

            this.writeTimer = Timer.builder("kangaroo.graph.write.duration")
                    .description("Time taken to replace the graph")
                    .register(registry);

            this.traverseTimer = Timer.builder("kangaroo.graph.traverse.duration")
                    .description("Time taken to traverse the graph into Markdown")
                    .register(registry);
        }
    }
}
