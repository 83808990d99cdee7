package com.stratum.graph;

import com.stratum.core.port.GraphSink;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.GraphDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chooses the {@link GraphSink}: Neo4j when {@code stratum.graph.uri} is set, in-memory otherwise.
 */
@Configuration
public class GraphConfiguration {

    private static final Logger log = LoggerFactory.getLogger(GraphConfiguration.class);

    @Bean
    public GraphSink graphSink(GraphProperties properties) {
        if (!properties.isNeo4jConfigured()) {
            log.info("No graph URI configured, keeping results in memory");
            return new InMemoryGraphSink();
        }
        log.info("Writing graph to Neo4j at {} (database {})", properties.getUri(), properties.getDatabase());
        var driver = GraphDatabase.driver(properties.getUri(),
                AuthTokens.basic(properties.getUsername(), properties.getPassword()));
        return new Neo4jGraphSink(driver, properties.getDatabase());
    }
}
