package dev.regula.config;

import dev.regula.retrieval.graph.GraphProperties;
import java.util.concurrent.TimeUnit;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Config;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the Neo4j {@link Driver} for the graph tier. The driver is thread-safe and pools its
 * own connections; it does not connect until the first session is opened.
 */
@Configuration
public class Neo4jConfig {

  private static final Logger log = LoggerFactory.getLogger(Neo4jConfig.class);

  @Bean(destroyMethod = "close")
  public Driver neo4jDriver(GraphProperties properties) {
    Config config =
        Config.builder()
            .withConnectionTimeout(properties.getQueryTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .withMaxConnectionPoolSize(properties.getMaxConnections())
            .build();
    log.info("Neo4j driver configured for {}", properties.getUri());
    return GraphDatabase.driver(
        properties.getUri(),
        AuthTokens.basic(properties.getUsername(), properties.getPassword()),
        config);
  }
}
