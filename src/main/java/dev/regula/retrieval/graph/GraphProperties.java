package dev.regula.retrieval.graph;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Graph backend connection and traversal settings, bound from {@code regula.graph.*}.
 *
 * <ul>
 *   <li>{@code uri}, {@code username}, {@code password} - Neo4j Bolt connection
 *   <li>{@code max-hops} - traversal depth from seed nodes (default 1, bounded [0, 3])
 *   <li>{@code seed-limit} - full-text seed nodes kept before traversal (default 10)
 *   <li>{@code max-terms} - Lucene clauses per query (default 12)
 *   <li>{@code max-content-chars} - node text kept per hit (default 1500)
 *   <li>{@code query-timeout} - server-side transaction and connect timeout (default 5s)
 *   <li>{@code max-connections} - driver connection pool size (default 16)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "regula.graph")
public class GraphProperties {

  private String uri = "bolt://localhost:7687";
  private String username = "neo4j";
  private String password = "";
  private int maxHops = 1;
  private int seedLimit = 10;
  private int maxTerms = 12;
  private int maxContentChars = 1500;
  private Duration queryTimeout = Duration.ofSeconds(5);
  private int maxConnections = 16;

  @PostConstruct
  void validate() {
    if (maxHops < 0 || maxHops > 3) {
      throw new IllegalStateException("regula.graph.max-hops must be in [0, 3], got: " + maxHops);
    }
    if (seedLimit < 1) {
      throw new IllegalStateException("regula.graph.seed-limit must be >= 1, got: " + seedLimit);
    }
    if (maxTerms < 1) {
      throw new IllegalStateException("regula.graph.max-terms must be >= 1, got: " + maxTerms);
    }
    if (maxContentChars < 100) {
      throw new IllegalStateException(
          "regula.graph.max-content-chars must be >= 100, got: " + maxContentChars);
    }
    if (queryTimeout.isNegative() || queryTimeout.isZero()) {
      throw new IllegalStateException(
          "regula.graph.query-timeout must be positive, got: " + queryTimeout);
    }
    if (maxConnections < 1) {
      throw new IllegalStateException(
          "regula.graph.max-connections must be >= 1, got: " + maxConnections);
    }
  }

  public String getUri() {
    return uri;
  }

  public void setUri(String uri) {
    this.uri = uri;
  }

  public String getUsername() {
    return username;
  }

  public void setUsername(String username) {
    this.username = username;
  }

  public String getPassword() {
    return password;
  }

  public void setPassword(String password) {
    this.password = password;
  }

  public int getMaxHops() {
    return maxHops;
  }

  public void setMaxHops(int maxHops) {
    this.maxHops = maxHops;
  }

  public int getSeedLimit() {
    return seedLimit;
  }

  public void setSeedLimit(int seedLimit) {
    this.seedLimit = seedLimit;
  }

  public int getMaxTerms() {
    return maxTerms;
  }

  public void setMaxTerms(int maxTerms) {
    this.maxTerms = maxTerms;
  }

  public int getMaxContentChars() {
    return maxContentChars;
  }

  public void setMaxContentChars(int maxContentChars) {
    this.maxContentChars = maxContentChars;
  }

  public Duration getQueryTimeout() {
    return queryTimeout;
  }

  public void setQueryTimeout(Duration queryTimeout) {
    this.queryTimeout = queryTimeout;
  }

  public int getMaxConnections() {
    return maxConnections;
  }

  public void setMaxConnections(int maxConnections) {
    this.maxConnections = maxConnections;
  }
}
