package dev.regula.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Sizing of the bounded executor that runs backend and generator calls, bound from {@code
 * regula.executor.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "regula.executor")
public class ExecutorProperties {

  private int coreSize = 8;
  private int maxSize = 32;
  private int queueCapacity = 100;

  @PostConstruct
  void validate() {
    if (coreSize < 1) {
      throw new IllegalStateException("regula.executor.core-size must be >= 1, got: " + coreSize);
    }
    if (maxSize < coreSize) {
      throw new IllegalStateException(
          "regula.executor.max-size must be >= core-size, got: " + maxSize);
    }
    if (queueCapacity < 1) {
      throw new IllegalStateException(
          "regula.executor.queue-capacity must be >= 1, got: " + queueCapacity);
    }
  }

  public int getCoreSize() {
    return coreSize;
  }

  public void setCoreSize(int coreSize) {
    this.coreSize = coreSize;
  }

  public int getMaxSize() {
    return maxSize;
  }

  public void setMaxSize(int maxSize) {
    this.maxSize = maxSize;
  }

  public int getQueueCapacity() {
    return queueCapacity;
  }

  public void setQueueCapacity(int queueCapacity) {
    this.queueCapacity = queueCapacity;
  }
}
