package dev.regula.synthesis;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAI-compatible generation endpoint settings, bound from {@code regula.generator.*}.
 *
 * <p>Transport retries ({@code regula.generator.retry.*}) are read directly by {@link
 * GeneratorClient}'s {@code @Retryable} expressions and validated here.
 */
@Configuration
@ConfigurationProperties(prefix = "regula.generator")
public class GeneratorProperties {

  private String baseUrl = "http://localhost:11434/v1";
  private String apiKey = "not-needed";
  private String modelName = "llama3.1";
  private double temperature = 0.1;
  private Duration timeout = Duration.ofSeconds(45);
  private Retry retry = new Retry();

  @PostConstruct
  void validate() {
    if (baseUrl == null || baseUrl.isBlank()) {
      throw new IllegalStateException("regula.generator.base-url must not be blank");
    }
    if (modelName == null || modelName.isBlank()) {
      throw new IllegalStateException("regula.generator.model-name must not be blank");
    }
    if (temperature < 0.0 || temperature > 2.0) {
      throw new IllegalStateException(
          "regula.generator.temperature must be in [0.0, 2.0], got: " + temperature);
    }
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalStateException(
          "regula.generator.timeout must be positive, got: " + timeout);
    }
    if (retry.getMaxAttempts() < 1 || retry.getMaxAttempts() > 5) {
      throw new IllegalStateException(
          "regula.generator.retry.max-attempts must be in [1, 5], got: "
              + retry.getMaxAttempts());
    }
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String getApiKey() {
    return apiKey;
  }

  public void setApiKey(String apiKey) {
    this.apiKey = apiKey;
  }

  public String getModelName() {
    return modelName;
  }

  public void setModelName(String modelName) {
    this.modelName = modelName;
  }

  public double getTemperature() {
    return temperature;
  }

  public void setTemperature(double temperature) {
    this.temperature = temperature;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }

  public Retry getRetry() {
    return retry;
  }

  public void setRetry(Retry retry) {
    this.retry = retry;
  }

  public static class Retry {

    private int maxAttempts = 2;
    private long delayMs = 500;
    private double multiplier = 2.0;

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public long getDelayMs() {
      return delayMs;
    }

    public void setDelayMs(long delayMs) {
      this.delayMs = delayMs;
    }

    public double getMultiplier() {
      return multiplier;
    }

    public void setMultiplier(double multiplier) {
      this.multiplier = multiplier;
    }
  }
}
