package dev.regula.synthesis;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Answer synthesis settings, bound from {@code regula.synthesis.*}.
 *
 * <ul>
 *   <li>{@code timeout} - wall-clock limit for one generator call, retries included (default 60s)
 *   <li>{@code parse-retries} - extra generations allowed after unparseable output (0 or 1)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "regula.synthesis")
public class SynthesisProperties {

  private Duration timeout = Duration.ofSeconds(60);
  private int parseRetries = 0;

  @PostConstruct
  void validate() {
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalStateException(
          "regula.synthesis.timeout must be positive, got: " + timeout);
    }
    if (parseRetries < 0 || parseRetries > 1) {
      throw new IllegalStateException(
          "regula.synthesis.parse-retries must be 0 or 1, got: " + parseRetries);
    }
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }

  public int getParseRetries() {
    return parseRetries;
  }

  public void setParseRetries(int parseRetries) {
    this.parseRetries = parseRetries;
  }
}
