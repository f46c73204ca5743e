package dev.regula.fusion;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Context budget bound from {@code regula.fusion.*}.
 *
 * <ul>
 *   <li>{@code max-context-chars} - total passage characters handed to the generator (default
 *       12000)
 *   <li>{@code max-entries} - maximum number of passages (default 12)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "regula.fusion")
public class FusionProperties {

  private int maxContextChars = 12_000;
  private int maxEntries = 12;

  @PostConstruct
  void validate() {
    if (maxContextChars < 500) {
      throw new IllegalStateException(
          "regula.fusion.max-context-chars must be >= 500, got: " + maxContextChars);
    }
    if (maxEntries < 1 || maxEntries > 50) {
      throw new IllegalStateException(
          "regula.fusion.max-entries must be in [1, 50], got: " + maxEntries);
    }
  }

  public int getMaxContextChars() {
    return maxContextChars;
  }

  public void setMaxContextChars(int maxContextChars) {
    this.maxContextChars = maxContextChars;
  }

  public int getMaxEntries() {
    return maxEntries;
  }

  public void setMaxEntries(int maxEntries) {
    this.maxEntries = maxEntries;
  }
}
