package dev.regula.retrieval;

/**
 * Retrieval tiers in escalation order. Lower numbers are tried first and win ties during fusion.
 */
public enum Tier {
  HYBRID_NARROW(1, Backend.HYBRID),
  HYBRID_RELAXED(2, Backend.HYBRID),
  GRAPH(3, Backend.GRAPH),
  FULL_TEXT(4, Backend.FULL_TEXT);

  private final int number;
  private final Backend backend;

  Tier(int number, Backend backend) {
    this.number = number;
    this.backend = backend;
  }

  public int number() {
    return number;
  }

  public Backend backend() {
    return backend;
  }

  public static Tier ofNumber(int number) {
    for (Tier tier : values()) {
      if (tier.number == number) {
        return tier;
      }
    }
    throw new IllegalArgumentException("No retrieval tier " + number);
  }
}
