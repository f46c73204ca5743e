package dev.regula.cascade;

/** How a tier call ended. */
public enum TierStatus {
  /** Returned at least one hit. */
  SUCCEEDED,
  /** Returned no hits. */
  EMPTY,
  /** Did not answer within the tier timeout and was cancelled. */
  TIMED_OUT,
  /** The backend reported an error. */
  FAILED,
  /** The request thread was interrupted while waiting. */
  CANCELLED,
  /** No adapter is registered for the tier's backend. */
  SKIPPED,
  /** Issued concurrently, then cancelled because an earlier tier already met the stop condition. */
  DISCARDED;

  /** Whether the tier counts as used in the response. */
  public boolean invoked() {
    return this != SKIPPED && this != DISCARDED;
  }
}
