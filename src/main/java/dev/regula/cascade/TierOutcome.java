package dev.regula.cascade;

import dev.regula.retrieval.RetrievalHit;
import dev.regula.retrieval.Tier;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Result of one tier call.
 *
 * @param tier the tier
 * @param status how the call ended
 * @param hits raw hits returned by the adapter; empty unless {@code SUCCEEDED}
 * @param elapsedMillis wall-clock time spent waiting for the call
 * @param error failure description for {@code FAILED}, {@code TIMED_OUT} and {@code SKIPPED}
 */
public record TierOutcome(
    Tier tier,
    TierStatus status,
    List<RetrievalHit> hits,
    long elapsedMillis,
    @Nullable String error) {

  public TierOutcome {
    Objects.requireNonNull(tier, "tier");
    Objects.requireNonNull(status, "status");
    hits = List.copyOf(hits);
  }

  static TierOutcome of(Tier tier, List<RetrievalHit> hits, long elapsedMillis) {
    return new TierOutcome(
        tier, hits.isEmpty() ? TierStatus.EMPTY : TierStatus.SUCCEEDED, hits, elapsedMillis, null);
  }

  static TierOutcome failed(Tier tier, TierStatus status, long elapsedMillis, String error) {
    return new TierOutcome(tier, status, List.of(), elapsedMillis, error);
  }
}
