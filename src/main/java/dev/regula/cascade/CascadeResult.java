package dev.regula.cascade;

import dev.regula.retrieval.RetrievalHit;
import dev.regula.retrieval.Tier;
import java.util.List;

/**
 * Final output of the cascade.
 *
 * @param hits all hits gathered by the tiers that ran, with calibrated scores
 * @param outcomes per-tier outcomes in execution order
 * @param quality evidence quality over {@code hits}
 * @param accepted whether some tier met the stop condition
 * @param interrupted whether the cascade was cut short by thread interruption
 */
public record CascadeResult(
    List<RetrievalHit> hits,
    List<TierOutcome> outcomes,
    ResultQuality quality,
    boolean accepted,
    boolean interrupted) {

  public CascadeResult {
    hits = List.copyOf(hits);
    outcomes = List.copyOf(outcomes);
  }

  static CascadeResult from(CascadeState state) {
    return new CascadeResult(
        state.hits(), state.outcomes(), state.quality(), state.accepted(), state.interrupted());
  }

  /** Tiers that were actually invoked, in execution order. */
  public List<Tier> tiersUsed() {
    return outcomes.stream()
        .filter(o -> o.status().invoked())
        .map(TierOutcome::tier)
        .toList();
  }

  /** True when every tier ran without meeting the stop condition. */
  public boolean lowEvidence() {
    return !accepted;
  }
}
