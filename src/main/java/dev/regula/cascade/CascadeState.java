package dev.regula.cascade;

import dev.regula.retrieval.RetrievalHit;
import dev.regula.retrieval.ScoreCalibrator;
import dev.regula.retrieval.Tier;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Immutable snapshot of the cascade between steps. Each tier outcome produces a new state; the
 * escalation decision is a function of the state alone.
 *
 * @param currentTier the last tier whose outcome was folded in, or {@code null} before the first
 * @param hits accumulated hits with calibrated scores, in arrival order
 * @param outcomes per-tier outcomes in execution order
 * @param quality evidence quality over {@code hits}
 * @param accepted whether the stop condition has been met
 * @param interrupted whether the request thread was interrupted
 */
public record CascadeState(
    @Nullable Tier currentTier,
    List<RetrievalHit> hits,
    List<TierOutcome> outcomes,
    ResultQuality quality,
    boolean accepted,
    boolean interrupted) {

  public CascadeState {
    hits = List.copyOf(hits);
    outcomes = List.copyOf(outcomes);
  }

  static CascadeState initial() {
    return new CascadeState(null, List.of(), List.of(), ResultQuality.NONE, false, false);
  }

  /** Folds a tier outcome into the state, calibrating its hits and re-evaluating quality. */
  CascadeState after(
      TierOutcome outcome, ScoreCalibrator calibrator, CascadeProperties properties) {
    List<RetrievalHit> accumulated = new ArrayList<>(hits);
    for (RetrievalHit hit : outcome.hits()) {
      accumulated.add(calibrator.calibrate(hit));
    }
    List<TierOutcome> nextOutcomes = new ArrayList<>(outcomes);
    nextOutcomes.add(outcome);
    ResultQuality nextQuality = ResultQuality.assess(accumulated, properties);
    return new CascadeState(
        outcome.tier(),
        accumulated,
        nextOutcomes,
        nextQuality,
        nextQuality.meetsStopCondition(properties),
        interrupted || outcome.status() == TierStatus.CANCELLED);
  }

  /** Records an outcome whose hits are not kept. */
  CascadeState discarding(TierOutcome outcome) {
    List<TierOutcome> nextOutcomes = new ArrayList<>(outcomes);
    nextOutcomes.add(outcome);
    return new CascadeState(currentTier, hits, nextOutcomes, quality, accepted, interrupted);
  }

  boolean finished() {
    return accepted || interrupted;
  }
}
