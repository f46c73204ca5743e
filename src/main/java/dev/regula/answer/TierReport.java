package dev.regula.answer;

import dev.regula.cascade.TierOutcome;
import dev.regula.cascade.TierStatus;
import dev.regula.retrieval.Backend;
import org.jspecify.annotations.Nullable;

/**
 * Per-tier execution summary returned to callers.
 *
 * @param tier tier number, 1 to 4
 * @param backend backend the tier queried
 * @param status how the tier call ended
 * @param hitCount hits returned by the tier
 * @param elapsedMillis time spent on the tier
 * @param error failure message, if any
 */
public record TierReport(
    int tier,
    Backend backend,
    TierStatus status,
    int hitCount,
    long elapsedMillis,
    @Nullable String error) {

  static TierReport of(TierOutcome outcome) {
    return new TierReport(
        outcome.tier().number(),
        outcome.tier().backend(),
        outcome.status(),
        outcome.hits().size(),
        outcome.elapsedMillis(),
        outcome.error());
  }
}
