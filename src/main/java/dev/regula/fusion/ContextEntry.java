package dev.regula.fusion;

import dev.regula.retrieval.RetrievalHit;
import dev.regula.retrieval.Tier;
import java.util.List;
import java.util.Objects;

/**
 * One passage in the assembled context.
 *
 * @param referenceId stable short id used in the prompt and in citations ({@code R1}, {@code R2},
 *     ...)
 * @param hit the retained hit, with calibrated score
 * @param corroboratingTiers later tiers that returned the same passage
 */
public record ContextEntry(String referenceId, RetrievalHit hit, List<Tier> corroboratingTiers) {

  public ContextEntry {
    Objects.requireNonNull(referenceId, "referenceId");
    Objects.requireNonNull(hit, "hit");
    corroboratingTiers = List.copyOf(corroboratingTiers);
  }

  public String label() {
    return hit.citation().label();
  }

  public int contentSize() {
    return hit.content().length();
  }
}
