package dev.regula.fusion;

import dev.regula.retrieval.RetrievalHit;
import dev.regula.retrieval.ScoreCalibrator;
import dev.regula.retrieval.Tier;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fuses hits from all tiers into a bounded {@link FusedContext}.
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>Calibrate every hit's raw score with {@link ScoreCalibrator}
 *   <li>De-duplicate by (document id, section id): across tiers the lowest tier's hit is kept and
 *       later tiers are recorded as corroborating; within a tier the higher score wins
 *   <li>Sort by calibrated score descending, then tier, then later effective date, then hit id
 *   <li>Fill greedily up to the entry cap and character budget; a passage larger than the whole
 *       budget is skipped, otherwise the first passage that does not fit ends the fill, and
 *       passages are never truncated
 *   <li>Assign reference ids {@code R1..Rn} in final order
 * </ol>
 */
@Component
public class ContextAssembler {

  private static final Logger log = LoggerFactory.getLogger(ContextAssembler.class);

  static final Comparator<RetrievalHit> CONTEXT_ORDER =
      Comparator.comparingDouble(RetrievalHit::normalizedScore)
          .reversed()
          .thenComparingInt((RetrievalHit h) -> h.tier().number())
          .thenComparing(
              RetrievalHit::effectiveFrom,
              Comparator.nullsLast(Comparator.<LocalDate>reverseOrder()))
          .thenComparing(RetrievalHit::id);

  private final ScoreCalibrator calibrator;
  private final FusionProperties properties;

  public ContextAssembler(ScoreCalibrator calibrator, FusionProperties properties) {
    this.calibrator = calibrator;
    this.properties = properties;
  }

  public FusedContext assemble(List<RetrievalHit> hits) {
    if (hits.isEmpty()) {
      return FusedContext.empty();
    }

    Map<String, Candidate> byPassage = new LinkedHashMap<>();
    int merged = 0;
    for (RetrievalHit raw : hits) {
      RetrievalHit hit = calibrator.calibrate(raw);
      Candidate existing = byPassage.get(hit.passageKey());
      if (existing == null) {
        byPassage.put(hit.passageKey(), new Candidate(hit, EnumSet.noneOf(Tier.class)));
        continue;
      }
      merged++;
      byPassage.put(hit.passageKey(), existing.merge(hit));
    }

    List<Candidate> ranked = new ArrayList<>(byPassage.values());
    ranked.sort(Comparator.comparing(Candidate::hit, CONTEXT_ORDER));

    List<ContextEntry> entries = new ArrayList<>();
    int used = 0;
    int oversized = 0;
    for (Candidate candidate : ranked) {
      int size = candidate.hit().content().length();
      if (size > properties.getMaxContextChars()) {
        oversized++;
        log.warn(
            "Skipping passage {} of {} chars: larger than the whole context budget of {}",
            candidate.hit().citation().label(),
            size,
            properties.getMaxContextChars());
        continue;
      }
      if (entries.size() == properties.getMaxEntries()
          || used + size > properties.getMaxContextChars()) {
        break;
      }
      used += size;
      entries.add(
          new ContextEntry(
              "R" + (entries.size() + 1),
              candidate.hit(),
              candidate.corroborating().stream().sorted().toList()));
    }

    int dropped = ranked.size() - entries.size();
    log.debug(
        "Assembled context: {} entries, {} chars, {} duplicates merged, {} dropped for budget"
            + " ({} oversized)",
        entries.size(),
        used,
        merged,
        dropped,
        oversized);
    return new FusedContext(entries, dropped, merged);
  }

  /** A de-duplicated passage and the other tiers that returned it. */
  private record Candidate(RetrievalHit hit, Set<Tier> corroborating) {

    Candidate merge(RetrievalHit other) {
      Set<Tier> tiers = EnumSet.noneOf(Tier.class);
      tiers.addAll(corroborating);
      if (other.tier() == hit.tier()) {
        RetrievalHit better = other.normalizedScore() > hit.normalizedScore() ? other : hit;
        return new Candidate(better, tiers);
      }
      if (other.tier().number() < hit.tier().number()) {
        tiers.add(hit.tier());
        tiers.remove(other.tier());
        return new Candidate(other, tiers);
      }
      tiers.add(other.tier());
      return new Candidate(hit, tiers);
    }
  }
}
