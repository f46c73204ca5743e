package dev.regula.conflict;

import dev.regula.fusion.ContextEntry;
import dev.regula.fusion.FusedContext;
import dev.regula.retrieval.RelationKind;
import dev.regula.retrieval.RetrievalHit;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Flags unresolved conflicts among context entries using explicit relationship and date metadata
 * only. Text similarity is never consulted.
 *
 * <p>Every unordered pair of entries from different documents is inspected. A relationship edge
 * matches when its target is the other entry's document id or hit id. REFERENCES and HAS_SECTION
 * edges are ignored. Each document pair yields at most one finding, of the highest-precedence
 * {@link ConflictKind}.
 */
@Component
public class ConflictDetector {

  private static final Logger log = LoggerFactory.getLogger(ConflictDetector.class);

  public List<ConflictFinding> detect(FusedContext context) {
    List<ContextEntry> entries = context.entries();
    Map<String, ConflictFinding> byDocumentPair = new LinkedHashMap<>();

    for (int i = 0; i < entries.size(); i++) {
      for (int j = i + 1; j < entries.size(); j++) {
        ContextEntry first = entries.get(i);
        ContextEntry second = entries.get(j);
        if (first.hit().documentId().equals(second.hit().documentId())) {
          continue;
        }
        ConflictFinding finding = inspect(first, second);
        if (finding == null) {
          continue;
        }
        String pair = pairKey(first.hit().documentId(), second.hit().documentId());
        ConflictFinding existing = byDocumentPair.get(pair);
        if (existing == null || finding.kind().outranks(existing.kind())) {
          byDocumentPair.put(pair, finding);
        }
      }
    }

    List<ConflictFinding> findings = new ArrayList<>(byDocumentPair.values());
    if (!findings.isEmpty()) {
      log.info("Detected {} conflict(s) among {} context entries", findings.size(), entries.size());
    }
    return findings;
  }

  private static @Nullable ConflictFinding inspect(ContextEntry a, ContextEntry b) {
    if (points(a.hit(), RelationKind.SUPERSEDES, b.hit())) {
      return directed(a, b, ConflictKind.SUPERSESSION, "supersedes");
    }
    if (points(b.hit(), RelationKind.SUPERSEDES, a.hit())) {
      return directed(b, a, ConflictKind.SUPERSESSION, "supersedes");
    }
    if (points(a.hit(), RelationKind.AMENDS, b.hit())) {
      return directed(a, b, ConflictKind.DIRECT_CONTRADICTION_CANDIDATE, "amends");
    }
    if (points(b.hit(), RelationKind.AMENDS, a.hit())) {
      return directed(b, a, ConflictKind.DIRECT_CONTRADICTION_CANDIDATE, "amends");
    }
    if (citationKey(a.hit()).equals(citationKey(b.hit())) && periodsDiffer(a.hit(), b.hit())) {
      return new ConflictFinding(
          a.referenceId(),
          b.referenceId(),
          ConflictKind.AMBIGUOUS_OVERLAP,
          "[%s] and [%s] both cite %s but state different in-force periods (%s vs %s)"
              .formatted(
                  a.referenceId(),
                  b.referenceId(),
                  a.label(),
                  period(a.hit()),
                  period(b.hit())));
    }
    return null;
  }

  private static boolean points(RetrievalHit from, RelationKind kind, RetrievalHit to) {
    return from.relatesTo(kind, to.documentId()) || from.relatesTo(kind, to.id());
  }

  private static ConflictFinding directed(
      ContextEntry actor, ContextEntry target, ConflictKind kind, String verb) {
    return new ConflictFinding(
        actor.referenceId(),
        target.referenceId(),
        kind,
        "[%s] %s %s [%s] %s"
            .formatted(
                actor.referenceId(), actor.label(), verb, target.referenceId(), target.label()));
  }

  private static boolean periodsDiffer(RetrievalHit a, RetrievalHit b) {
    boolean aExplicit = a.effectiveFrom() != null || a.effectiveTo() != null;
    boolean bExplicit = b.effectiveFrom() != null || b.effectiveTo() != null;
    return aExplicit
        && bExplicit
        && !(Objects.equals(a.effectiveFrom(), b.effectiveFrom())
            && Objects.equals(a.effectiveTo(), b.effectiveTo()));
  }

  private static String citationKey(RetrievalHit hit) {
    String section = hit.citation().sectionId();
    return hit.citation().documentTitle().strip().toLowerCase(Locale.ROOT)
        + "#"
        + (section == null ? "" : section.strip().toLowerCase(Locale.ROOT));
  }

  private static String period(RetrievalHit hit) {
    return bound(hit.effectiveFrom()) + " to " + bound(hit.effectiveTo());
  }

  private static String bound(@Nullable LocalDate date) {
    return date == null ? "open" : date.toString();
  }

  private static String pairKey(String first, String second) {
    return first.compareTo(second) <= 0 ? first + "|" + second : second + "|" + first;
  }
}
