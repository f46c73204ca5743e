package dev.regula.validation;

import dev.regula.fusion.ContextEntry;
import dev.regula.fusion.FusedContext;
import dev.regula.synthesis.Claim;
import dev.regula.synthesis.ClaimStatus;
import dev.regula.synthesis.ConflictNote;
import dev.regula.synthesis.StructuredAnswer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Checks every citation in a generated answer against the fused context.
 *
 * <p>SUPPORTED claims and requirement bullets keep only citations that resolve to a context entry
 * (rewritten to the entry's reference id); an entry left with no citation is removed and recorded
 * as a {@link CitationMismatch}. NOT_FOUND claims are kept with their citations cleared. Conflict
 * notes naming any unknown reference are removed. Nothing is ever added.
 *
 * <p>The direct answer and explanation are checked sentence by sentence: a sentence carrying an
 * inline {@code [Rn]} marker or a {@code "<title>, Section <id>"} label that does not resolve is
 * removed. A direct answer that loses every sentence comes back blank, which leaves the answer
 * without supported content.
 */
@Component
public class CitationValidator {

  private static final Logger log = LoggerFactory.getLogger(CitationValidator.class);

  private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");
  private static final Pattern INLINE_REFERENCE =
      Pattern.compile("\\[\\s*(R\\d+)\\s*]", Pattern.CASE_INSENSITIVE);
  private static final Pattern INLINE_LABEL =
      Pattern.compile(
          "(\\p{Lu}[\\p{L}'’()-]*(?:\\s+(?:\\p{Lu}[\\p{L}'’()-]*"
              + "|of|the|and|on|for|to|de|des|du|la|le|sur|et))*)"
              + ",\\s+Section\\s+(\\d+(?:\\.\\d+)*(?:\\(\\w+\\))*)");
  private static final Pattern STATUTE_WORD =
      Pattern.compile("\\b(?:Act|Regulations?|Rules|Code|Order|Charter|Loi|Règlement)\\b");

  public ValidationReport validate(StructuredAnswer answer, FusedContext context) {
    Tally tally = new Tally();
    List<Claim> claims = new ArrayList<>();
    for (Claim claim : answer.claims()) {
      if (claim.status() == ClaimStatus.NOT_FOUND) {
        claims.add(claim.withCitations(List.of()));
        continue;
      }
      check(claim, false, context, tally).ifPresent(claims::add);
    }
    List<Claim> requirements = new ArrayList<>();
    for (Claim requirement : answer.requirements()) {
      check(requirement, true, context, tally).ifPresent(requirements::add);
    }

    List<ConflictNote> conflicts = new ArrayList<>();
    int droppedNotes = 0;
    for (ConflictNote note : answer.conflicts()) {
      List<String> ids = new ArrayList<>();
      for (String reference : note.references()) {
        context.resolve(reference).map(ContextEntry::referenceId).ifPresent(ids::add);
      }
      if (note.references().isEmpty() || ids.size() != note.references().size()) {
        droppedNotes++;
        continue;
      }
      conflicts.add(new ConflictNote(ids, note.description()));
    }

    String directAnswer = checkProse(answer.directAnswer(), context, tally);
    String explanation = checkProse(answer.explanation(), context, tally);

    String limitations = answer.limitations();
    if (!tally.mismatches.isEmpty()) {
      String removal =
          "Removed %d statement(s) whose citations could not be matched to the retrieved documents."
              .formatted(tally.mismatches.size());
      limitations = limitations.isBlank() ? removal : limitations + " " + removal;
      log.warn(
          "Citation validation removed {} statements ({} cited claims checked)",
          tally.mismatches.size(),
          tally.checked);
    }

    return new ValidationReport(
        answer.withValidated(
            directAnswer, explanation, claims, requirements, conflicts, limitations),
        tally.checked,
        tally.passed,
        tally.mismatches,
        tally.droppedCitations,
        droppedNotes);
  }

  private static Optional<Claim> check(
      Claim claim, boolean requirement, FusedContext context, Tally tally) {
    tally.checked++;
    Set<String> resolved = new LinkedHashSet<>();
    for (String citation : claim.citations()) {
      Optional<ContextEntry> entry = context.resolve(citation);
      if (entry.isPresent()) {
        resolved.add(entry.get().referenceId());
      } else {
        tally.droppedCitations++;
        log.debug("Unresolvable citation '{}'", citation);
      }
    }
    if (resolved.isEmpty()) {
      tally.mismatches.add(new CitationMismatch(claim.text(), claim.citations(), requirement));
      return Optional.empty();
    }
    tally.passed++;
    return Optional.of(claim.withCitations(List.copyOf(resolved)));
  }

  /** Drops every sentence of free text that cites something outside the context. */
  private static String checkProse(String text, FusedContext context, Tally tally) {
    if (text.isBlank()) {
      return text;
    }
    List<String> kept = new ArrayList<>();
    for (String sentence : SENTENCE_BREAK.split(text.strip())) {
      List<String> unresolved = unresolvedCitations(sentence, context);
      if (unresolved.isEmpty()) {
        kept.add(sentence);
        continue;
      }
      tally.droppedCitations += unresolved.size();
      tally.mismatches.add(new CitationMismatch(sentence, unresolved, false));
      log.debug("Removed sentence citing {}", unresolved);
    }
    return String.join(" ", kept);
  }

  static List<String> unresolvedCitations(String sentence, FusedContext context) {
    List<String> unresolved = new ArrayList<>();
    Matcher reference = INLINE_REFERENCE.matcher(sentence);
    while (reference.find()) {
      if (context.resolve(reference.group(1)).isEmpty()) {
        unresolved.add(reference.group(1));
      }
    }
    Matcher label = INLINE_LABEL.matcher(sentence);
    while (label.find()) {
      String title = label.group(1);
      if (!STATUTE_WORD.matcher(title).find()) {
        continue;
      }
      if (!resolvesLabel(title, label.group(2), context)) {
        unresolved.add(title + ", Section " + label.group(2));
      }
    }
    return unresolved;
  }

  // The title match may pick up capitalized words before the title, so each capitalized suffix
  // is tried in turn.
  private static boolean resolvesLabel(String title, String section, FusedContext context) {
    String[] words = title.split("\\s+");
    for (int start = 0; start < words.length; start++) {
      if (!Character.isUpperCase(words[start].charAt(0))) {
        continue;
      }
      String candidate =
          String.join(" ", List.of(words).subList(start, words.length)) + ", Section " + section;
      if (context.resolve(candidate).isPresent()) {
        return true;
      }
    }
    return false;
  }

  private static final class Tally {
    int checked;
    int passed;
    int droppedCitations;
    final List<CitationMismatch> mismatches = new ArrayList<>();
  }
}
