package dev.regula.fusion;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The bounded, ordered evidence handed to the generator. Entries are unique by document and
 * section, ordered by relevance, and their total content fits the configured budget.
 *
 * @param entries ordered context entries
 * @param droppedForBudget hits that ranked below the budget cut-off
 * @param duplicatesMerged hits folded into an existing entry
 */
public record FusedContext(
    List<ContextEntry> entries, int droppedForBudget, int duplicatesMerged) {

  private static final Pattern REFERENCE =
      Pattern.compile("^\\[?\\s*(R\\d+)\\s*]?$", Pattern.CASE_INSENSITIVE);
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  public FusedContext {
    entries = List.copyOf(entries);
  }

  public static FusedContext empty() {
    return new FusedContext(List.of(), 0, 0);
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public int size() {
    return entries.size();
  }

  public int totalContentSize() {
    return entries.stream().mapToInt(ContextEntry::contentSize).sum();
  }

  public double maxNormalizedScore() {
    return entries.stream().mapToDouble(e -> e.hit().normalizedScore()).max().orElse(0.0);
  }

  /**
   * Resolves a citation to a context entry, either by reference id ({@code R3}, {@code [R3]}) or
   * by citation label ({@code "<title>, Section <id>"}), ignoring case and whitespace.
   */
  public Optional<ContextEntry> resolve(String citation) {
    if (citation == null || citation.isBlank()) {
      return Optional.empty();
    }
    String trimmed = citation.strip();
    Matcher reference = REFERENCE.matcher(trimmed);
    if (reference.matches()) {
      String id = reference.group(1).toUpperCase(Locale.ROOT);
      return entries.stream().filter(e -> e.referenceId().equals(id)).findFirst();
    }
    String wanted = normalize(trimmed);
    return entries.stream()
        .filter(e -> normalize(e.label()).equals(wanted) || matchesTitleAndSection(e, wanted))
        .findFirst();
  }

  private static boolean matchesTitleAndSection(ContextEntry entry, String wanted) {
    String title = normalize(entry.hit().citation().documentTitle());
    String section = entry.hit().citation().sectionId();
    if (section == null) {
      return wanted.equals(title);
    }
    String sectionKey = normalize(section);
    return wanted.startsWith(title) && wanted.endsWith(" " + sectionKey);
  }

  static String normalize(String text) {
    String lower = text.toLowerCase(Locale.ROOT).replace(',', ' ');
    return WHITESPACE.matcher(lower).replaceAll(" ").strip();
  }
}
