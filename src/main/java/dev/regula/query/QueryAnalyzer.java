package dev.regula.query;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Month;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a raw question into a {@link Question}: normalized text, intent, legal entities,
 * keywords, retrieval filters and language.
 *
 * <p>Analysis is a pure function of the input text and the configured limits. It performs no I/O
 * and holds no mutable state, so a single instance serves all requests.
 */
@Component
public class QueryAnalyzer {

  private static final Logger log = LoggerFactory.getLogger(QueryAnalyzer.class);

  private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS;

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern TRAILING_QUESTION_MARKS = Pattern.compile("[\\s?]+$");
  private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\s.!?;:,]+$");
  private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}][\\p{L}\\p{N}'-]*");

  private static final Pattern LEGISLATION =
      Pattern.compile(
          "((?:[A-Z][\\p{L}'-]*\\s+(?:(?:of|the|and|on|for|to)\\s+)?){1,6}"
              + "(?:Act|Regulations?|Code))\\b");
  private static final Pattern ISO_DATE = Pattern.compile("\\b(\\d{4})-(\\d{2})-(\\d{2})\\b");
  private static final Pattern LONG_DATE =
      Pattern.compile(
          "\\b(January|February|March|April|May|June|July|August|September|October|November"
              + "|December)\\s+(\\d{1,2}),?\\s+(\\d{4})\\b",
          FLAGS);
  private static final Pattern MONEY = Pattern.compile("\\$\\s?\\d[\\d,]*(?:\\.\\d{2})?");
  private static final Pattern REGULATION_MENTION =
      Pattern.compile("\\b(regulations?|règlements?)\\b", FLAGS);
  private static final Pattern ACT_MENTION = Pattern.compile("\\b(act|loi)\\b", FLAGS);

  private static final Pattern STARTS_ELIGIBILITY =
      Pattern.compile("^(can|may|could|am i)\\b", FLAGS);
  private static final Pattern STARTS_DEFINITIONAL = Pattern.compile("^what\\b", FLAGS);
  private static final Pattern STARTS_PROCEDURAL = Pattern.compile("^how\\b", FLAGS);

  private static final List<IntentFamily> INTENT_FAMILIES =
      List.of(
          new IntentFamily(
              QueryIntent.ELIGIBILITY,
              patterns(
                  "\\b(eligible|eligibility|admissible)\\b",
                  "\\bqualif(y|ies|ied|ication)\\b",
                  "\\b(can|may|could)\\b.*\\bapply\\b",
                  "\\b(entitled to|ai-je droit|have the right to)\\b")),
          new IntentFamily(
              QueryIntent.COMPARATIVE,
              patterns(
                  "\\b(compare|comparison|comparing)\\b",
                  "\\bdifferen(ce|t) between\\b|\\bdifférence entre\\b",
                  "\\b(versus|vs)\\b",
                  "\\bwhich is (better|more)\\b")),
          new IntentFamily(
              QueryIntent.PROCEDURAL,
              patterns(
                  "^how\\b|\\bhow (do|can|should|would) (i|we|you|one)\\b|\\bcomment\\b",
                  "\\b(steps?|procedure|process)\\b",
                  "\\bappl(y|ication) for\\b",
                  "\\b(submit|file|register|renew)\\b")),
          new IntentFamily(
              QueryIntent.DEFINITIONAL,
              patterns(
                  "^what (is|are)\\b|\\bqu'est-ce que\\b",
                  "\\b(define|definition|définition)\\b",
                  "\\bmeaning of\\b|\\bwhat does .+ mean\\b",
                  "\\b(who is considered|what counts as)\\b")));

  private static final Set<String> STOP_WORDS =
      Set.of(
          "the", "and", "for", "are", "can", "what", "how", "who", "when", "where", "which",
          "does", "did", "has", "have", "had", "was", "were", "will", "would", "should", "could",
          "may", "might", "must", "shall", "with", "from", "into", "about", "under", "this",
          "that", "these", "those", "there", "their", "they", "them", "you", "your", "our",
          "not", "any", "all", "some", "get", "also", "than", "then", "its", "his", "her",
          "les", "des", "une", "est", "pour", "dans", "que", "qui", "avec", "sur", "par", "pas");

  private static final List<EntityType> DICTIONARY_TYPES =
      List.of(
          EntityType.PERSON_TYPE, EntityType.PROGRAM, EntityType.JURISDICTION,
          EntityType.REQUIREMENT);

  private static final Set<EntityType> TOPIC_TYPES =
      Set.of(
          EntityType.PERSON_TYPE, EntityType.PROGRAM, EntityType.REQUIREMENT,
          EntityType.LEGISLATION);

  private static final Comparator<String> LONGEST_FIRST =
      Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder());

  private static final Map<EntityType, DictionaryMatcher> DICTIONARY_MATCHERS = buildMatchers();

  private final QueryProperties properties;

  public QueryAnalyzer(QueryProperties properties) {
    this.properties = properties;
  }

  /**
   * Analyzes a raw question.
   *
   * @param raw the question text as supplied by the caller
   * @return the analyzed question
   * @throws InvalidQuestionException if the text is null, blank, or longer than the configured
   *     maximum
   */
  public Question analyze(@Nullable String raw) {
    if (raw == null || raw.isBlank()) {
      throw new InvalidQuestionException("Question must not be empty");
    }
    if (raw.length() > properties.getMaxLength()) {
      throw new InvalidQuestionException(
          "Question exceeds the maximum length of " + properties.getMaxLength() + " characters");
    }

    String collapsed = WHITESPACE.matcher(raw.strip()).replaceAll(" ");
    String normalized = TRAILING_QUESTION_MARKS.matcher(collapsed).replaceAll("");
    String bare = TRAILING_PUNCTUATION.matcher(normalized).replaceAll("");
    if (bare.isEmpty()) {
      throw new InvalidQuestionException("Question must contain words, not only punctuation");
    }

    IntentScore intent = classifyIntent(normalized);
    boolean ambiguous = intent.confidence() < properties.getAmbiguityThreshold();
    List<ExtractedEntity> entities = extractEntities(normalized);
    List<String> keywords = extractKeywords(normalized);
    QuestionLanguage language = QuestionLanguage.detect(normalized);
    QueryFilters filters = deriveFilters(normalized, entities, language);
    String topic = topicOf(entities, bare);

    log.debug(
        "Analyzed question: intent={} ({}), entities={}, keywords={}, language={}, ambiguous={}",
        intent.intent(),
        intent.confidence(),
        entities.size(),
        keywords.size(),
        language,
        ambiguous);

    return new Question(
        raw,
        normalized,
        topic,
        intent.intent(),
        intent.confidence(),
        ambiguous,
        keywords,
        entities,
        filters,
        language);
  }

  /**
   * Names what the question is about for the fail-closed sentence: the people, programs,
   * requirements and legislation it mentions ("temporary residents and employment insurance"),
   * or the whole question when none was recognised.
   */
  static String topicOf(List<ExtractedEntity> entities, String fallback) {
    Set<String> seen = new LinkedHashSet<>();
    List<String> parts = new ArrayList<>();
    for (ExtractedEntity entity : entities) {
      if (TOPIC_TYPES.contains(entity.type())
          && seen.add(entity.text().toLowerCase(Locale.ROOT))) {
        parts.add(entity.text());
      }
    }
    if (parts.isEmpty()) {
      return fallback;
    }
    if (parts.size() == 1) {
      return parts.get(0);
    }
    return String.join(", ", parts.subList(0, parts.size() - 1))
        + " and "
        + parts.get(parts.size() - 1);
  }

  static IntentScore classifyIntent(String text) {
    QueryIntent best = QueryIntent.UNKNOWN;
    int bestMatches = 0;
    boolean tied = false;
    for (IntentFamily family : INTENT_FAMILIES) {
      int matches = family.countMatches(text);
      if (matches > bestMatches) {
        best = family.intent();
        bestMatches = matches;
        tied = false;
      } else if (matches > 0 && matches == bestMatches) {
        tied = true;
      }
    }

    if (bestMatches > 0) {
      double confidence = Math.min(0.95, 0.4 + 0.2 * bestMatches);
      if (tied) {
        confidence -= 0.15;
      }
      return new IntentScore(best, confidence);
    }

    String stripped = text.strip();
    if (STARTS_ELIGIBILITY.matcher(stripped).find()) {
      return new IntentScore(QueryIntent.ELIGIBILITY, 0.7);
    }
    if (STARTS_DEFINITIONAL.matcher(stripped).find()) {
      return new IntentScore(QueryIntent.DEFINITIONAL, 0.7);
    }
    if (STARTS_PROCEDURAL.matcher(stripped).find()) {
      return new IntentScore(QueryIntent.PROCEDURAL, 0.7);
    }
    return new IntentScore(QueryIntent.UNKNOWN, 0.3);
  }

  static List<ExtractedEntity> extractEntities(String text) {
    List<ExtractedEntity> candidates = new ArrayList<>();
    for (EntityType type : DICTIONARY_TYPES) {
      DICTIONARY_MATCHERS.get(type).collect(text, candidates);
    }

    Matcher legislation = LEGISLATION.matcher(text);
    while (legislation.find()) {
      String surface = legislation.group(1).strip();
      int start = legislation.start(1);
      candidates.add(
          new ExtractedEntity(
              surface,
              EntityType.LEGISLATION,
              surface.toLowerCase(Locale.ROOT),
              0.8,
              start,
              start + surface.length()));
    }

    Matcher iso = ISO_DATE.matcher(text);
    while (iso.find()) {
      LocalDate date =
          toDate(
              Integer.parseInt(iso.group(1)),
              Integer.parseInt(iso.group(2)),
              Integer.parseInt(iso.group(3)));
      if (date != null) {
        candidates.add(dateEntity(iso, date));
      }
    }

    Matcher longDate = LONG_DATE.matcher(text);
    while (longDate.find()) {
      Month month = Month.valueOf(longDate.group(1).toUpperCase(Locale.ROOT));
      LocalDate date =
          toDate(
              Integer.parseInt(longDate.group(3)),
              month.getValue(),
              Integer.parseInt(longDate.group(2)));
      if (date != null) {
        candidates.add(dateEntity(longDate, date));
      }
    }

    Matcher money = MONEY.matcher(text);
    while (money.find()) {
      String surface = money.group();
      candidates.add(
          new ExtractedEntity(
              surface,
              EntityType.MONEY,
              surface.replaceAll("[$,\\s]", ""),
              0.8,
              money.start(),
              money.end()));
    }

    candidates.sort(
        Comparator.comparingInt(ExtractedEntity::start)
            .thenComparing(
                Comparator.comparingInt((ExtractedEntity e) -> e.end() - e.start()).reversed()));

    List<ExtractedEntity> accepted = new ArrayList<>();
    for (ExtractedEntity candidate : candidates) {
      boolean overlaps = accepted.stream().anyMatch(candidate::overlaps);
      if (!overlaps) {
        accepted.add(candidate);
      }
    }
    return List.copyOf(accepted);
  }

  static List<String> extractKeywords(String text) {
    Set<String> keywords = new LinkedHashSet<>();
    Matcher words = WORD.matcher(text.toLowerCase(Locale.ROOT));
    while (words.find()) {
      String word = words.group();
      if (word.length() >= 3 && !STOP_WORDS.contains(word)) {
        keywords.add(word);
      }
    }
    return List.copyOf(keywords);
  }

  private static QueryFilters deriveFilters(
      String text, List<ExtractedEntity> entities, QuestionLanguage language) {
    String jurisdiction =
        entities.stream()
            .filter(e -> e.type() == EntityType.JURISDICTION)
            .map(ExtractedEntity::normalized)
            .findFirst()
            .orElse(null);

    List<LocalDate> dates =
        entities.stream()
            .filter(e -> e.type() == EntityType.DATE)
            .map(e -> LocalDate.parse(e.normalized()))
            .sorted()
            .toList();
    LocalDate effectiveFrom = null;
    LocalDate effectiveTo = null;
    if (dates.size() == 1) {
      // A single date asks what was in force at that point.
      effectiveTo = dates.get(0);
    } else if (dates.size() > 1) {
      effectiveFrom = dates.get(0);
      effectiveTo = dates.get(dates.size() - 1);
    }

    String documentType = null;
    if (REGULATION_MENTION.matcher(text).find()) {
      documentType = "regulation";
    } else if (ACT_MENTION.matcher(text).find()) {
      documentType = "act";
    }

    return new QueryFilters(jurisdiction, language, effectiveFrom, effectiveTo, documentType);
  }

  private static ExtractedEntity dateEntity(Matcher matcher, LocalDate date) {
    return new ExtractedEntity(
        matcher.group(), EntityType.DATE, date.toString(), 0.8, matcher.start(), matcher.end());
  }

  private static @Nullable LocalDate toDate(int year, int month, int day) {
    try {
      return LocalDate.of(year, month, day);
    } catch (DateTimeException e) {
      log.debug("Ignoring impossible date {}-{}-{}", year, month, day);
      return null;
    }
  }

  private static List<Pattern> patterns(String... regexes) {
    List<Pattern> compiled = new ArrayList<>();
    for (String regex : regexes) {
      compiled.add(Pattern.compile(regex, FLAGS));
    }
    return List.copyOf(compiled);
  }

  private static Map<EntityType, DictionaryMatcher> buildMatchers() {
    Map<EntityType, DictionaryMatcher> matchers = new EnumMap<>(EntityType.class);
    for (EntityType type : DICTIONARY_TYPES) {
      matchers.put(type, DictionaryMatcher.of(type, LegalTerminology.dictionary(type)));
    }
    return matchers;
  }

  record IntentScore(QueryIntent intent, double confidence) {}

  private record IntentFamily(QueryIntent intent, List<Pattern> patterns) {

    int countMatches(String text) {
      int matches = 0;
      for (Pattern pattern : patterns) {
        if (pattern.matcher(text).find()) {
          matches++;
        }
      }
      return matches;
    }
  }

  /** One alternation pattern per entity type, longest surface form first. */
  private record DictionaryMatcher(
      EntityType type, Pattern pattern, Map<String, String> keysBySurface) {

    static DictionaryMatcher of(EntityType type, Map<String, List<String>> dictionary) {
      Map<String, String> keysBySurface = new HashMap<>();
      dictionary.forEach(
          (key, surfaces) ->
              surfaces.forEach(s -> keysBySurface.putIfAbsent(s.toLowerCase(Locale.ROOT), key)));
      String alternation =
          keysBySurface.keySet().stream()
              .sorted(LONGEST_FIRST)
              .map(Pattern::quote)
              .reduce((a, b) -> a + "|" + b)
              .orElse("(?!)");
      Pattern pattern =
          Pattern.compile("(?<![\\p{L}\\p{N}])(" + alternation + ")(?![\\p{L}\\p{N}])", FLAGS);
      return new DictionaryMatcher(type, pattern, Map.copyOf(keysBySurface));
    }

    void collect(String text, List<ExtractedEntity> sink) {
      Matcher matcher = pattern.matcher(text);
      while (matcher.find()) {
        String surface = matcher.group(1);
        String key = keysBySurface.get(surface.toLowerCase(Locale.ROOT));
        if (key != null) {
          sink.add(new ExtractedEntity(surface, type, key, 0.9, matcher.start(1), matcher.end(1)));
        }
      }
    }
  }
}
