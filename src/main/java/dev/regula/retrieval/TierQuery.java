package dev.regula.retrieval;

import dev.regula.query.QueryFilters;
import dev.regula.query.QuestionLanguage;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A backend-neutral request for one tier. Each adapter reads the fields it understands: the hybrid
 * adapter uses text, keywords and filters; the graph adapter uses seed terms, relation types and
 * hop count; the full-text adapter uses keywords and language.
 *
 * @param tier the tier being executed
 * @param queryText free text for semantic search
 * @param keywords keyword terms, possibly synonym-expanded
 * @param filters filters to apply (narrow or relaxed)
 * @param seedTerms graph seed terms
 * @param traversal relationship types the graph adapter may traverse
 * @param maxHops traversal depth bound
 * @param limit maximum number of hits to return
 * @param language question language
 */
public record TierQuery(
    Tier tier,
    String queryText,
    List<String> keywords,
    QueryFilters filters,
    List<String> seedTerms,
    Set<RelationKind> traversal,
    int maxHops,
    int limit,
    QuestionLanguage language) {

  public TierQuery {
    Objects.requireNonNull(tier, "tier");
    Objects.requireNonNull(queryText, "queryText");
    Objects.requireNonNull(filters, "filters");
    Objects.requireNonNull(language, "language");
    keywords = List.copyOf(keywords);
    seedTerms = List.copyOf(seedTerms);
    traversal = Set.copyOf(traversal);
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be positive, got: " + limit);
    }
    if (maxHops < 0) {
      throw new IllegalArgumentException("maxHops must not be negative, got: " + maxHops);
    }
  }
}
