package dev.regula.retrieval.fulltext;

import dev.regula.query.QuestionLanguage;
import dev.regula.retrieval.Backend;
import dev.regula.retrieval.BackendUnavailableException;
import dev.regula.retrieval.HitCitation;
import dev.regula.retrieval.RetrievalAdapter;
import dev.regula.retrieval.RetrievalHit;
import dev.regula.retrieval.TierQuery;
import java.sql.Date;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Last-resort keyword search over the relational store using PostgreSQL {@code tsvector} columns.
 *
 * <p>Tries a conjunctive query first; when that finds nothing and there is more than one keyword
 * group, retries disjunctively. Hits carry the raw {@code ts_rank} and a {@code ts_headline}
 * snippet as content.
 */
@Component
public class FullTextSearchAdapter implements RetrievalAdapter {

  private static final Logger log = LoggerFactory.getLogger(FullTextSearchAdapter.class);

  private final RegulationSearchRepository repository;

  public FullTextSearchAdapter(RegulationSearchRepository repository) {
    this.repository = repository;
  }

  @Override
  public Backend backend() {
    return Backend.FULL_TEXT;
  }

  @Override
  public List<RetrievalHit> retrieve(TierQuery query) {
    String conjunctive = TsQueryBuilder.allOf(query.keywords());
    if (conjunctive.isEmpty()) {
      log.debug("No searchable keywords for full-text tier");
      return List.of();
    }

    try {
      List<Object[]> rows = search(query.language(), conjunctive, query.limit());
      if (rows.isEmpty() && conjunctive.contains(" & ")) {
        String disjunctive = TsQueryBuilder.anyOf(query.keywords());
        log.debug("Conjunctive tsquery '{}' empty, retrying with '{}'", conjunctive, disjunctive);
        rows = search(query.language(), disjunctive, query.limit());
      }
      List<RetrievalHit> hits = new ArrayList<>(rows.size());
      for (Object[] row : rows) {
        hits.add(toHit(query, row));
      }
      return hits;
    } catch (RuntimeException e) {
      throw new BackendUnavailableException(
          Backend.FULL_TEXT, "Full-text search failed: " + e.getMessage(), e);
    }
  }

  private List<Object[]> search(QuestionLanguage language, String tsquery, int limit) {
    if (language == QuestionLanguage.FR) {
      return repository.searchFrench(tsquery, limit);
    }
    return repository.searchEnglish(tsquery, limit);
  }

  static RetrievalHit toHit(TierQuery query, Object[] row) {
    String id = (String) row[0];
    String documentId = (String) row[1];
    String title = (String) row[2];
    String documentTitle = (String) row[3];
    String section = (String) row[4];
    String snippet = (String) row[5];
    LocalDate effectiveFrom = toLocalDate(row[7]);
    double rank = row[8] == null ? 0.0 : ((Number) row[8]).doubleValue();
    String documentType = (String) row[9];

    return new RetrievalHit(
        id,
        query.tier(),
        rank,
        0.0,
        title,
        snippet,
        new HitCitation(documentId, documentTitle, section),
        documentType,
        effectiveFrom,
        null,
        List.of(),
        null);
  }

  private static @Nullable LocalDate toLocalDate(@Nullable Object value) {
    if (value instanceof LocalDate localDate) {
      return localDate;
    }
    if (value instanceof Date sqlDate) {
      return sqlDate.toLocalDate();
    }
    if (value instanceof String text && !text.isBlank()) {
      return LocalDate.parse(text);
    }
    return null;
  }
}
