package dev.regula.retrieval.hybrid;

import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

/** Keyword side of the hybrid search over {@link PassageChunk} rows. */
public interface PassageChunkRepository extends Repository<PassageChunk, UUID> {

  /**
   * Ranks passages against a {@code to_tsquery} expression, applying the same metadata filters as
   * the vector side. A {@code null} filter argument disables that filter.
   *
   * @param tsquery a valid {@code to_tsquery} expression
   * @param tsConfig text search configuration, {@code english} or {@code french}
   * @param jurisdiction jurisdiction key
   * @param language ISO language code
   * @param documentType document type tag
   * @param effectiveOnOrBefore ISO date; passages effective after it are excluded
   * @param limit maximum rows
   * @return rows of {@code [embedding_id, text, metadata_json, rank]}
   */
  @Query(
      value =
          """
            SELECT CAST(p.embedding_id AS text) AS embedding_id,
                   p.text AS text,
                   CAST(p.metadata AS text) AS metadata,
                   ts_rank(to_tsvector(CAST(:tsConfig AS regconfig), p.text),
                           to_tsquery(CAST(:tsConfig AS regconfig), :tsquery)) AS rank
            FROM regulation_passages p
            WHERE to_tsvector(CAST(:tsConfig AS regconfig), p.text)
                  @@ to_tsquery(CAST(:tsConfig AS regconfig), :tsquery)
              AND (CAST(:jurisdiction AS text) IS NULL
                   OR p.metadata->>'jurisdiction' = CAST(:jurisdiction AS text))
              AND (CAST(:language AS text) IS NULL
                   OR p.metadata->>'language' = CAST(:language AS text))
              AND (CAST(:documentType AS text) IS NULL
                   OR p.metadata->>'document_type' = CAST(:documentType AS text))
              AND (CAST(:effectiveOnOrBefore AS text) IS NULL
                   OR p.metadata->>'effective_from' <= CAST(:effectiveOnOrBefore AS text))
            ORDER BY rank DESC, embedding_id
            LIMIT :limit
            """,
      nativeQuery = true)
  List<Object[]> fullTextSearch(
      @Param("tsquery") String tsquery,
      @Param("tsConfig") String tsConfig,
      @Param("jurisdiction") @Nullable String jurisdiction,
      @Param("language") @Nullable String language,
      @Param("documentType") @Nullable String documentType,
      @Param("effectiveOnOrBefore") @Nullable String effectiveOnOrBefore,
      @Param("limit") int limit);
}
