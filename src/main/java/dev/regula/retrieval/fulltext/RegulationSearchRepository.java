package dev.regula.retrieval.fulltext;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

/**
 * Ranked full-text search over regulations and their sections.
 *
 * <p>Each row is {@code [id, document_id, title, document_title, section_number, snippet,
 * jurisdiction, effective_date, rank, document_type]}. The tsquery argument must already be a
 * valid {@code to_tsquery} expression; see {@link TsQueryBuilder}.
 */
public interface RegulationSearchRepository extends Repository<Regulation, UUID> {

  @Query(
      value =
          """
            SELECT id, document_id, title, document_title, section_number, snippet,
                   jurisdiction, effective_date, rank, document_type
            FROM (
              SELECT CAST(r.id AS text) AS id,
                     CAST(r.id AS text) AS document_id,
                     r.title AS title,
                     r.title AS document_title,
                     CAST(NULL AS text) AS section_number,
                     ts_headline('english', coalesce(r.full_text, ''),
                                 to_tsquery('english', :tsquery),
                                 'MaxWords=60, MinWords=20') AS snippet,
                     r.jurisdiction AS jurisdiction,
                     r.effective_date AS effective_date,
                     ts_rank(r.search_vector, to_tsquery('english', :tsquery)) AS rank,
                     'regulation' AS document_type
              FROM regulations r
              WHERE r.search_vector @@ to_tsquery('english', :tsquery)
                AND coalesce(r.status, 'active') = 'active'
              UNION ALL
              SELECT CAST(s.id AS text),
                     CAST(r.id AS text),
                     coalesce(s.title, r.title),
                     r.title,
                     s.section_number,
                     ts_headline('english', coalesce(s.content, ''),
                                 to_tsquery('english', :tsquery), 'MaxWords=60, MinWords=20'),
                     r.jurisdiction,
                     r.effective_date,
                     ts_rank(s.search_vector, to_tsquery('english', :tsquery)),
                     'section'
              FROM sections s
              JOIN regulations r ON r.id = s.regulation_id
              WHERE s.search_vector @@ to_tsquery('english', :tsquery)
                AND coalesce(r.status, 'active') = 'active'
            ) hits
            ORDER BY rank DESC, id
            LIMIT :limit
            """,
      nativeQuery = true)
  List<Object[]> searchEnglish(@Param("tsquery") String tsquery, @Param("limit") int limit);

  @Query(
      value =
          """
            SELECT id, document_id, title, document_title, section_number, snippet,
                   jurisdiction, effective_date, rank, document_type
            FROM (
              SELECT CAST(r.id AS text) AS id,
                     CAST(r.id AS text) AS document_id,
                     r.title AS title,
                     r.title AS document_title,
                     CAST(NULL AS text) AS section_number,
                     ts_headline('french', coalesce(r.full_text, ''),
                                 to_tsquery('french', :tsquery),
                                 'MaxWords=60, MinWords=20') AS snippet,
                     r.jurisdiction AS jurisdiction,
                     r.effective_date AS effective_date,
                     ts_rank(r.search_vector_fr, to_tsquery('french', :tsquery)) AS rank,
                     'regulation' AS document_type
              FROM regulations r
              WHERE r.search_vector_fr @@ to_tsquery('french', :tsquery)
                AND coalesce(r.status, 'active') = 'active'
              UNION ALL
              SELECT CAST(s.id AS text),
                     CAST(r.id AS text),
                     coalesce(s.title, r.title),
                     r.title,
                     s.section_number,
                     ts_headline('french', coalesce(s.content, ''),
                                 to_tsquery('french', :tsquery), 'MaxWords=60, MinWords=20'),
                     r.jurisdiction,
                     r.effective_date,
                     ts_rank(s.search_vector_fr, to_tsquery('french', :tsquery)),
                     'section'
              FROM sections s
              JOIN regulations r ON r.id = s.regulation_id
              WHERE s.search_vector_fr @@ to_tsquery('french', :tsquery)
                AND coalesce(r.status, 'active') = 'active'
            ) hits
            ORDER BY rank DESC, id
            LIMIT :limit
            """,
      nativeQuery = true)
  List<Object[]> searchFrench(@Param("tsquery") String tsquery, @Param("limit") int limit);
}
