package dev.regula.retrieval.hybrid;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.filter.Filter;
import dev.regula.query.QueryFilters;
import dev.regula.retrieval.Backend;
import dev.regula.retrieval.BackendUnavailableException;
import dev.regula.retrieval.RetrievalAdapter;
import dev.regula.retrieval.RetrievalHit;
import dev.regula.retrieval.TierQuery;
import dev.regula.retrieval.fulltext.TsQueryBuilder;
import dev.regula.retrieval.hybrid.ConvexCombinationFusion.FusedCandidate;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Hybrid search over {@code regulation_passages}: pgvector similarity and PostgreSQL full-text
 * rank over the same rows, fused by {@link ConvexCombinationFusion}.
 *
 * <p>Pipeline: embed query text with the BGE query prefix -> vector search with metadata filter ->
 * keyword search with the same filters -> convex combination -> drop passages that expired before
 * the requested window -> top {@code limit}.
 */
@Component
public class HybridSearchAdapter implements RetrievalAdapter {

  private static final Logger log = LoggerFactory.getLogger(HybridSearchAdapter.class);

  /**
   * BGE query prefix recommended by the bge-small-en-v1.5 model documentation. Prepended to search
   * queries only, never to indexed passages.
   */
  static final String BGE_QUERY_PREFIX =
      "Represent this sentence for searching relevant passages: ";

  private final EmbeddingStore<TextSegment> embeddingStore;
  private final EmbeddingModel embeddingModel;
  private final PassageChunkRepository passageChunkRepository;
  private final HybridSearchProperties properties;
  private final ObjectMapper objectMapper;

  public HybridSearchAdapter(
      EmbeddingStore<TextSegment> embeddingStore,
      EmbeddingModel embeddingModel,
      PassageChunkRepository passageChunkRepository,
      HybridSearchProperties properties,
      ObjectMapper objectMapper) {
    this.embeddingStore = embeddingStore;
    this.embeddingModel = embeddingModel;
    this.passageChunkRepository = passageChunkRepository;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public Backend backend() {
    return Backend.HYBRID;
  }

  @Override
  public List<RetrievalHit> retrieve(TierQuery query) {
    List<ScoredCandidate> vectorResults;
    List<ScoredCandidate> keywordResults;
    try {
      vectorResults = vectorSearch(query);
      keywordResults = keywordSearch(query);
    } catch (RuntimeException e) {
      throw new BackendUnavailableException(
          Backend.HYBRID, "Hybrid search failed: " + e.getMessage(), e);
    }

    List<FusedCandidate> fused =
        ConvexCombinationFusion.fuse(
            vectorResults,
            keywordResults,
            properties.getAlpha(),
            properties.getKeywordHalfRank(),
            properties.getCandidates());

    LocalDate windowStart = query.filters().effectiveFrom();
    List<RetrievalHit> hits = new ArrayList<>();
    for (FusedCandidate candidate : fused) {
      RetrievalHit hit =
          PassageMetadata.toHit(
              candidate.passageId(),
              candidate.segment(),
              candidate.combinedScore(),
              candidate.breakdown(),
              query.tier());
      if (windowStart != null
          && hit.effectiveTo() != null
          && hit.effectiveTo().isBefore(windowStart)) {
        continue;
      }
      hits.add(hit);
      if (hits.size() == query.limit()) {
        break;
      }
    }

    log.debug(
        "Hybrid {}: {} vector + {} keyword candidates -> {} hits",
        query.tier(),
        vectorResults.size(),
        keywordResults.size(),
        hits.size());
    return hits;
  }

  private List<ScoredCandidate> vectorSearch(TierQuery query) {
    Embedding queryEmbedding = embeddingModel.embed(BGE_QUERY_PREFIX + query.queryText()).content();

    EmbeddingSearchRequest.EmbeddingSearchRequestBuilder builder =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(queryEmbedding)
            .maxResults(properties.getCandidates())
            .minScore(properties.getMinVectorScore());

    Filter filter = buildFilter(query.filters());
    if (filter != null) {
      builder.filter(filter);
    }

    List<ScoredCandidate> candidates = new ArrayList<>();
    for (EmbeddingMatch<TextSegment> match : embeddingStore.search(builder.build()).matches()) {
      if (match.embedded() != null) {
        candidates.add(new ScoredCandidate(match.embeddingId(), match.embedded(), match.score()));
      }
    }
    return candidates;
  }

  private List<ScoredCandidate> keywordSearch(TierQuery query) {
    String tsquery = TsQueryBuilder.anyOf(query.keywords());
    if (tsquery.isEmpty()) {
      return List.of();
    }
    QueryFilters filters = query.filters();
    List<Object[]> rows =
        passageChunkRepository.fullTextSearch(
            tsquery,
            query.language().textSearchConfig(),
            filters.jurisdiction(),
            filters.language() == null ? null : filters.language().code(),
            filters.documentType(),
            filters.effectiveTo() == null ? null : filters.effectiveTo().toString(),
            properties.getCandidates());

    List<ScoredCandidate> candidates = new ArrayList<>(rows.size());
    for (Object[] row : rows) {
      String passageId = (String) row[0];
      String text = (String) row[1];
      TextSegment segment =
          TextSegment.from(text, PassageMetadata.fromJson(objectMapper, (String) row[2]));
      double rank = row[3] == null ? 0.0 : ((Number) row[3]).doubleValue();
      candidates.add(new ScoredCandidate(passageId, segment, rank));
    }
    return candidates;
  }

  /**
   * Builds the metadata filter for the vector side. Multiple filters are combined with AND logic.
   *
   * @return combined filter, or null if no filter applies
   */
  @Nullable Filter buildFilter(QueryFilters filters) {
    List<Filter> parts = new ArrayList<>();

    if (filters.jurisdiction() != null) {
      parts.add(metadataKey(PassageMetadata.JURISDICTION).isEqualTo(filters.jurisdiction()));
    }
    if (filters.language() != null) {
      parts.add(metadataKey(PassageMetadata.LANGUAGE).isEqualTo(filters.language().code()));
    }
    if (filters.documentType() != null) {
      parts.add(metadataKey(PassageMetadata.DOCUMENT_TYPE).isEqualTo(filters.documentType()));
    }
    if (filters.effectiveTo() != null) {
      parts.add(
          metadataKey(PassageMetadata.EFFECTIVE_FROM)
              .isLessThanOrEqualTo(filters.effectiveTo().toString()));
    }

    return parts.stream().reduce((a, b) -> a.and(b)).orElse(null);
  }
}
