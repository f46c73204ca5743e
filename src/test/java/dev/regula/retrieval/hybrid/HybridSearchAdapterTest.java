package dev.regula.retrieval.hybrid;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingSearchResult;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.filter.comparison.IsEqualTo;
import dev.langchain4j.store.embedding.filter.logical.And;
import dev.regula.query.QueryFilters;
import dev.regula.query.QuestionLanguage;
import dev.regula.retrieval.BackendUnavailableException;
import dev.regula.retrieval.RelationKind;
import dev.regula.retrieval.RetrievalHit;
import dev.regula.retrieval.TierQueries;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@SuppressWarnings("NullAway.Init")
@ExtendWith(MockitoExtension.class)
class HybridSearchAdapterTest {

  @Mock EmbeddingStore<TextSegment> embeddingStore;

  @Mock EmbeddingModel embeddingModel;

  @Mock PassageChunkRepository passageChunkRepository;

  @Captor ArgumentCaptor<EmbeddingSearchRequest> searchRequestCaptor;

  HybridSearchAdapter adapter;

  private static final Embedding DUMMY_EMBEDDING = Embedding.from(new float[] {0.1f, 0.2f, 0.3f});

  private static final String EI_METADATA =
      "{\"document_id\":\"ei-act\",\"document_title\":\"Employment Insurance Act\","
          + "\"section_id\":\"7\",\"document_type\":\"act\",\"jurisdiction\":\"federal\","
          + "\"language\":\"en\",\"effective_from\":\"1996-06-30\"}";

  @BeforeEach
  void setUp() {
    HybridSearchProperties props = new HybridSearchProperties();
    props.setAlpha(0.7);
    props.setCandidates(30);
    props.setKeywordHalfRank(0.1);
    adapter =
        new HybridSearchAdapter(
            embeddingStore, embeddingModel, passageChunkRepository, props, new ObjectMapper());
  }

  private void stubEmbeddingModel(String text) {
    when(embeddingModel.embed(HybridSearchAdapter.BGE_QUERY_PREFIX + text))
        .thenReturn(Response.from(DUMMY_EMBEDDING));
  }

  private void stubVectorMatches(List<EmbeddingMatch<TextSegment>> matches) {
    when(embeddingStore.search(any(EmbeddingSearchRequest.class)))
        .thenReturn(new EmbeddingSearchResult<>(matches));
  }

  private static EmbeddingMatch<TextSegment> match(String id, double score, Metadata metadata) {
    return new EmbeddingMatch<>(
        score, id, DUMMY_EMBEDDING, TextSegment.from("passage " + id, metadata));
  }

  @Test
  void vector_and_keyword_candidates_are_fused_into_hits() {
    stubEmbeddingModel("insurable hours");
    stubVectorMatches(
        List.of(
            match(
                "p1",
                0.9,
                Metadata.from(
                    Map.of(
                        "document_id", "ei-regs",
                        "document_title", "Employment Insurance Regulations",
                        "section_id", "14",
                        "relations", "AMENDS:ei-act")))));
    when(passageChunkRepository.fullTextSearch(
            any(), any(), any(), any(), any(), any(), anyInt()))
        .thenReturn(
            List.<Object[]>of(new Object[] {"p2", "Section 7 text", EI_METADATA, 0.1f}));

    List<RetrievalHit> hits =
        adapter.retrieve(
            TierQueries.hybrid(
                "insurable hours", List.of("insurable", "hours"), QueryFilters.none()));

    assertThat(hits).extracting(RetrievalHit::id).containsExactly("p1", "p2");
    RetrievalHit vectorHit = hits.get(0);
    assertThat(vectorHit.rawScore()).isCloseTo(0.63, within(1e-6));
    assertThat(vectorHit.citation().label())
        .isEqualTo("Employment Insurance Regulations, Section 14");
    assertThat(vectorHit.relatesTo(RelationKind.AMENDS, "ei-act")).isTrue();

    RetrievalHit keywordHit = hits.get(1);
    assertThat(keywordHit.documentId()).isEqualTo("ei-act");
    assertThat(keywordHit.effectiveFrom()).isEqualTo(LocalDate.of(1996, 6, 30));
    assertThat(keywordHit.breakdown().vector()).isZero();
  }

  @Test
  void query_text_is_embedded_with_bge_prefix() {
    stubEmbeddingModel("pension splitting");
    stubVectorMatches(List.of());

    adapter.retrieve(TierQueries.hybrid("pension splitting", List.of(), QueryFilters.none()));

    verify(embeddingModel).embed(HybridSearchAdapter.BGE_QUERY_PREFIX + "pension splitting");
    verify(embeddingStore).search(searchRequestCaptor.capture());
    assertThat(searchRequestCaptor.getValue().maxResults()).isEqualTo(30);
    assertThat(searchRequestCaptor.getValue().filter()).isNull();
  }

  @Test
  void keyword_side_is_skipped_without_keywords() {
    stubEmbeddingModel("pension");
    stubVectorMatches(List.of());

    List<RetrievalHit> hits =
        adapter.retrieve(TierQueries.hybrid("pension", List.of(), QueryFilters.none()));

    assertThat(hits).isEmpty();
    verifyNoInteractions(passageChunkRepository);
  }

  @Test
  void passages_expired_before_the_window_start_are_dropped() {
    stubEmbeddingModel("rates");
    stubVectorMatches(
        List.of(
            match("old", 0.95, Metadata.from("effective_to", "2010-12-31")),
            match("current", 0.8, Metadata.from("effective_from", "2011-01-01"))));
    QueryFilters window =
        new QueryFilters(null, null, LocalDate.of(2015, 1, 1), LocalDate.of(2020, 1, 1), null);

    List<RetrievalHit> hits = adapter.retrieve(TierQueries.hybrid("rates", List.of(), window));

    assertThat(hits).extracting(RetrievalHit::id).containsExactly("current");
  }

  @Test
  void store_failure_surfaces_as_backend_unavailable() {
    stubEmbeddingModel("pension");
    when(embeddingStore.search(any(EmbeddingSearchRequest.class)))
        .thenThrow(new IllegalStateException("connection refused"));

    assertThatThrownBy(
            () -> adapter.retrieve(TierQueries.hybrid("pension", List.of(), QueryFilters.none())))
        .isInstanceOf(BackendUnavailableException.class)
        .hasMessageContaining("connection refused");
  }

  @Test
  void no_filters_build_no_metadata_filter() {
    assertThat(adapter.buildFilter(QueryFilters.none())).isNull();
  }

  @Test
  void single_filter_is_an_equality_check() {
    assertThat(adapter.buildFilter(new QueryFilters("ontario", null, null, null, null)))
        .isInstanceOf(IsEqualTo.class);
  }

  @Test
  void several_filters_are_combined_with_and() {
    QueryFilters filters =
        new QueryFilters("federal", QuestionLanguage.EN, null, LocalDate.of(2020, 1, 1), "act");

    assertThat(adapter.buildFilter(filters)).isInstanceOf(And.class);
  }
}
