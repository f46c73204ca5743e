package dev.regula.retrieval.hybrid;

import static org.assertj.core.api.Assertions.assertThat;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.regula.BaseIntegrationTest;
import dev.regula.query.QueryFilters;
import dev.regula.retrieval.RetrievalHit;
import dev.regula.retrieval.TierQueries;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class HybridSearchAdapterIT extends BaseIntegrationTest {

  @Autowired HybridSearchAdapter adapter;

  @Autowired EmbeddingStore<TextSegment> embeddingStore;

  @Autowired EmbeddingModel embeddingModel;

  // --- Test passages ---

  static final String IRPR_TITLE = "Immigration and Refugee Protection Regulations";

  static final String EI_QUALIFICATION =
      "An insured person qualifies for employment insurance benefits if the person has had an "
          + "interruption of earnings and the required hours of insurable employment.";

  static final String IRPR_WORK_PERMIT =
      "An officer shall issue a work permit to a foreign national who applied for it as a "
          + "temporary resident and meets the requirements of this Part.";

  static final String ONTARIO_TENANCY =
      "A landlord shall not charge a rent deposit greater than the rent for one rent period.";

  static final String REPEALED_UI =
      "Unemployment insurance benefits were payable to insured persons after eight weeks of "
          + "insurable employment.";

  @BeforeEach
  void seedPassages() {
    embeddingStore.removeAll();

    seed(EI_QUALIFICATION, passage("ei-act", "Employment Insurance Act", "7", "federal", "act"));
    seed(
        IRPR_WORK_PERMIT,
        passage("irpr", IRPR_TITLE, "200", "federal", "regulation")
            .put(PassageMetadata.EFFECTIVE_FROM, "2002-06-28"));
    seed(ONTARIO_TENANCY, passage("rta", "Residential Tenancies Act", "105", "ontario", "act"));
    seed(
        REPEALED_UI,
        passage("ui-act", "Unemployment Insurance Act", "17", "federal", "act")
            .put(PassageMetadata.EFFECTIVE_TO, "1996-06-29"));
  }

  private static Metadata passage(
      String documentId, String title, String section, String jurisdiction, String type) {
    return Metadata.from(PassageMetadata.DOCUMENT_ID, documentId)
        .put(PassageMetadata.DOCUMENT_TITLE, title)
        .put(PassageMetadata.SECTION_ID, section)
        .put(PassageMetadata.JURISDICTION, jurisdiction)
        .put(PassageMetadata.LANGUAGE, "en")
        .put(PassageMetadata.DOCUMENT_TYPE, type);
  }

  private void seed(String text, Metadata metadata) {
    TextSegment segment = TextSegment.from(text, metadata);
    Embedding embedding = embeddingModel.embed(segment).content();
    embeddingStore.add(embedding, segment);
  }

  @Test
  void semantic_and_keyword_signals_rank_the_relevant_passage_first() {
    List<RetrievalHit> hits =
        adapter.retrieve(
            TierQueries.hybrid(
                "Can temporary residents receive employment insurance benefits",
                List.of("employment insurance", "temporary resident"),
                QueryFilters.none()));

    assertThat(hits).isNotEmpty();
    assertThat(hits.get(0).documentId()).isIn("ei-act", "irpr");
    assertThat(hits).extracting(RetrievalHit::documentId).contains("ei-act");
    // no keyword match and the weakest semantic match
    assertThat(hits.get(hits.size() - 1).documentId()).isEqualTo("rta");
    assertThat(hits.get(0).breakdown()).isNotNull();
  }

  @Test
  void hits_carry_citation_metadata() {
    List<RetrievalHit> hits =
        adapter.retrieve(
            TierQueries.hybrid(
                "work permit for a foreign national", List.of("work permit"), QueryFilters.none()));

    assertThat(hits.get(0).citation().label())
        .isEqualTo(IRPR_TITLE + ", Section 200");
    assertThat(hits.get(0).documentType()).isEqualTo("regulation");
    assertThat(hits.get(0).effectiveFrom()).isEqualTo(LocalDate.of(2002, 6, 28));
  }

  @Test
  void jurisdiction_filter_excludes_other_jurisdictions() {
    QueryFilters ontarioOnly = new QueryFilters("ontario", null, null, null, null);

    List<RetrievalHit> hits =
        adapter.retrieve(
            TierQueries.hybrid("rent deposit rules", List.of("rent deposit"), ontarioOnly));

    assertThat(hits).extracting(RetrievalHit::documentId).containsOnly("rta");
  }

  @Test
  void passages_expired_before_the_window_are_dropped() {
    QueryFilters currentWindow = new QueryFilters(null, null, LocalDate.of(2020, 1, 1), null, null);

    List<RetrievalHit> hits =
        adapter.retrieve(
            TierQueries.hybrid(
                "insurance benefits for insured persons",
                List.of("insurable employment"),
                currentWindow));

    assertThat(hits).extracting(RetrievalHit::documentId).doesNotContain("ui-act");
  }
}
