package dev.regula.retrieval.fulltext;

import static org.assertj.core.api.Assertions.assertThat;

import dev.regula.BaseIntegrationTest;
import dev.regula.query.QuestionLanguage;
import dev.regula.retrieval.RetrievalHit;
import dev.regula.retrieval.TierQueries;
import dev.regula.retrieval.TierQuery;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class FullTextSearchAdapterIT extends BaseIntegrationTest {

  static final String EI_ACT = "11111111-1111-1111-1111-111111111111";
  static final String IRPR = "22222222-2222-2222-2222-222222222222";
  static final String REPEALED_ACT = "33333333-3333-3333-3333-333333333333";

  @Autowired FullTextSearchAdapter adapter;

  private static TierQuery english(String... keywords) {
    return TierQueries.fullText(List.of(keywords), QuestionLanguage.EN);
  }

  @Test
  void conjunctive_query_finds_matching_sections_with_citations() {
    List<RetrievalHit> hits = adapter.retrieve(english("insurable", "employment"));

    assertThat(hits).isNotEmpty();
    assertThat(hits)
        .anySatisfy(
            hit -> {
              assertThat(hit.documentId()).isEqualTo(EI_ACT);
              assertThat(hit.citation().sectionId()).isEqualTo("7");
              assertThat(hit.citation().label())
                  .isEqualTo("Employment Insurance Act, Section 7");
              assertThat(hit.documentType()).isEqualTo("section");
              assertThat(hit.effectiveFrom()).isEqualTo(LocalDate.of(1996, 6, 30));
              assertThat(hit.content()).containsIgnoringCase("insurable");
            });
    assertThat(hits).allSatisfy(hit -> assertThat(hit.rawScore()).isPositive());
  }

  @Test
  void hits_are_ordered_by_rank() {
    List<RetrievalHit> hits = adapter.retrieve(english("insurable", "employment"));

    assertThat(hits)
        .extracting(RetrievalHit::rawScore)
        .isSortedAccordingTo((a, b) -> Double.compare(b, a));
  }

  @Test
  void repealed_documents_are_never_returned() {
    List<RetrievalHit> hits = adapter.retrieve(english("unemployment"));

    assertThat(hits).isEmpty();
  }

  @Test
  void falls_back_to_any_keyword_when_no_row_matches_all() {
    List<RetrievalHit> hits = adapter.retrieve(english("work permit", "interruption"));

    assertThat(hits)
        .extracting(RetrievalHit::documentId)
        .contains(EI_ACT, IRPR)
        .doesNotContain(REPEALED_ACT);
  }

  @Test
  void french_questions_search_the_french_vectors() {
    List<RetrievalHit> hits =
        adapter.retrieve(TierQueries.fullText(List.of("prestataire"), QuestionLanguage.FR));

    assertThat(hits)
        .singleElement()
        .satisfies(
            hit -> {
              assertThat(hit.citation().documentTitle()).isEqualTo("Loi sur l'assurance-emploi");
              assertThat(hit.citation().sectionId()).isEqualTo("7");
            });
  }

  @Test
  void keywords_without_searchable_words_return_nothing() {
    List<RetrievalHit> hits = adapter.retrieve(english("&", "!"));

    assertThat(hits).isEmpty();
  }
}
