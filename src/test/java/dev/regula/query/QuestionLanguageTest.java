package dev.regula.query;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class QuestionLanguageTest {

  @Test
  void english_is_the_default() {
    assertThat(QuestionLanguage.detect("")).isEqualTo(QuestionLanguage.EN);
    assertThat(QuestionLanguage.detect("pension")).isEqualTo(QuestionLanguage.EN);
  }

  @Test
  void french_markers_outweighing_english_ones_select_french() {
    assertThat(QuestionLanguage.detect("Quelles sont les conditions pour la pension?"))
        .isEqualTo(QuestionLanguage.FR);
  }

  @Test
  void single_accented_word_in_english_text_stays_english() {
    assertThat(QuestionLanguage.detect("What is the Québec pension plan for seniors?"))
        .isEqualTo(QuestionLanguage.EN);
  }

  @Test
  void language_maps_to_text_search_configuration() {
    assertThat(QuestionLanguage.FR.textSearchConfig()).isEqualTo("french");
    assertThat(QuestionLanguage.EN.code()).isEqualTo("en");
  }
}
