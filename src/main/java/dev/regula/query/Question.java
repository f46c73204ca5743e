package dev.regula.query;

import java.util.List;
import java.util.Objects;

/**
 * An analyzed question. Created once per request by {@link QueryAnalyzer} and never mutated.
 *
 * @param raw the text exactly as the caller supplied it
 * @param normalized whitespace-collapsed text without a trailing question mark
 * @param topic the recognised subjects of the question, or the normalized text without trailing
 *     punctuation when none was recognised; used in fail-closed answers
 * @param intent classified intent
 * @param intentConfidence confidence of the intent classification in [0, 1]
 * @param ambiguous whether the intent confidence fell below the ambiguity threshold
 * @param keywords ordered, de-duplicated content words
 * @param entities recognised legal entities in order of appearance
 * @param filters structured filters for the narrow retrieval tier
 * @param language detected question language
 */
public record Question(
        String raw,
        String normalized,
        String topic,
        QueryIntent intent,
        double intentConfidence,
        boolean ambiguous,
        List<String> keywords,
        List<ExtractedEntity> entities,
        QueryFilters filters,
        QuestionLanguage language) {

    public Question {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(normalized, "normalized");
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(intent, "intent");
        Objects.requireNonNull(filters, "filters");
        Objects.requireNonNull(language, "language");
        keywords = List.copyOf(keywords);
        entities = List.copyOf(entities);
    }

    public List<ExtractedEntity> entitiesOf(EntityType type) {
        return entities.stream().filter(e -> e.type() == type).toList();
    }
}
