package dev.regula.retrieval.hybrid;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import dev.regula.retrieval.HitCitation;
import dev.regula.retrieval.Relationship;
import dev.regula.retrieval.RetrievalHit;
import dev.regula.retrieval.ScoreBreakdown;
import dev.regula.retrieval.Tier;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metadata keys stored with each passage and the mapping from a stored passage to a {@link
 * RetrievalHit}.
 */
final class PassageMetadata {

  private static final Logger log = LoggerFactory.getLogger(PassageMetadata.class);

  static final String DOCUMENT_ID = "document_id";
  static final String DOCUMENT_TITLE = "document_title";
  static final String SECTION_ID = "section_id";
  static final String TITLE = "title";
  static final String DOCUMENT_TYPE = "document_type";
  static final String JURISDICTION = "jurisdiction";
  static final String LANGUAGE = "language";
  static final String EFFECTIVE_FROM = "effective_from";
  static final String EFFECTIVE_TO = "effective_to";
  static final String RELATIONS = "relations";

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private PassageMetadata() {}

  static RetrievalHit toHit(
      String passageId, TextSegment segment, double score, ScoreBreakdown breakdown, Tier tier) {
    Map<String, Object> metadata = segment.metadata().toMap();
    String documentId = string(metadata, DOCUMENT_ID);
    if (documentId == null) {
      documentId = passageId;
    }
    String documentTitle = string(metadata, DOCUMENT_TITLE);
    String title = string(metadata, TITLE);
    if (documentTitle == null) {
      documentTitle = title == null ? documentId : title;
    }

    String relations = string(metadata, RELATIONS);
    List<Relationship> relationships = Relationship.parseAll(relations);
    if (relations != null && relationships.isEmpty()) {
      log.warn(
          "Passage {} has unreadable relations '{}'; conflict edges lost", passageId, relations);
    }

    return new RetrievalHit(
        passageId,
        tier,
        score,
        0.0,
        title == null ? documentTitle : title,
        segment.text(),
        new HitCitation(documentId, documentTitle, string(metadata, SECTION_ID)),
        string(metadata, DOCUMENT_TYPE),
        date(metadata, EFFECTIVE_FROM),
        date(metadata, EFFECTIVE_TO),
        relationships,
        breakdown);
  }

  /**
   * Parses the JSONB metadata column into LangChain4j {@link Metadata}. Values of types that
   * {@code Metadata} does not accept are stored as strings; nulls are dropped. A {@code relations}
   * array, of {@code "KIND:id"} strings or {@code {"kind", "target"}} objects, is folded into the
   * compact {@code "KIND:id;KIND:id"} form.
   */
  static Metadata fromJson(ObjectMapper objectMapper, @Nullable String json) {
    if (json == null || json.isBlank()) {
      return new Metadata();
    }
    Map<String, Object> raw;
    try {
      raw = objectMapper.readValue(json, MAP_TYPE);
    } catch (JsonProcessingException e) {
      log.warn("Ignoring unreadable passage metadata: {}", e.getOriginalMessage());
      return new Metadata();
    }
    Map<String, Object> accepted = new HashMap<>();
    raw.forEach(
        (key, value) -> {
          if (RELATIONS.equals(key) && value instanceof List<?> list) {
            accepted.put(key, encodeRelations(list));
          } else if (value instanceof String
              || value instanceof Integer
              || value instanceof Long
              || value instanceof Double
              || value instanceof Float
              || value instanceof UUID) {
            accepted.put(key, value);
          } else if (value != null) {
            accepted.put(key, String.valueOf(value));
          }
        });
    return Metadata.from(accepted);
  }

  static String encodeRelations(List<?> relations) {
    List<String> parts = new ArrayList<>();
    for (Object relation : relations) {
      if (relation instanceof Map<?, ?> edge) {
        Object kind = edge.get("kind");
        Object target = edge.get("target") != null ? edge.get("target") : edge.get("document_id");
        if (kind != null && target != null) {
          parts.add(kind + ":" + target);
        }
      } else if (relation != null) {
        parts.add(String.valueOf(relation));
      }
    }
    return String.join(";", parts);
  }

  private static @Nullable String string(Map<String, Object> metadata, String key) {
    Object value = metadata.get(key);
    if (value == null) {
      return null;
    }
    String text = String.valueOf(value).strip();
    return text.isEmpty() ? null : text;
  }

  private static @Nullable LocalDate date(Map<String, Object> metadata, String key) {
    String text = string(metadata, key);
    if (text == null) {
      return null;
    }
    try {
      return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
    } catch (DateTimeParseException e) {
      log.debug("Ignoring malformed {} '{}'", key, text);
      return null;
    }
  }
}
