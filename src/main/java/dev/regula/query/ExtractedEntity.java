package dev.regula.query;

/**
 * An entity recognised in the question text.
 *
 * @param text the surface text as it appears in the question
 * @param type the entity type
 * @param normalized canonical form (dictionary key, ISO date, or lower-cased surface text)
 * @param confidence extraction confidence in [0, 1]
 * @param start start offset (inclusive) in the normalized question
 * @param end end offset (exclusive) in the normalized question
 */
public record ExtractedEntity(
    String text, EntityType type, String normalized, double confidence, int start, int end) {

  boolean overlaps(ExtractedEntity other) {
    return start < other.end && other.start < end;
  }
}
