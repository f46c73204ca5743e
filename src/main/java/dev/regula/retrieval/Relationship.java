package dev.regula.retrieval;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A directed relationship from the hit's document to another document.
 *
 * @param kind relationship type
 * @param targetDocumentId identifier of the related document
 */
public record Relationship(RelationKind kind, String targetDocumentId) {

  public Relationship {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(targetDocumentId, "targetDocumentId");
  }

  /**
   * Parses the compact metadata encoding {@code "SUPERSEDES:doc-9;REFERENCES:doc-3"}. Malformed or
   * unknown entries are skipped.
   */
  public static List<Relationship> parseAll(@Nullable String encoded) {
    if (encoded == null || encoded.isBlank()) {
      return List.of();
    }
    List<Relationship> relationships = new ArrayList<>();
    for (String part : encoded.split(";")) {
      int colon = part.indexOf(':');
      if (colon <= 0 || colon == part.length() - 1) {
        continue;
      }
      String target = part.substring(colon + 1).strip();
      RelationKind.parse(part.substring(0, colon))
          .ifPresent(kind -> relationships.add(new Relationship(kind, target)));
    }
    return List.copyOf(relationships);
  }
}
