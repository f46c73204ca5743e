package dev.regula.retrieval;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Structured citation of a retrieved passage.
 *
 * @param documentId identifier of the statute or regulation
 * @param documentTitle human-readable title, e.g. "Employment Insurance Act"
 * @param sectionId section number within the document, or {@code null} for whole-document hits
 */
public record HitCitation(String documentId, String documentTitle, @Nullable String sectionId) {

  public HitCitation {
    Objects.requireNonNull(documentId, "documentId");
    Objects.requireNonNull(documentTitle, "documentTitle");
    if (sectionId != null && sectionId.isBlank()) {
      sectionId = null;
    }
  }

  /** Display label in the form {@code "<title>, Section <id>"}. */
  public String label() {
    return sectionId == null ? documentTitle : documentTitle + ", Section " + sectionId;
  }

  /** Key identifying one section of one document; used for de-duplication. */
  public String passageKey() {
    return documentId + "#" + (sectionId == null ? "" : sectionId);
  }
}
