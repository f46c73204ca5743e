package dev.regula.synthesis;

import java.util.List;

/**
 * A conflict the generator chose to mention, tied to context reference ids.
 *
 * @param references reference ids of the passages involved
 * @param description the generator's explanation
 */
public record ConflictNote(List<String> references, String description) {

  public ConflictNote {
    references = references == null ? List.of() : List.copyOf(references);
    description = description == null ? "" : description;
  }
}
