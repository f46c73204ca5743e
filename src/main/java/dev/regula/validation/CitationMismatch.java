package dev.regula.validation;

import java.util.List;

/**
 * A claim removed because none of its citations resolved into the context, or a sentence of the
 * direct answer or explanation removed because it cited something outside the context.
 *
 * @param claimText text of the removed claim or sentence
 * @param citations the citations the generator gave; for a sentence, the ones that did not resolve
 * @param requirement whether the removed entry was a requirement bullet
 */
public record CitationMismatch(String claimText, List<String> citations, boolean requirement) {

  public CitationMismatch {
    citations = List.copyOf(citations);
  }
}
