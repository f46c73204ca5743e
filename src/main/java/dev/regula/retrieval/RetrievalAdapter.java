package dev.regula.retrieval;

import java.util.List;

/**
 * Uniform contract over the retrieval backends. Implementations translate a {@link TierQuery} into
 * a backend request and map the response to {@link RetrievalHit}s carrying raw scores.
 *
 * <p>Implementations must be thread-safe and should respond to thread interruption, since the
 * cascade cancels calls that exceed their timeout.
 */
public interface RetrievalAdapter {

  Backend backend();

  /**
   * Executes the query.
   *
   * @return hits in backend rank order, at most {@code query.limit()} of them
   * @throws BackendUnavailableException if the backend cannot be queried
   */
  List<RetrievalHit> retrieve(TierQuery query);
}
