package dev.regula.retrieval;

/** A retrieval backend could not be queried: connection failure, query error or bad response. */
public class BackendUnavailableException extends RuntimeException {

  private final Backend backend;

  public BackendUnavailableException(Backend backend, String message, Throwable cause) {
    super(message, cause);
    this.backend = backend;
  }

  public Backend getBackend() {
    return backend;
  }
}
