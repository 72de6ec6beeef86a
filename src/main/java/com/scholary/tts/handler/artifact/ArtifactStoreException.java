package com.scholary.tts.handler.artifact;

/**
 * Exception thrown when artifact storage operations fail.
 *
 * <p>Runtime exception: a full disk or a missing bucket is not something the caller can fix. A
 * worker that hits it marks its job FAILED; on the request path it becomes a 500.
 */
public class ArtifactStoreException extends RuntimeException {

  public ArtifactStoreException(String message) {
    super(message);
  }

  public ArtifactStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
