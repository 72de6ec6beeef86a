package com.scholary.tts.handler.synthesis;

/**
 * Exception thrown when the synthesis engine fails.
 *
 * <p>This could be due to network issues, engine unavailability, or an empty response. A job that
 * hits this exception ends in FAILED and is not retried.
 */
public class SynthesisException extends RuntimeException {

  public SynthesisException(String message) {
    super(message);
  }

  public SynthesisException(String message, Throwable cause) {
    super(message, cause);
  }
}
