package com.scholary.tts.handler.synthesis;

/**
 * Interface for the speech synthesis engine.
 *
 * <p>Implementations block until the audio is ready. Callers run them on worker threads, never on
 * a request thread.
 */
public interface SpeechSynthesizer {

  /**
   * Synthesize speech for a request.
   *
   * @param request the validated request
   * @return the encoded audio (MP3)
   * @throws SynthesisException if the engine fails or returns no audio
   */
  byte[] synthesize(SpeechRequest request);
}
