package com.scholary.tts.handler.synthesis;

import java.util.Objects;

/**
 * Immutable description of one synthesis request.
 *
 * <p>Bounds on pitch, speed and volume are enforced at the HTTP boundary; by the time a request
 * reaches the job manager it is assumed valid. Text is stored trimmed.
 *
 * @param text the text to speak, trimmed and non-empty
 * @param voice the engine voice identifier
 * @param pitch pitch offset in Hz
 * @param speed speaking rate offset in percent
 * @param volume volume offset in percent
 */
public record SpeechRequest(String text, String voice, int pitch, int speed, int volume) {

  public SpeechRequest {
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(voice, "voice");
    text = text.strip();
    if (text.isEmpty()) {
      throw new IllegalArgumentException("text must not be blank");
    }
  }
}
