package com.scholary.tts.handler.api;

import com.scholary.tts.handler.synthesis.SpeechRequest;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request for synthesizing speech.
 *
 * <p>All synthesis is asynchronous: POST /tts returns a job ID immediately and the client polls
 * /tts/status/{job_id} until the audio is ready.
 */
public record TtsRequest(
    @NotBlank(message = "Text is required") String text,
    @Size(max = 100) String voice,
    @Min(-100) @Max(100) Integer pitch,
    @Min(-50) @Max(100) Integer speed,
    @Min(-50) @Max(50) Integer volume) {

  public static final String DEFAULT_VOICE = "en-US-AriaNeural";

  // Provide defaults
  public TtsRequest {
    if (voice == null || voice.isBlank()) {
      voice = DEFAULT_VOICE;
    }
    if (pitch == null) {
      pitch = 0;
    }
    if (speed == null) {
      speed = 0;
    }
    if (volume == null) {
      volume = 0;
    }
  }

  public SpeechRequest toSpeechRequest() {
    return new SpeechRequest(text, voice, pitch, speed, volume);
  }
}
