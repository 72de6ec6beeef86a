package com.scholary.tts.handler.synthesis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the speech synthesis backend.
 *
 * <p>Posts the request as JSON to {@code {baseUrl}/api/v1/synthesize} and returns the raw response
 * body as audio. The backend is expected to answer 200 with {@code audio/mpeg} bytes.
 *
 * <p>Failures are not retried. A failed synthesis marks the job FAILED and the client decides
 * whether to resubmit.
 */
@Component
public class HttpSpeechSynthesizer implements SpeechSynthesizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpSpeechSynthesizer.class);

  private final HttpClient httpClient;
  private final SynthesisEngineProperties properties;
  private final ObjectMapper objectMapper;

  public HttpSpeechSynthesizer(SynthesisEngineProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized synthesis client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public byte[] synthesize(SpeechRequest request) {
    LOGGER.info(
        "Synthesizing: voice={}, chars={}, pitch={}, speed={}, volume={}",
        request.voice(),
        request.text().length(),
        request.pitch(),
        request.speed(),
        request.volume());

    HttpRequest httpRequest =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/api/v1/synthesize"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "application/json")
            .header("Accept", "audio/mpeg")
            .POST(BodyPublishers.ofByteArray(buildBody(request)))
            .build();

    HttpResponse<byte[]> response;
    try {
      response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
    } catch (IOException e) {
      throw new SynthesisException("Synthesis request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SynthesisException("Synthesis interrupted", e);
    }

    if (response.statusCode() != 200) {
      throw new SynthesisException(
          String.format(
              "Synthesis backend returned status %d: %s",
              response.statusCode(), new String(response.body(), StandardCharsets.UTF_8)));
    }

    byte[] audio = response.body();
    if (audio == null || audio.length == 0) {
      throw new SynthesisException("Synthesis backend returned no audio");
    }

    LOGGER.debug("Synthesis returned {} bytes", audio.length);
    return audio;
  }

  private byte[] buildBody(SpeechRequest request) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("text", request.text());
    body.put("voice", request.voice());
    body.put("pitch", request.pitch());
    body.put("speed", request.speed());
    body.put("volume", request.volume());
    try {
      return objectMapper.writeValueAsBytes(body);
    } catch (JsonProcessingException e) {
      throw new SynthesisException("Failed to encode synthesis request", e);
    }
  }
}
