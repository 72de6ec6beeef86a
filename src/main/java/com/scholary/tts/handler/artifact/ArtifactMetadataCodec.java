package com.scholary.tts.handler.artifact;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;

/**
 * Reads and writes sidecar records.
 *
 * <p>Uses its own mapper so the on-disk format does not change with the web layer's Jackson
 * settings. Format:
 *
 * <pre>
 * {
 *   "jobId": "0b6c...",
 *   "createdAt": "2024-05-01T10:15:30Z",
 *   "completedAt": "2024-05-01T10:15:34Z",
 *   "text": "Hello world",
 *   "voice": "en-US-AriaNeural",
 *   "sizeBytes": 18432
 * }
 * </pre>
 */
final class ArtifactMetadataCodec {

  private static final ObjectMapper MAPPER =
      JsonMapper.builder()
          .addModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
          .build();

  private ArtifactMetadataCodec() {}

  static byte[] encode(ArtifactMetadata metadata) throws IOException {
    return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsBytes(metadata);
  }

  static ArtifactMetadata decode(byte[] json) throws IOException {
    return MAPPER.readValue(json, ArtifactMetadata.class);
  }
}
