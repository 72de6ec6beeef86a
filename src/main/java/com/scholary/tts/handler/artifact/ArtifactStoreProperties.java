package com.scholary.tts.handler.artifact;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for artifact storage.
 *
 * <p>These map to the "tts.artifacts.*" keys in application.yml.
 */
@ConfigurationProperties(prefix = "tts.artifacts")
@Validated
public record ArtifactStoreProperties(
    @NotNull Backend backend,
    @NotBlank String directory,
    @Positive int minBytes,
    @Positive long cacheMaxAgeSeconds) {

  public enum Backend {
    FILESYSTEM,
    S3
  }
}
