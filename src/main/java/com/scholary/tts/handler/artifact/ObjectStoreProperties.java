package com.scholary.tts.handler.artifact;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the S3 artifact backend.
 *
 * <p>These map to the "objectstore.*" keys in application.yml and are only bound when
 * {@code tts.artifacts.backend=s3}.
 */
@ConfigurationProperties(prefix = "objectstore")
@Validated
public record ObjectStoreProperties(
    @NotBlank String endpoint,
    @NotBlank String accessKey,
    @NotBlank String secretKey,
    @NotBlank String bucket,
    String region,
    String keyPrefix,
    boolean pathStyleAccess) {}
