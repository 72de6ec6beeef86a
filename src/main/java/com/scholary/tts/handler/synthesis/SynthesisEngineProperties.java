package com.scholary.tts.handler.synthesis;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the synthesis engine client.
 *
 * <p>Timeouts are in seconds. The read timeout is the only bound on how long a single synthesis
 * may take.
 */
@ConfigurationProperties(prefix = "tts.engine")
@Validated
public record SynthesisEngineProperties(
    @NotBlank String baseUrl, @Positive int connectTimeout, @Positive int readTimeout) {}
