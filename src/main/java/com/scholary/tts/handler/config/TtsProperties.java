package com.scholary.tts.handler.config;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for job scheduling and listing.
 *
 * <p>Admission control rejects a submission once {@code queueSize > maxConcurrent *
 * backlogFactor}.
 */
@ConfigurationProperties(prefix = "tts")
@Validated
public record TtsProperties(
    @Positive int maxConcurrent,
    @Positive int backlogFactor,
    @Positive int listLimit,
    @Positive int previewLength,
    @PositiveOrZero long completedRetentionMinutes) {

  public int capacityLimit() {
    return maxConcurrent * backlogFactor;
  }
}
