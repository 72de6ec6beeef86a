package com.scholary.tts.handler.job;

import com.scholary.tts.handler.synthesis.SpeechRequest;
import java.time.Instant;

/**
 * Point-in-time copy of a job's state.
 *
 * <p>{@code startedAt}, {@code finishedAt} and {@code error} are null until the corresponding
 * transition has happened.
 */
public record JobSnapshot(
    String jobId,
    SpeechRequest request,
    JobStatus status,
    Instant createdAt,
    Instant startedAt,
    Instant finishedAt,
    String error) {}
