package com.scholary.tts.handler.service;

import com.scholary.tts.handler.job.JobStatus;
import java.time.Instant;

/**
 * One row of the job listing.
 *
 * <p>{@code text} is a preview, cut to the configured length. It is null for artifacts that were
 * found without a sidecar record.
 */
public record JobSummary(
    String jobId, JobStatus status, Instant createdAt, boolean audioExists, String text) {}
