package com.scholary.tts.handler.api;

import com.scholary.tts.handler.job.JobStatus;

/**
 * Response for job status query.
 *
 * <p>{@code message} is human-readable; for failed jobs it carries the failure reason.
 */
public record JobStatusResponse(String jobId, JobStatus status, String message) {}
