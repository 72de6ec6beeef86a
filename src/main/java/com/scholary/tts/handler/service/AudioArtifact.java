package com.scholary.tts.handler.service;

/**
 * Audio ready to be served, with its HTTP cache metadata.
 *
 * @param jobId the job id
 * @param audio the encoded audio
 * @param etag quoted entity tag, stable for a given job id
 * @param cacheControl value for the Cache-Control header
 */
public record AudioArtifact(String jobId, byte[] audio, String etag, String cacheControl) {}
