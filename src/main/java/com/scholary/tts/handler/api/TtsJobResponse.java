package com.scholary.tts.handler.api;

/** Response for an accepted synthesis request. */
public record TtsJobResponse(String jobId) {}
