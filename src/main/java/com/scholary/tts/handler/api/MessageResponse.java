package com.scholary.tts.handler.api;

/** Plain acknowledgement, e.g. after a delete. */
public record MessageResponse(String message) {}
