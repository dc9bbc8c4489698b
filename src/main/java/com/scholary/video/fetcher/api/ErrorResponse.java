package com.scholary.video.fetcher.api;

/** A user-facing error message. */
public record ErrorResponse(String message) {}
