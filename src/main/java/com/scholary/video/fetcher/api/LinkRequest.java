package com.scholary.video.fetcher.api;

import jakarta.validation.constraints.NotBlank;

/** A message that should contain a video link. */
public record LinkRequest(@NotBlank String text) {}
