package com.scholary.video.fetcher.api;

import jakarta.validation.constraints.NotBlank;

/**
 * Request to download a previously submitted link.
 *
 * @param key the link key from {@link LinkResponse}
 * @param quality quality code ("best", "720p", "480p" or "audio"); anything else means best
 */
public record JobRequest(@NotBlank String key, String quality) {}
