package com.scholary.video.fetcher.api;

/**
 * One button of the quality menu.
 *
 * @param callbackData {@code <quality>|<key>}, small enough for chat callback payloads
 */
public record QualityChoice(String quality, String label, String callbackData) {}
