package com.scholary.video.fetcher.api;

import java.util.List;

/** Video details and the quality menu for a submitted link. */
public record LinkResponse(
    String key,
    String url,
    String title,
    String duration,
    String uploader,
    String thumbnailUrl,
    List<QualityChoice> choices) {}
