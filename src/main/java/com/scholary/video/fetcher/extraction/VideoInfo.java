package com.scholary.video.fetcher.extraction;

/** Metadata of a video, fetched without downloading it. Duration is 0 when unknown. */
public record VideoInfo(String title, long durationSeconds, String uploader, String thumbnailUrl) {

  public static final String UNKNOWN = "Unknown";
}
