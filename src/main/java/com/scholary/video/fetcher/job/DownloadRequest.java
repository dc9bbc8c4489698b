package com.scholary.video.fetcher.job;

/** A link and the quality to fetch it in. */
public record DownloadRequest(String url, Quality quality) {

  public DownloadRequest {
    if (url == null || url.isBlank()) {
      throw new IllegalArgumentException("URL must not be blank");
    }
    if (quality == null) {
      throw new IllegalArgumentException("Quality must not be null");
    }
  }
}
