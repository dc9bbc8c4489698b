package com.scholary.video.fetcher.fileserver;

import java.time.Instant;

/** A file shown on the listing page. */
public record ListedFile(String name, long sizeBytes, Instant lastModified) {

  public double sizeMegabytes() {
    return sizeBytes / (1024.0 * 1024.0);
  }
}
