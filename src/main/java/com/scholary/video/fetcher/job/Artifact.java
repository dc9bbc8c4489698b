package com.scholary.video.fetcher.job;

import java.nio.file.Path;

/** A finished media file in the artifact directory. */
public record Artifact(Path path, long sizeBytes) {

  private static final double BYTES_PER_MEGABYTE = 1024.0 * 1024.0;

  public String fileName() {
    return path.getFileName().toString();
  }

  public double sizeMegabytes() {
    return sizeBytes / BYTES_PER_MEGABYTE;
  }
}
