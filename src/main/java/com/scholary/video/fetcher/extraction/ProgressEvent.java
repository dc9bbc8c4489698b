package com.scholary.video.fetcher.extraction;

/**
 * Raw progress as reported by the extraction engine. Byte counts are 0 when unknown.
 */
public record ProgressEvent(
    Status status, long downloadedBytes, long totalBytes, long totalBytesEstimate) {

  public enum Status {
    DOWNLOADING,
    FINISHED,
    OTHER
  }
}
