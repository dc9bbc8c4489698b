package com.scholary.video.fetcher.job;

/**
 * Exception thrown when a download job cannot produce an artifact.
 *
 * <p>This is the only failure a job's caller sees. Subclasses say which stage failed. Jobs are
 * never retried internally; the message is meant to be shown to the user, who may try again.
 */
public class DownloadFailedException extends RuntimeException {

  public DownloadFailedException(String message) {
    super(message);
  }

  public DownloadFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
