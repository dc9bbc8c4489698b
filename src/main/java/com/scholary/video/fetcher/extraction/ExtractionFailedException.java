package com.scholary.video.fetcher.extraction;

import com.scholary.video.fetcher.job.DownloadFailedException;

/**
 * Exception thrown when the extraction engine cannot fetch or parse a source.
 *
 * <p>Covers network errors, unsupported or private videos, a non-zero engine exit and an output
 * file that is missing after the engine claimed success.
 */
public class ExtractionFailedException extends DownloadFailedException {

  public ExtractionFailedException(String message) {
    super(message);
  }

  public ExtractionFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
