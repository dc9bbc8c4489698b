package com.scholary.video.fetcher.transcode;

import com.scholary.video.fetcher.job.DownloadFailedException;

/**
 * Exception thrown when re-encoding a downloaded video fails.
 *
 * <p>The downloaded file is left in place when this is thrown; only the side-by-side output is
 * discarded.
 */
public class TranscodeFailedException extends DownloadFailedException {

  public TranscodeFailedException(String message) {
    super(message);
  }

  public TranscodeFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
