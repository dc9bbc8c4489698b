package com.scholary.video.fetcher.progress;

/**
 * Thrown by a progress observer that can no longer be reached, e.g. because the message it edits
 * was deleted. Progress reporting for the job stops; the job itself carries on.
 */
public class ObserverUnavailableException extends RuntimeException {

  public ObserverUnavailableException(String message) {
    super(message);
  }

  public ObserverUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
