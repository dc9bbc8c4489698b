package com.scholary.video.fetcher.progress;

/**
 * Receives throttled progress notifications for one job.
 *
 * <p>Implementations may fail (network errors, a deleted status message). A failure never affects
 * the job. Throwing {@link ObserverUnavailableException} tells the caller to stop notifying.
 */
@FunctionalInterface
public interface ProgressObserver {

  void onProgress(JobProgress progress);
}
