package com.scholary.video.fetcher.progress;

/** Coarse state of a job as shown to the user. */
public enum Phase {
  DOWNLOADING,
  PROCESSING,
  DONE
}
