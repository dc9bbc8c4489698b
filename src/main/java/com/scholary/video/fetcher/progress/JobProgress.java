package com.scholary.video.fetcher.progress;

/**
 * A progress reading for a job.
 *
 * <p>Readings are "latest known value", not an event log: consumers may see repeated or, rarely,
 * out-of-order values.
 */
public record JobProgress(int percent, Phase phase) {

  public static final JobProgress INITIAL = new JobProgress(0, Phase.DOWNLOADING);
  public static final JobProgress PROCESSING = new JobProgress(100, Phase.PROCESSING);

  public JobProgress {
    if (percent < 0 || percent > 100) {
      throw new IllegalArgumentException("Percent must be within 0-100, was " + percent);
    }
    if (phase == null) {
      throw new IllegalArgumentException("Phase must not be null");
    }
  }

  public static JobProgress downloading(int percent) {
    return new JobProgress(percent, Phase.DOWNLOADING);
  }

  /** Whether the download part of the job is over. */
  public boolean isTerminal() {
    return percent >= 100 || phase != Phase.DOWNLOADING;
  }
}
