package com.scholary.video.fetcher.link;

import java.util.Locale;

/** Formats video durations the way players show them. */
public final class DurationFormatter {

  private DurationFormatter() {}

  /**
   * {@code m:ss} below an hour, {@code h:mm:ss} from an hour on, "Unknown" for 0 or less.
   *
   * @param seconds duration in seconds
   */
  public static String format(long seconds) {
    if (seconds <= 0) {
      return "Unknown";
    }
    if (seconds < 3600) {
      return String.format(Locale.ROOT, "%d:%02d", seconds / 60, seconds % 60);
    }
    return String.format(
        Locale.ROOT, "%d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
  }
}
