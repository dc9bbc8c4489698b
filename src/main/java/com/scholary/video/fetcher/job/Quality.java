package com.scholary.video.fetcher.job;

import java.util.Arrays;
import java.util.Locale;

/** Quality tiers a user can choose from. The code is what travels in callback payloads. */
public enum Quality {
  BEST("best", "Best Quality", null),
  P720("720p", "720p", 720),
  P480("480p", "480p", 480),
  AUDIO_ONLY("audio", "Audio Only", null);

  private final String code;
  private final String label;
  private final Integer maxHeight;

  Quality(String code, String label, Integer maxHeight) {
    this.code = code;
    this.label = label;
    this.maxHeight = maxHeight;
  }

  public String code() {
    return code;
  }

  public String label() {
    return label;
  }

  /** Maximum video height in pixels, or null when unconstrained. */
  public Integer maxHeight() {
    return maxHeight;
  }

  /** Resolve a callback code. Unknown or missing codes mean {@link #BEST}. */
  public static Quality fromCode(String code) {
    if (code == null) {
      return BEST;
    }
    String normalized = code.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(quality -> quality.code.equals(normalized))
        .findFirst()
        .orElse(BEST);
  }
}
