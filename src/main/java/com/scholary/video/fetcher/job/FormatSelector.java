package com.scholary.video.fetcher.job;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds ranked format selector expressions for a quality tier.
 *
 * <p>H.264 ("avc1") with AAC ("mp4a") plays everywhere, including iPhones, so it is asked for
 * first. Each further alternative drops one constraint:
 *
 * <ol>
 *   <li>H.264 video + AAC audio, merged
 *   <li>H.264 video + any audio, merged
 *   <li>a single H.264 stream at the resolution
 *   <li>any codec at the resolution
 *   <li>anything at all
 * </ol>
 *
 * <p>The engine takes the first alternative that is available, so a job never fails just because
 * the source has no H.264 stream. Files that end up in another codec are re-encoded afterwards.
 */
public final class FormatSelector {

  static final String PREFERRED_VIDEO_CODEC = "avc1";
  static final String PREFERRED_AUDIO_CODEC = "mp4a";

  /** Selector for audio-only jobs. */
  public static final String AUDIO = "bestaudio/best";

  private FormatSelector() {}

  /** Ranked alternatives for a video tier, most constrained first. */
  public static List<String> alternatives(Quality quality) {
    if (quality == Quality.AUDIO_ONLY) {
      return List.of("bestaudio", "best");
    }
    String height = quality.maxHeight() == null ? "" : "[height<=" + quality.maxHeight() + "]";
    String video = "bestvideo" + height + "[vcodec^=" + PREFERRED_VIDEO_CODEC + "]";

    List<String> alternatives = new ArrayList<>();
    alternatives.add(video + "+bestaudio[acodec^=" + PREFERRED_AUDIO_CODEC + "]");
    alternatives.add(video + "+bestaudio");
    alternatives.add("best" + height + "[vcodec^=" + PREFERRED_VIDEO_CODEC + "]");
    if (!height.isEmpty()) {
      alternatives.add("best" + height);
    }
    alternatives.add("best");
    return List.copyOf(alternatives);
  }

  /** The alternatives joined into one selector expression. */
  public static String expression(Quality quality) {
    if (quality == Quality.AUDIO_ONLY) {
      return AUDIO;
    }
    return String.join("/", alternatives(quality));
  }

  /** Whether a codec tag belongs to the preferred H.264 family. Unknown codecs count as a match. */
  public static boolean isPreferredCodec(String videoCodec) {
    if (videoCodec == null || videoCodec.isBlank()) {
      return true;
    }
    return videoCodec.startsWith("avc") || videoCodec.startsWith("h264");
  }
}
