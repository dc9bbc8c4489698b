package com.scholary.video.fetcher.extraction;

/**
 * What to ask the extraction engine for.
 *
 * @param url the video link
 * @param formatSelector ranked format selector expression, alternatives separated by '/'
 * @param outputTemplate absolute output path template, e.g. {@code /dl/%(title)s.%(ext)s}
 * @param mergeOutputFormat container to merge separate streams into, or null to keep the source's
 * @param audioExtraction audio post-processing target, or null to keep video
 */
public record DownloadSpec(
    String url,
    String formatSelector,
    String outputTemplate,
    String mergeOutputFormat,
    AudioExtraction audioExtraction) {

  /** Audio-only post-processing: re-encode the fetched audio to a codec at a bitrate in kbit/s. */
  public record AudioExtraction(String codec, int quality) {}
}
