package com.scholary.video.fetcher.link;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Finds YouTube video links in free text. */
public final class YoutubeLinkDetector {

  // watch?v=, youtu.be/ and shorts/ links, with or without scheme and www
  private static final Pattern YOUTUBE_LINK =
      Pattern.compile(
          "(https?://)?(www\\.)?"
              + "(youtube\\.com/watch\\?v=|youtu\\.be/|youtube\\.com/shorts/)[\\w-]+");

  private YoutubeLinkDetector() {}

  /**
   * Return the first YouTube link in the text, with {@code https://} added if it had no scheme.
   *
   * @param text message text, may be null
   * @return the link, or empty if there is none
   */
  public static Optional<String> find(String text) {
    if (text == null) {
      return Optional.empty();
    }
    Matcher matcher = YOUTUBE_LINK.matcher(text);
    if (!matcher.find()) {
      return Optional.empty();
    }
    String url = matcher.group();
    return Optional.of(url.startsWith("http") ? url : "https://" + url);
  }
}
