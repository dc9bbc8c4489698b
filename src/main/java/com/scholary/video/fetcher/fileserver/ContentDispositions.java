package com.scholary.video.fetcher.fileserver;

import java.nio.charset.StandardCharsets;
import org.springframework.web.util.UriUtils;

/**
 * Builds {@code Content-Disposition} headers for file downloads.
 *
 * <p>The header carries the name twice: a plain ASCII {@code filename} for old clients, and the
 * exact name as a percent-encoded UTF-8 {@code filename*} (RFC 6266) for everyone else.
 */
public final class ContentDispositions {

  private ContentDispositions() {}

  public static String attachment(String fileName) {
    return "attachment; filename=\""
        + asciiFallback(fileName)
        + "\"; filename*=UTF-8''"
        + UriUtils.encode(fileName, StandardCharsets.UTF_8);
  }

  /**
   * Make a name safe for a quoted header parameter: quotes become apostrophes, line breaks become
   * spaces, other control characters are dropped and anything outside printable ASCII becomes '_'.
   */
  static String asciiFallback(String fileName) {
    StringBuilder safe = new StringBuilder(fileName.length());
    for (int i = 0; i < fileName.length(); i++) {
      char c = fileName.charAt(i);
      if (c == '\r' || c == '\n') {
        safe.append(' ');
      } else if (Character.isISOControl(c)) {
        continue;
      } else if (c == '"') {
        safe.append('\'');
      } else if (c == '\\') {
        safe.append('_');
      } else if (c > '~') {
        safe.append('_');
      } else {
        safe.append(c);
      }
    }
    return safe.toString();
  }
}
