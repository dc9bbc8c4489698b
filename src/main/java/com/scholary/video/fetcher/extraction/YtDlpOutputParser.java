package com.scholary.video.fetcher.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.video.fetcher.extraction.ProgressEvent.Status;
import java.io.IOException;
import java.util.Optional;

/**
 * Parses yt-dlp output.
 *
 * <p>The download command is run with a progress template and two after-move print templates, so
 * the interesting lines look like:
 *
 * <pre>
 * [progress] downloading 1048576 10485760 NA
 * [file] /home/me/Downloads/My video.mp4
 * [vcodec] avc1.64001F
 * </pre>
 *
 * <p>Fields yt-dlp does not know are printed as {@code NA}.
 */
class YtDlpOutputParser {

  static final String PROGRESS_PREFIX = "[progress] ";
  static final String FILE_PREFIX = "[file] ";
  static final String VCODEC_PREFIX = "[vcodec] ";

  static final String PROGRESS_TEMPLATE =
      "download:"
          + PROGRESS_PREFIX
          + "%(progress.status)s %(progress.downloaded_bytes)s"
          + " %(progress.total_bytes)s %(progress.total_bytes_estimate)s";
  static final String FILE_TEMPLATE = "after_move:" + FILE_PREFIX + "%(filepath)s";
  static final String VCODEC_TEMPLATE = "after_move:" + VCODEC_PREFIX + "%(vcodec)s";

  private static final String NOT_AVAILABLE = "NA";

  private final ObjectMapper objectMapper;

  YtDlpOutputParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /** Parse a progress line, or return empty if the line is something else. */
  Optional<ProgressEvent> parseProgress(String line) {
    if (!line.startsWith(PROGRESS_PREFIX)) {
      return Optional.empty();
    }
    String[] fields = line.substring(PROGRESS_PREFIX.length()).trim().split("\\s+");
    if (fields.length < 4) {
      return Optional.empty();
    }
    return Optional.of(
        new ProgressEvent(
            parseStatus(fields[0]),
            parseBytes(fields[1]),
            parseBytes(fields[2]),
            parseBytes(fields[3])));
  }

  /** Return the value of a "[prefix] value" line, or empty if the prefix does not match. */
  Optional<String> parseTagged(String line, String prefix) {
    if (!line.startsWith(prefix)) {
      return Optional.empty();
    }
    String value = line.substring(prefix.length()).trim();
    if (value.isEmpty() || NOT_AVAILABLE.equals(value)) {
      return Optional.empty();
    }
    return Optional.of(value);
  }

  /**
   * Parse the output of {@code --dump-json}.
   *
   * @throws ExtractionFailedException if the output is not a JSON object
   */
  VideoInfo parseInfo(String json) {
    JsonNode node;
    try {
      node = objectMapper.readTree(json);
    } catch (IOException e) {
      throw new ExtractionFailedException("Could not parse video metadata", e);
    }
    if (node == null || !node.isObject()) {
      throw new ExtractionFailedException("No video metadata in extractor output");
    }
    return new VideoInfo(
        textOr(node, "title", VideoInfo.UNKNOWN),
        node.path("duration").asLong(0),
        textOr(node, "uploader", VideoInfo.UNKNOWN),
        textOr(node, "thumbnail", null));
  }

  private static String textOr(JsonNode node, String field, String fallback) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull() || value.asText().isBlank()) {
      return fallback;
    }
    return value.asText();
  }

  private static Status parseStatus(String status) {
    switch (status) {
      case "downloading":
        return Status.DOWNLOADING;
      case "finished":
        return Status.FINISHED;
      default:
        return Status.OTHER;
    }
  }

  private static long parseBytes(String value) {
    if (NOT_AVAILABLE.equals(value)) {
      return 0;
    }
    try {
      // Estimates are printed as floats.
      return (long) Double.parseDouble(value);
    } catch (NumberFormatException e) {
      return 0;
    }
  }
}
