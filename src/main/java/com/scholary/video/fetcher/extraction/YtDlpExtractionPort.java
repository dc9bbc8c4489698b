package com.scholary.video.fetcher.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Extraction port backed by the yt-dlp command line tool.
 *
 * <p>Each call starts one yt-dlp process with stdout and stderr merged. Metadata lookups collect
 * the output in a temporary file and are bounded by the configured timeout. Downloads read the
 * output line by line and are not bounded. Progress lines are forwarded to the hook as they
 * arrive, so the hook runs on the calling thread. The final file path and video codec are printed
 * by yt-dlp after it has moved the file into place.
 *
 * <p>yt-dlp handles format negotiation, merging and audio extraction itself (it calls ffmpeg for
 * those), so this class only builds the command and interprets the result.
 */
@Component
public class YtDlpExtractionPort implements ExtractionPort {

  private static final Logger LOGGER = LoggerFactory.getLogger(YtDlpExtractionPort.class);

  // Lines kept for the failure message when yt-dlp prints no ERROR line
  private static final int OUTPUT_TAIL_LINES = 20;

  private final YtDlpProperties properties;
  private final YtDlpOutputParser parser;

  public YtDlpExtractionPort(YtDlpProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.parser = new YtDlpOutputParser(objectMapper);
  }

  @Override
  public VideoInfo probe(String url, ExtractionOptions options) {
    List<String> command = buildProbeCommand(url, options);
    LOGGER.info("Probing video metadata: {}", url);
    LOGGER.debug("Executing: {}", command);

    Path output = createOutputFile();
    try {
      Process process = start(command, output);
      awaitMetadata(process);

      StringBuilder json = new StringBuilder();
      Deque<String> tail = new ArrayDeque<>();
      String error = null;
      try (BufferedReader reader = Files.newBufferedReader(output, StandardCharsets.UTF_8)) {
        String line;
        while ((line = reader.readLine()) != null) {
          if (line.startsWith("{")) {
            json.append(line);
          } else if (line.startsWith("ERROR:")) {
            error = line;
          } else {
            remember(tail, line);
          }
        }
      } catch (IOException e) {
        throw new ExtractionFailedException("Failed to read extractor output", e);
      }

      if (process.exitValue() != 0) {
        throw new ExtractionFailedException(describeFailure(process.exitValue(), error, tail));
      }
      if (json.length() == 0) {
        throw new ExtractionFailedException("No metadata received from extractor");
      }
      return parser.parseInfo(json.toString());
    } finally {
      deleteOutputFile(output);
    }
  }

  @Override
  public ExtractedMedia download(DownloadSpec spec, ExtractionOptions options, ProgressHook hook) {
    List<String> command = buildDownloadCommand(spec, options);
    LOGGER.info("Downloading {} with format {}", spec.url(), spec.formatSelector());
    LOGGER.debug("Executing: {}", command);

    Process process = start(command);
    String filePath = null;
    String videoCodec = null;
    String error = null;
    Deque<String> tail = new ArrayDeque<>();

    try (BufferedReader reader = reader(process)) {
      String line;
      while ((line = reader.readLine()) != null) {
        var progress = parser.parseProgress(line);
        if (progress.isPresent()) {
          hook.onProgress(progress.get());
          continue;
        }
        var file = parser.parseTagged(line, YtDlpOutputParser.FILE_PREFIX);
        if (file.isPresent()) {
          filePath = file.get();
          continue;
        }
        if (line.startsWith(YtDlpOutputParser.VCODEC_PREFIX)) {
          videoCodec = parser.parseTagged(line, YtDlpOutputParser.VCODEC_PREFIX).orElse(null);
          continue;
        }
        if (line.startsWith("ERROR:")) {
          error = line;
        }
        remember(tail, line);
      }
    } catch (IOException e) {
      process.destroyForcibly();
      throw new ExtractionFailedException("Failed to read extractor output", e);
    }

    int exitCode;
    try {
      exitCode = process.waitFor();
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new ExtractionFailedException("Interrupted while downloading", e);
    }

    if (exitCode != 0) {
      throw new ExtractionFailedException(describeFailure(exitCode, error, tail));
    }
    if (filePath == null) {
      throw new ExtractionFailedException("Extractor finished without reporting an output file");
    }

    LOGGER.info("Extractor wrote {} (vcodec={})", filePath, videoCodec);
    return new ExtractedMedia(Path.of(filePath), normalizeCodec(videoCodec));
  }

  List<String> buildProbeCommand(String url, ExtractionOptions options) {
    List<String> command = new ArrayList<>();
    command.add(properties.executable());
    addOptions(command, options);
    command.add("--no-warnings");
    command.add("--no-playlist");
    command.add("--dump-json");
    command.add(url);
    return command;
  }

  List<String> buildDownloadCommand(DownloadSpec spec, ExtractionOptions options) {
    List<String> command = new ArrayList<>();
    command.add(properties.executable());
    addOptions(command, options);
    command.add("--no-warnings");
    command.add("--no-playlist");
    command.add("--no-simulate");
    command.add("--newline");
    command.add("--progress");
    command.add("--progress-template");
    command.add(YtDlpOutputParser.PROGRESS_TEMPLATE);
    command.add("--print");
    command.add(YtDlpOutputParser.FILE_TEMPLATE);
    command.add("--print");
    command.add(YtDlpOutputParser.VCODEC_TEMPLATE);
    command.add("-f");
    command.add(spec.formatSelector());
    command.add("-o");
    command.add(spec.outputTemplate());

    if (spec.mergeOutputFormat() != null) {
      command.add("--merge-output-format");
      command.add(spec.mergeOutputFormat());
      // Put the index at the front of the merged file so players can start before it is complete
      command.add("--postprocessor-args");
      command.add("Merger:-movflags +faststart");
    }

    if (spec.audioExtraction() != null) {
      command.add("--extract-audio");
      command.add("--audio-format");
      command.add(spec.audioExtraction().codec());
      command.add("--audio-quality");
      command.add(spec.audioExtraction().quality() + "K");
    }

    command.add(spec.url());
    return command;
  }

  private static void addOptions(List<String> command, ExtractionOptions options) {
    if (options.hasCookiesFromBrowser()) {
      command.add("--cookies-from-browser");
      command.add(options.cookiesFromBrowser());
    }
    for (String component : options.remoteComponents()) {
      command.add("--remote-components");
      command.add(component);
    }
  }

  // The deadline covers the whole run, including an extractor that stalls with stdout still open
  private void awaitMetadata(Process process) {
    try {
      if (!process.waitFor(properties.probeTimeoutSeconds(), TimeUnit.SECONDS)) {
        process.destroyForcibly();
        throw new ExtractionFailedException(
            "Timed out fetching video info after " + properties.probeTimeoutSeconds() + "s");
      }
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new ExtractionFailedException("Interrupted while fetching video info", e);
    }
  }

  private static Process start(List<String> command) {
    ProcessBuilder builder = new ProcessBuilder(command);
    builder.redirectErrorStream(true);
    return start(builder);
  }

  private static Process start(List<String> command, Path output) {
    ProcessBuilder builder = new ProcessBuilder(command);
    builder.redirectErrorStream(true);
    builder.redirectOutput(output.toFile());
    return start(builder);
  }

  private static Process start(ProcessBuilder builder) {
    try {
      return builder.start();
    } catch (IOException e) {
      throw new ExtractionFailedException("Could not start " + builder.command().get(0), e);
    }
  }

  private static Path createOutputFile() {
    try {
      return Files.createTempFile("yt-dlp-info-", ".out");
    } catch (IOException e) {
      throw new ExtractionFailedException("Could not create a file for extractor output", e);
    }
  }

  private static void deleteOutputFile(Path output) {
    try {
      Files.deleteIfExists(output);
    } catch (IOException e) {
      LOGGER.warn("Could not delete extractor output {}: {}", output, e.getMessage());
    }
  }

  private static BufferedReader reader(Process process) {
    return new BufferedReader(
        new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8), 8192);
  }

  private static void remember(Deque<String> tail, String line) {
    if (tail.size() == OUTPUT_TAIL_LINES) {
      tail.removeFirst();
    }
    tail.addLast(line);
  }

  private static String describeFailure(int exitCode, String error, Deque<String> tail) {
    if (error != null) {
      return error.substring("ERROR:".length()).trim();
    }
    if (tail.isEmpty()) {
      return "Extractor exited with code " + exitCode;
    }
    return "Extractor exited with code " + exitCode + ": " + tail.getLast();
  }

  private static String normalizeCodec(String codec) {
    if (codec == null || "none".equalsIgnoreCase(codec)) {
      return null;
    }
    return codec;
  }
}
