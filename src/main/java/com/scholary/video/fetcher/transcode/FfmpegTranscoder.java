package com.scholary.video.fetcher.transcode;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Re-encodes videos with ffmpeg.
 *
 * <p>Some sources only offer VP9 or AV1 at the requested resolution, which many phones cannot
 * play. This converts such files to H.264/AAC in an MP4 container with {@code +faststart}.
 */
@Component
public class FfmpegTranscoder implements Transcoder {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegTranscoder.class);

  private final FfmpegProperties properties;

  public FfmpegTranscoder(FfmpegProperties properties) {
    this.properties = properties;
  }

  @Override
  public void transcodeToH264(Path input, Path output) {
    // -nostdin: never wait for interactive input
    // -c:v libx264 -preset -crf: H.264 video at constant quality
    // -c:a aac -b:a: AAC audio
    // -movflags +faststart: move the index to the front for progressive playback
    // -y: overwrite output file
    List<String> command = buildCommand(input, output);

    LOGGER.info("Re-encoding {} to H.264", input.getFileName());
    LOGGER.debug("Executing: {}", command);

    ProcessBuilder builder = new ProcessBuilder(command);
    builder.redirectErrorStream(true);

    Process process;
    try {
      process = builder.start();
    } catch (IOException e) {
      throw new TranscodeFailedException("Could not start " + properties.executable(), e);
    }

    // ffmpeg logs to stderr; drain it so the process never blocks on a full pipe
    String lastLine = null;
    try (BufferedReader reader =
        new BufferedReader(
            new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8), 8192)) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (!line.isBlank()) {
          lastLine = line;
        }
      }
    } catch (IOException e) {
      process.destroyForcibly();
      throw new TranscodeFailedException("Failed to read ffmpeg output", e);
    }

    try {
      int exitCode = process.waitFor();
      if (exitCode != 0) {
        throw new TranscodeFailedException(
            "ffmpeg re-encoding failed with exit code "
                + exitCode
                + (lastLine == null ? "" : ": " + lastLine));
      }
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new TranscodeFailedException("Re-encoding interrupted", e);
    }

    LOGGER.info("Re-encoded {} to {}", input.getFileName(), output.getFileName());
  }

  List<String> buildCommand(Path input, Path output) {
    return List.of(
        properties.executable(),
        "-nostdin",
        "-i",
        input.toString(),
        "-c:v",
        "libx264",
        "-preset",
        properties.preset(),
        "-crf",
        String.valueOf(properties.crf()),
        "-c:a",
        "aac",
        "-b:a",
        properties.audioBitrate(),
        "-movflags",
        "+faststart",
        "-y",
        output.toString());
  }
}
