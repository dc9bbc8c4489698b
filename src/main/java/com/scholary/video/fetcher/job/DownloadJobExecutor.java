package com.scholary.video.fetcher.job;

import com.scholary.video.fetcher.config.DownloadProperties;
import com.scholary.video.fetcher.extraction.DownloadSpec.AudioExtraction;
import com.scholary.video.fetcher.extraction.DownloadSpec;
import com.scholary.video.fetcher.extraction.ExtractedMedia;
import com.scholary.video.fetcher.extraction.ExtractionFailedException;
import com.scholary.video.fetcher.extraction.ExtractionOptions;
import com.scholary.video.fetcher.extraction.ExtractionPort;
import com.scholary.video.fetcher.fileserver.ArtifactDirectory;
import com.scholary.video.fetcher.logging.StructuredLogger;
import com.scholary.video.fetcher.progress.JobProgress;
import com.scholary.video.fetcher.transcode.TranscodeFailedException;
import com.scholary.video.fetcher.transcode.Transcoder;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Runs one fetch (and, if needed, re-encode) job to completion on the calling thread.
 *
 * <p>Video jobs:
 *
 * <ol>
 *   <li>Ask the engine for the tier's ranked selector, preferring H.264 + AAC
 *   <li>Merge into MP4 in the artifact directory, forwarding progress
 *   <li>If the result is not H.264, re-encode it next to the original and swap it in
 * </ol>
 *
 * <p>Audio jobs fetch the best audio stream and let the engine convert it to the configured codec.
 *
 * <p>Every failure surfaces as a {@link DownloadFailedException}. Nothing is retried here.
 */
@Service
public class DownloadJobExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(DownloadJobExecutor.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String VIDEO_CONTAINER = "mp4";
  static final String REENCODED_SUFFIX = "_h264";

  private final ExtractionPort extractionPort;
  private final Transcoder transcoder;
  private final ArtifactDirectory artifactDirectory;
  private final ExtractionOptions extractionOptions;
  private final AudioExtraction audioExtraction;

  @Autowired
  public DownloadJobExecutor(
      ExtractionPort extractionPort,
      Transcoder transcoder,
      ArtifactDirectory artifactDirectory,
      ExtractionOptions extractionOptions,
      DownloadProperties properties) {
    this(
        extractionPort,
        transcoder,
        artifactDirectory,
        extractionOptions,
        new AudioExtraction(properties.audioCodec(), properties.audioQuality()));
  }

  DownloadJobExecutor(
      ExtractionPort extractionPort,
      Transcoder transcoder,
      ArtifactDirectory artifactDirectory,
      ExtractionOptions extractionOptions,
      AudioExtraction audioExtraction) {
    this.extractionPort = extractionPort;
    this.transcoder = transcoder;
    this.artifactDirectory = artifactDirectory;
    this.extractionOptions = extractionOptions;
    this.audioExtraction = audioExtraction;
  }

  /** Run a request, dispatching on its quality. */
  public Artifact run(DownloadRequest request, Consumer<JobProgress> onProgress) {
    if (request.quality() == Quality.AUDIO_ONLY) {
      return runAudioJob(request.url(), onProgress);
    }
    return runVideoJob(request.url(), request.quality(), onProgress);
  }

  /**
   * Download a video in the given tier and make sure it is H.264.
   *
   * @throws DownloadFailedException if the download or the re-encode fails
   */
  public Artifact runVideoJob(String url, Quality quality, Consumer<JobProgress> onProgress) {
    if (quality == Quality.AUDIO_ONLY) {
      return runAudioJob(url, onProgress);
    }

    DownloadSpec spec =
        new DownloadSpec(
            url,
            FormatSelector.expression(quality),
            artifactDirectory.outputTemplate(),
            VIDEO_CONTAINER,
            null);

    ExtractedMedia media =
        extractionPort.download(spec, extractionOptions, new ByteProgressHook(onProgress));
    Path file = locateOutput(media.filePath());

    if (!FormatSelector.isPreferredCodec(media.videoCodec())) {
      file = reencode(file, media.videoCodec());
    }
    return toArtifact(file);
  }

  /**
   * Download the audio track of a video, converted to the configured codec.
   *
   * @throws DownloadFailedException if the download fails
   */
  public Artifact runAudioJob(String url, Consumer<JobProgress> onProgress) {
    DownloadSpec spec =
        new DownloadSpec(
            url, FormatSelector.AUDIO, artifactDirectory.outputTemplate(), null, audioExtraction);

    ExtractedMedia media =
        extractionPort.download(spec, extractionOptions, new ByteProgressHook(onProgress));

    // The engine may report the pre-conversion name
    Path file = withExtension(media.filePath(), audioExtraction.codec());
    if (!Files.isRegularFile(file)) {
      throw new ExtractionFailedException(
          "Audio file missing after download: " + file.getFileName());
    }
    return toArtifact(file);
  }

  /** The engine reports the pre-merge name for some sources; fall back to the merged container. */
  private static Path locateOutput(Path reported) {
    if (Files.isRegularFile(reported)) {
      return reported;
    }
    Path merged = withExtension(reported, VIDEO_CONTAINER);
    if (Files.isRegularFile(merged)) {
      return merged;
    }
    throw new ExtractionFailedException(
        "Output file missing after download: " + reported.getFileName());
  }

  /**
   * Re-encode to H.264 next to the original, then move the result over the canonical name.
   *
   * <p>The canonical file is only replaced once a complete re-encoded file exists. On failure the
   * side-by-side output is deleted and the downloaded file stays as it was.
   */
  private Path reencode(Path original, String videoCodec) {
    structuredLogger.logTranscodeStarted(original.getFileName().toString(), videoCodec);
    long startTime = System.currentTimeMillis();

    Path target = withExtension(original, VIDEO_CONTAINER);
    Path temp = target.resolveSibling(stem(target) + REENCODED_SUFFIX + "." + VIDEO_CONTAINER);

    try {
      transcoder.transcodeToH264(original, temp);
    } catch (TranscodeFailedException e) {
      discard(temp, e);
      throw e;
    }

    if (!Files.isRegularFile(temp)) {
      throw new TranscodeFailedException(
          "Re-encoder produced no output for " + original.getFileName());
    }

    try {
      replace(temp, target);
    } catch (IOException e) {
      TranscodeFailedException failure =
          new TranscodeFailedException("Could not replace " + target.getFileName(), e);
      discard(temp, failure);
      throw failure;
    }

    if (!original.equals(target)) {
      try {
        Files.deleteIfExists(original);
      } catch (IOException e) {
        LOGGER.warn("Could not delete pre-conversion file {}: {}", original, e.getMessage());
      }
    }

    structuredLogger.logTranscodeFinished(
        target.getFileName().toString(), System.currentTimeMillis() - startTime);
    return target;
  }

  private static void replace(Path source, Path target) throws IOException {
    try {
      Files.move(
          source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void discard(Path temp, Exception failure) {
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      failure.addSuppressed(e);
      LOGGER.warn("Could not delete partial output {}: {}", temp, e.getMessage());
    }
  }

  private static Artifact toArtifact(Path file) {
    try {
      return new Artifact(file.toAbsolutePath(), Files.size(file));
    } catch (IOException e) {
      throw new DownloadFailedException("Could not read " + file.getFileName(), e);
    }
  }

  static Path withExtension(Path file, String extension) {
    return file.resolveSibling(stem(file) + "." + extension);
  }

  private static String stem(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }
}
