package com.scholary.video.fetcher.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Job lifecycle events carry their fields in the MDC so they can be filtered by job and event
 * type in the log backend.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log job started event. */
  public void logJobStarted(String jobId, String url, String quality) {
    try {
      MDC.put("event_type", "job_started");

      logger.info("Job started: jobId={}, url={}, quality={}", jobId, url, quality);
    } finally {
      clearEventFields();
    }
  }

  /** Log a progress notification that was shown to the user. */
  public void logJobProgress(String jobId, int percent, String phase) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("percent", String.valueOf(percent));
      MDC.put("phase", phase);

      logger.debug("Job progress: jobId={}, phase={}, progress={}%", jobId, phase, percent);
    } finally {
      clearEventFields();
    }
  }

  /** Log job finished event. */
  public void logJobFinished(String jobId, String fileName, long sizeBytes, long elapsedMs) {
    try {
      MDC.put("event_type", "job_finished");
      MDC.put("sizeBytes", String.valueOf(sizeBytes));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Job finished: jobId={}, file={}, size={} bytes, elapsed={}ms",
          jobId,
          fileName,
          sizeBytes,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log job failure event. */
  public void logJobFailed(String jobId, String errorType, String message) {
    try {
      MDC.put("event_type", "job_failed");
      MDC.put("errorType", errorType);

      logger.error("Job failed: jobId={}, error={}, message={}", jobId, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log re-encode started event. */
  public void logTranscodeStarted(String fileName, String videoCodec) {
    try {
      MDC.put("event_type", "transcode_started");
      MDC.put("videoCodec", String.valueOf(videoCodec));

      logger.info("Re-encoding required: file={}, vcodec={}", fileName, videoCodec);
    } finally {
      clearEventFields();
    }
  }

  /** Log re-encode finished event. */
  public void logTranscodeFinished(String fileName, long transcodeMs) {
    try {
      MDC.put("event_type", "transcode_finished");
      MDC.put("transcodeMs", String.valueOf(transcodeMs));

      logger.info("Re-encoding finished: file={}, took={}ms", fileName, transcodeMs);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String url, String quality) {
    MDC.put("jobId", jobId);
    MDC.put("url", url);
    MDC.put("quality", quality);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("url");
    MDC.remove("quality");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("percent");
    MDC.remove("phase");
    MDC.remove("sizeBytes");
    MDC.remove("elapsedMs");
    MDC.remove("errorType");
    MDC.remove("videoCodec");
    MDC.remove("transcodeMs");
  }
}
