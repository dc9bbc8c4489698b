package com.scholary.video.fetcher.job;

import com.scholary.video.fetcher.config.DownloadProperties;
import com.scholary.video.fetcher.logging.StructuredLogger;
import com.scholary.video.fetcher.progress.ProgressObserver;
import com.scholary.video.fetcher.progress.ProgressSlot;
import com.scholary.video.fetcher.progress.ProgressThrottler;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Starts download jobs in the background and wires up their progress reporting.
 *
 * <p>For each job the worker writes progress into a {@link ProgressSlot}, and a {@link
 * ProgressThrottler} forwards it to the observer at a fixed cadence. The returned future completes
 * with the artifact or a {@link DownloadFailedException}. Whichever way the job ends, the throttler
 * is cancelled so no reporting loop outlives its job.
 */
@Service
public class DownloadJobService {

  private static final Logger LOGGER = LoggerFactory.getLogger(DownloadJobService.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final DownloadJobExecutor jobExecutor;
  private final Executor workers;
  private final TaskScheduler scheduler;
  private final Duration progressInterval;

  @Autowired
  public DownloadJobService(
      DownloadJobExecutor jobExecutor,
      @Qualifier("downloadExecutor") Executor workers,
      @Qualifier("progressScheduler") TaskScheduler scheduler,
      DownloadProperties properties) {
    this(jobExecutor, workers, scheduler, properties.progressInterval());
  }

  DownloadJobService(
      DownloadJobExecutor jobExecutor,
      Executor workers,
      TaskScheduler scheduler,
      Duration progressInterval) {
    this.jobExecutor = jobExecutor;
    this.workers = workers;
    this.scheduler = scheduler;
    this.progressInterval = progressInterval;
  }

  /**
   * Start a job.
   *
   * @param jobId identifier used in logs
   * @param request what to download
   * @param observer receives throttled progress; its failures never affect the job
   * @return completes with the artifact, or exceptionally with a DownloadFailedException
   */
  public CompletableFuture<Artifact> submit(
      String jobId, DownloadRequest request, ProgressObserver observer) {
    ProgressSlot slot = new ProgressSlot();
    ProgressThrottler throttler = new ProgressThrottler(jobId, slot, observer);
    throttler.start(scheduler, progressInterval);

    CompletableFuture<Artifact> result;
    try {
      result = CompletableFuture.supplyAsync(() -> execute(jobId, request, slot), workers);
    } catch (RejectedExecutionException e) {
      throttler.cancel();
      LOGGER.warn("Rejected job {}: worker queue is full", jobId);
      return CompletableFuture.failedFuture(
          new DownloadFailedException("Too many downloads in progress, try again later", e));
    }

    result.whenComplete((artifact, error) -> throttler.cancel());
    return result;
  }

  private Artifact execute(String jobId, DownloadRequest request, ProgressSlot slot) {
    StructuredLogger.setJobContext(jobId, request.url(), request.quality().code());
    long startTime = System.currentTimeMillis();
    try {
      structuredLogger.logJobStarted(jobId, request.url(), request.quality().code());

      Artifact artifact = jobExecutor.run(request, slot);

      structuredLogger.logJobFinished(
          jobId, artifact.fileName(), artifact.sizeBytes(), System.currentTimeMillis() - startTime);
      return artifact;

    } catch (DownloadFailedException e) {
      structuredLogger.logJobFailed(jobId, e.getClass().getSimpleName(), e.getMessage());
      throw e;
    } catch (RuntimeException e) {
      LOGGER.error("Unexpected failure in job {}", jobId, e);
      throw new DownloadFailedException("Unexpected error: " + e.getMessage(), e);
    } finally {
      StructuredLogger.clearJobContext();
    }
  }
}
