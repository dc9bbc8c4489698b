package com.scholary.video.fetcher.api;

import com.scholary.video.fetcher.fileserver.DownloadLinkBuilder;
import com.scholary.video.fetcher.job.Artifact;
import com.scholary.video.fetcher.job.DownloadJob;
import com.scholary.video.fetcher.job.DownloadJobService;
import com.scholary.video.fetcher.job.DownloadRequest;
import com.scholary.video.fetcher.job.JobRepository;
import com.scholary.video.fetcher.job.Quality;
import com.scholary.video.fetcher.logging.StructuredLogger;
import com.scholary.video.fetcher.progress.JobProgress;
import com.scholary.video.fetcher.token.LinkExpiredException;
import com.scholary.video.fetcher.token.LinkTokenStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for download jobs.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Starting a job for a submitted link (returns job ID immediately)
 *   <li>Job status polling
 * </ul>
 *
 * <p>The job's throttled progress notifications are written into its status message, the same
 * text a chat front end would edit into its reply.
 */
@RestController
@Tag(name = "Jobs", description = "Download jobs and their progress")
public class JobController {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobController.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String EXPIRED_MESSAGE = "Link expired. Please send the URL again.";

  private final DownloadJobService jobService;
  private final JobRepository jobRepository;
  private final LinkTokenStore tokenStore;
  private final DownloadLinkBuilder linkBuilder;

  public JobController(
      DownloadJobService jobService,
      JobRepository jobRepository,
      LinkTokenStore tokenStore,
      DownloadLinkBuilder linkBuilder) {
    this.jobService = jobService;
    this.jobRepository = jobRepository;
    this.tokenStore = tokenStore;
    this.linkBuilder = linkBuilder;
  }

  /** Start an asynchronous download job. */
  @PostMapping("/api/jobs")
  @Operation(
      summary = "Start download",
      description = "Start an asynchronous download for a link key and return the job ID")
  public ResponseEntity<AsyncJobResponse> startJob(@Valid @RequestBody JobRequest request) {
    String url =
        tokenStore
            .get(request.key())
            .orElseThrow(() -> new LinkExpiredException(request.key()));
    Quality quality = Quality.fromCode(request.quality());

    DownloadJob job = jobRepository.create(new DownloadRequest(url, quality));
    String jobId = job.getJobId();
    LOGGER.info("Created download job {}: url={}, quality={}", jobId, url, quality.code());

    jobService
        .submit(jobId, job.getRequest(), progress -> onProgress(job, progress))
        .whenComplete((artifact, error) -> onFinished(job, artifact, error));

    return ResponseEntity.accepted().body(new AsyncJobResponse(jobId));
  }

  /**
   * Get job status.
   *
   * <p>Returns the current state of a job. Completed jobs include the download link.
   */
  @GetMapping("/api/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of a download job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(job -> ResponseEntity.ok(toResponse(job)))
        .orElse(ResponseEntity.notFound().build());
  }

  @ExceptionHandler(LinkExpiredException.class)
  public ResponseEntity<ErrorResponse> handleExpired(LinkExpiredException e) {
    LOGGER.info("Unknown or expired link key: {}", e.getKey());
    return ResponseEntity.status(HttpStatus.GONE).body(new ErrorResponse(EXPIRED_MESSAGE));
  }

  private void onProgress(DownloadJob job, JobProgress progress) {
    job.applyProgress(progress);
    structuredLogger.logJobProgress(job.getJobId(), progress.percent(), progress.phase().name());
  }

  private void onFinished(DownloadJob job, Artifact artifact, Throwable error) {
    if (error == null) {
      job.complete(artifact, linkBuilder.downloadUrl(artifact.fileName()));
    } else {
      Throwable cause =
          error instanceof CompletionException && error.getCause() != null
              ? error.getCause()
              : error;
      job.fail(cause.getMessage());
    }
    jobRepository.save(job);
  }

  private static JobStatusResponse toResponse(DownloadJob job) {
    Artifact artifact = job.getArtifact();
    JobProgress progress = job.getProgress();
    return new JobStatusResponse(
        job.getJobId(),
        job.getStatus(),
        progress.percent(),
        progress.phase(),
        job.getMessage(),
        artifact == null ? null : artifact.fileName(),
        artifact == null ? null : Math.round(artifact.sizeMegabytes() * 10) / 10.0,
        job.getDownloadUrl(),
        job.getError());
  }
}
