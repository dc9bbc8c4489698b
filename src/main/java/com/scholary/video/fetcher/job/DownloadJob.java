package com.scholary.video.fetcher.job;

import com.scholary.video.fetcher.progress.JobProgress;
import com.scholary.video.fetcher.progress.Phase;
import java.util.Locale;

/**
 * Represents a download job as seen by the user.
 *
 * <p>Tracks the job's state, the last progress notification and the result. Progress is written
 * from the progress scheduler and the result from a worker thread, so fields are volatile.
 */
public class DownloadJob {

  private final String jobId;
  private final DownloadRequest request;

  private volatile JobStatus status;
  private volatile JobProgress progress;
  private volatile String message;
  private volatile Artifact artifact;
  private volatile String downloadUrl;
  private volatile String error;

  public DownloadJob(String jobId, DownloadRequest request) {
    this.jobId = jobId;
    this.request = request;
    this.status = JobStatus.PENDING;
    this.progress = JobProgress.INITIAL;
    this.message = "Starting download...";
  }

  /** Apply a throttled progress notification. Ignored once the job has ended. */
  public synchronized void applyProgress(JobProgress update) {
    if (isFinished()) {
      return;
    }
    this.progress = update;
    if (update.phase() == Phase.DOWNLOADING) {
      this.status = JobStatus.DOWNLOADING;
      this.message = "Downloading... " + update.percent() + "%";
    } else {
      this.status = JobStatus.PROCESSING;
      this.message = "Processing...";
    }
  }

  public synchronized void complete(Artifact artifact, String downloadUrl) {
    this.artifact = artifact;
    this.downloadUrl = downloadUrl;
    this.status = JobStatus.COMPLETED;
    this.progress = new JobProgress(100, Phase.DONE);
    this.message =
        String.format(
            Locale.ROOT,
            "Ready to download!%n%nFile: %s%nSize: %.1f MB%n%nDownload: %s",
            artifact.fileName(),
            artifact.sizeMegabytes(),
            downloadUrl);
  }

  public synchronized void fail(String error) {
    this.error = error;
    this.status = JobStatus.FAILED;
    this.message = "Download failed: " + error;
  }

  public boolean isFinished() {
    return status == JobStatus.COMPLETED || status == JobStatus.FAILED;
  }

  public String getJobId() {
    return jobId;
  }

  public DownloadRequest getRequest() {
    return request;
  }

  public JobStatus getStatus() {
    return status;
  }

  public JobProgress getProgress() {
    return progress;
  }

  public String getMessage() {
    return message;
  }

  public Artifact getArtifact() {
    return artifact;
  }

  public String getDownloadUrl() {
    return downloadUrl;
  }

  public String getError() {
    return error;
  }
}
