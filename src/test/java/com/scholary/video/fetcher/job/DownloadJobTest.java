package com.scholary.video.fetcher.job;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.video.fetcher.progress.JobProgress;
import com.scholary.video.fetcher.progress.Phase;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class DownloadJobTest {

  private final DownloadJob job =
      new DownloadJob("job-1", new DownloadRequest("https://youtu.be/abc123", Quality.P720));

  @Test
  void newJob_shouldBePendingAtZero() {
    assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
    assertThat(job.getProgress()).isEqualTo(JobProgress.INITIAL);
    assertThat(job.getMessage()).isEqualTo("Starting download...");
  }

  @Test
  void applyProgress_shouldDescribeCurrentPhase() {
    job.applyProgress(JobProgress.downloading(42));
    assertThat(job.getStatus()).isEqualTo(JobStatus.DOWNLOADING);
    assertThat(job.getMessage()).isEqualTo("Downloading... 42%");

    job.applyProgress(JobProgress.PROCESSING);
    assertThat(job.getStatus()).isEqualTo(JobStatus.PROCESSING);
    assertThat(job.getMessage()).isEqualTo("Processing...");
  }

  @Test
  void complete_shouldDescribeArtifactAndIgnoreLateProgress() {
    Artifact artifact = new Artifact(Path.of("/dl/Title.mp4"), 3 * 1024 * 1024 + 512 * 1024);

    job.complete(artifact, "http://files.test/download/Title.mp4");
    job.applyProgress(JobProgress.PROCESSING);

    assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
    assertThat(job.getProgress().phase()).isEqualTo(Phase.DONE);
    assertThat(job.getMessage())
        .startsWith("Ready to download!")
        .contains("File: Title.mp4")
        .contains("Size: 3.5 MB")
        .contains("Download: http://files.test/download/Title.mp4");
    assertThat(job.isFinished()).isTrue();
  }

  @Test
  void fail_shouldKeepErrorForTheUser() {
    job.fail("Video unavailable");

    assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
    assertThat(job.getError()).isEqualTo("Video unavailable");
    assertThat(job.getMessage()).isEqualTo("Download failed: Video unavailable");
  }
}
