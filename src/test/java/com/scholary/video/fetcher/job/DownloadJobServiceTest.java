package com.scholary.video.fetcher.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.video.fetcher.progress.JobProgress;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.scheduling.TaskScheduler;

/** Tests for DownloadJobService: job completion and the lifetime of progress reporting. */
@ExtendWith(MockitoExtension.class)
class DownloadJobServiceTest {

  private static final Duration INTERVAL = Duration.ofSeconds(2);
  private static final DownloadRequest REQUEST =
      new DownloadRequest("https://youtu.be/abc123", Quality.P720);

  @Mock private DownloadJobExecutor jobExecutor;
  @Mock private TaskScheduler scheduler;
  @Mock private ScheduledFuture<?> tick;

  private DownloadJobService service;

  @BeforeEach
  void setUp() {
    // Runs jobs on the calling thread
    Executor direct = Runnable::run;
    service = new DownloadJobService(jobExecutor, direct, scheduler, INTERVAL);
  }

  private void stubScheduler() {
    doReturn(tick)
        .when(scheduler)
        .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), eq(INTERVAL));
  }

  @Test
  void submit_shouldCompleteWithArtifactAndStopReporting() {
    stubScheduler();
    Artifact artifact = new Artifact(Path.of("/downloads/Title.mp4"), 1024);
    when(jobExecutor.run(eq(REQUEST), any())).thenReturn(artifact);

    CompletableFuture<Artifact> result = service.submit("job-1", REQUEST, progress -> {});

    assertThat(result.join()).isEqualTo(artifact);
    verify(tick).cancel(false);
  }

  @Test
  void submit_shouldFailWithDownloadFailureAndStopReporting() {
    stubScheduler();
    when(jobExecutor.run(eq(REQUEST), any()))
        .thenThrow(new DownloadFailedException("Video unavailable"));

    CompletableFuture<Artifact> result = service.submit("job-2", REQUEST, progress -> {});

    assertThatThrownBy(result::join)
        .isInstanceOf(CompletionException.class)
        .hasCauseInstanceOf(DownloadFailedException.class)
        .hasRootCauseMessage("Video unavailable");
    verify(tick).cancel(false);
  }

  @Test
  void submit_shouldWrapUnexpectedErrors() {
    stubScheduler();
    when(jobExecutor.run(eq(REQUEST), any())).thenThrow(new IllegalStateException("boom"));

    CompletableFuture<Artifact> result = service.submit("job-3", REQUEST, progress -> {});

    assertThatThrownBy(result::join)
        .hasCauseInstanceOf(DownloadFailedException.class)
        .cause()
        .hasMessage("Unexpected error: boom");
    verify(tick).cancel(false);
  }

  @Test
  void submit_shouldForwardWorkerProgressToObserverOnTick() {
    stubScheduler();
    List<JobProgress> shown = new ArrayList<>();
    when(jobExecutor.run(eq(REQUEST), any()))
        .thenAnswer(
            invocation -> {
              Consumer<JobProgress> onProgress = invocation.getArgument(1);
              onProgress.accept(JobProgress.downloading(40));

              ArgumentCaptor<Runnable> scheduledTick = ArgumentCaptor.forClass(Runnable.class);
              verify(scheduler)
                  .scheduleAtFixedRate(scheduledTick.capture(), any(Instant.class), eq(INTERVAL));
              scheduledTick.getValue().run();
              return new Artifact(Path.of("/downloads/Title.mp4"), 1);
            });

    service.submit("job-4", REQUEST, shown::add).join();

    assertThat(shown).containsExactly(JobProgress.downloading(40));
  }

  @Test
  void submit_shouldClearJobContextAfterRunning() {
    stubScheduler();
    when(jobExecutor.run(eq(REQUEST), any()))
        .thenAnswer(
            invocation -> {
              assertThat(MDC.get("jobId")).isEqualTo("job-5");
              return new Artifact(Path.of("/downloads/Title.mp4"), 1);
            });

    service.submit("job-5", REQUEST, progress -> {}).join();

    assertThat(MDC.get("jobId")).isNull();
  }

  @Test
  void submit_shouldFailFastWhenWorkersAreSaturated() {
    stubScheduler();
    Executor full =
        command -> {
          throw new RejectedExecutionException("queue full");
        };
    DownloadJobService saturated = new DownloadJobService(jobExecutor, full, scheduler, INTERVAL);

    CompletableFuture<Artifact> result = saturated.submit("job-6", REQUEST, progress -> {});

    assertThatThrownBy(result::join).hasCauseInstanceOf(DownloadFailedException.class);
    verify(tick).cancel(false);
    verify(jobExecutor, never()).run(any(), any());
  }
}
