package com.scholary.video.fetcher.progress;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

/**
 * Republishes a job's progress to an observer at a fixed cadence.
 *
 * <p>On every tick the throttler reads the {@link ProgressSlot}. It notifies the observer only when
 * the percentage differs from the last one shown. Once the reading is terminal (100% or past the
 * download phase) it sends a single {@link JobProgress#PROCESSING} notification and stops.
 *
 * <p>Publishing is best-effort: observer failures are logged and the loop continues. An {@link
 * ObserverUnavailableException} cancels the loop. Cancellation is idempotent and is also checked at
 * the start of every tick, so a tick already in flight when {@link #cancel()} is called does
 * nothing.
 */
public class ProgressThrottler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProgressThrottler.class);

  private final String jobId;
  private final ProgressSlot slot;
  private final ProgressObserver observer;
  private final AtomicBoolean cancelled = new AtomicBoolean(false);

  private ScheduledFuture<?> scheduledTick;
  private int lastShownPercent = -1;

  public ProgressThrottler(String jobId, ProgressSlot slot, ProgressObserver observer) {
    this.jobId = jobId;
    this.slot = slot;
    this.observer = observer;
  }

  /**
   * Start ticking. The first tick fires one interval from now.
   *
   * @param scheduler the scheduler to run ticks on
   * @param interval time between ticks
   */
  public synchronized void start(TaskScheduler scheduler, Duration interval) {
    if (scheduledTick != null) {
      throw new IllegalStateException("Throttler for job " + jobId + " already started");
    }
    if (cancelled.get()) {
      return;
    }
    scheduledTick =
        scheduler.scheduleAtFixedRate(this::tick, Instant.now().plus(interval), interval);
  }

  /** Stop ticking. Safe to call more than once and before {@link #start}. */
  public void cancel() {
    if (!cancelled.compareAndSet(false, true)) {
      return;
    }
    synchronized (this) {
      if (scheduledTick != null) {
        scheduledTick.cancel(false);
      }
    }
    LOGGER.debug("Progress reporting stopped for job {}", jobId);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /** One wake-up of the reporting loop. Ticks never overlap when run at a fixed rate. */
  void tick() {
    if (cancelled.get()) {
      return;
    }

    JobProgress reading = slot.current();

    if (reading.isTerminal()) {
      publish(JobProgress.PROCESSING);
      cancel();
      return;
    }

    if (reading.percent() != lastShownPercent) {
      lastShownPercent = reading.percent();
      publish(reading);
    }
  }

  private void publish(JobProgress progress) {
    try {
      observer.onProgress(progress);
    } catch (ObserverUnavailableException e) {
      LOGGER.info("Progress observer for job {} is gone: {}", jobId, e.getMessage());
      cancel();
    } catch (RuntimeException e) {
      // Best-effort: a failed notification must never abort the job.
      LOGGER.warn("Failed to publish progress for job {}: {}", jobId, e.getMessage());
    }
  }
}
