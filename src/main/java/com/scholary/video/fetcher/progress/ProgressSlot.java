package com.scholary.video.fetcher.progress;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Single-slot progress channel between a job worker and its throttler.
 *
 * <p>The worker overwrites the slot as often as the extraction engine reports; the throttler reads
 * whatever is there on each tick. Only the latest value is kept.
 */
public class ProgressSlot implements Consumer<JobProgress> {

  private final Lock lock = new ReentrantLock();
  private JobProgress current = JobProgress.INITIAL;

  @Override
  public void accept(JobProgress progress) {
    lock.lock();
    try {
      current = progress;
    } finally {
      lock.unlock();
    }
  }

  public JobProgress current() {
    lock.lock();
    try {
      return current;
    } finally {
      lock.unlock();
    }
  }
}
