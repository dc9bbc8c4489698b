package com.scholary.video.fetcher.job;

import com.scholary.video.fetcher.extraction.ProgressEvent;
import com.scholary.video.fetcher.extraction.ProgressHook;
import com.scholary.video.fetcher.progress.JobProgress;
import java.util.function.Consumer;

/**
 * Turns raw byte counts from the engine into job progress.
 *
 * <p>While downloading, the percentage is downloaded/total (or the estimate when the total is
 * unknown), and only changes are forwarded. A finished download is reported as {@link
 * JobProgress#PROCESSING}, since merging or re-encoding follows.
 */
class ByteProgressHook implements ProgressHook {

  private final Consumer<JobProgress> onProgress;
  private int lastPercent = -1;

  ByteProgressHook(Consumer<JobProgress> onProgress) {
    this.onProgress = onProgress;
  }

  @Override
  public void onProgress(ProgressEvent event) {
    switch (event.status()) {
      case DOWNLOADING:
        long total = event.totalBytes() > 0 ? event.totalBytes() : event.totalBytesEstimate();
        if (total <= 0) {
          return;
        }
        int percent = (int) Math.min(100, event.downloadedBytes() * 100 / total);
        if (percent != lastPercent) {
          lastPercent = percent;
          onProgress.accept(JobProgress.downloading(percent));
        }
        break;
      case FINISHED:
        onProgress.accept(JobProgress.PROCESSING);
        break;
      default:
        break;
    }
  }
}
