package com.scholary.video.fetcher.extraction;

/** Called by the extraction engine, possibly many times a second, on the job's worker thread. */
@FunctionalInterface
public interface ProgressHook {

  void onProgress(ProgressEvent event);
}
