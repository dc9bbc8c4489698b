package com.scholary.video.fetcher.job;

public enum JobStatus {
  PENDING,
  DOWNLOADING,
  PROCESSING,
  COMPLETED,
  FAILED
}
