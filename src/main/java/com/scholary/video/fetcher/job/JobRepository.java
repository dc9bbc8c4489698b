package com.scholary.video.fetcher.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory store of the download jobs users poll.
 *
 * <p>A job is kept for a fixed time after it was last recorded. The controller records a job once
 * when it is created and again when it finishes, so a finished job stays pollable for the whole
 * retention period no matter how long the download took. Jobs are not persisted; a restart
 * forgets them (the files stay in the artifact directory).
 */
@Repository
public class JobRepository {

  private final Cache<String, DownloadJob> jobs;

  @Autowired
  public JobRepository(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes) {
    this(maxSize, Duration.ofMinutes(expireAfterMinutes), Ticker.systemTicker());
  }

  JobRepository(int maxSize, Duration retention, Ticker ticker) {
    this.jobs =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(retention)
            .ticker(ticker)
            .build();
  }

  /** Create a pending job under a fresh random ID and record it. */
  public DownloadJob create(DownloadRequest request) {
    String jobId;
    do {
      jobId = UUID.randomUUID().toString();
    } while (jobs.getIfPresent(jobId) != null);
    DownloadJob job = new DownloadJob(jobId, request);
    jobs.put(jobId, job);
    return job;
  }

  /** Record the job's latest state; restarts its retention period. */
  public void save(DownloadJob job) {
    jobs.put(job.getJobId(), job);
  }

  public Optional<DownloadJob> findById(String jobId) {
    return Optional.ofNullable(jobs.getIfPresent(jobId));
  }
}
