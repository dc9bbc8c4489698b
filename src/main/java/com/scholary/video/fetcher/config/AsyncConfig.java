package com.scholary.video.fetcher.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Configuration for background job execution.
 *
 * <p>Extraction and re-encoding block for minutes, so they run on a bounded worker pool and never
 * on a request thread. Progress reporting runs on a separate small scheduler so a busy worker pool
 * cannot delay it.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "downloadExecutor")
  public ThreadPoolTaskExecutor downloadExecutor(DownloadProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.workerThreads());
    executor.setMaxPoolSize(properties.workerThreads());
    executor.setQueueCapacity(properties.workerQueueSize());
    executor.setThreadNamePrefix("download-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "progressScheduler")
  public ThreadPoolTaskScheduler progressScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(2);
    scheduler.setThreadNamePrefix("progress-");
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.initialize();
    return scheduler;
  }
}
