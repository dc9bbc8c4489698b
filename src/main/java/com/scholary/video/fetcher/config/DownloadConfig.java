package com.scholary.video.fetcher.config;

import com.scholary.video.fetcher.token.LinkTokenStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for download-related beans.
 *
 * <p>Enables the DownloadProperties to be loaded from application.yml and owns the process-wide
 * link token store.
 */
@Configuration
@EnableConfigurationProperties(DownloadProperties.class)
public class DownloadConfig {

  @Bean
  public LinkTokenStore linkTokenStore(DownloadProperties properties) {
    return new LinkTokenStore(properties.tokenStoreCapacity());
  }
}
