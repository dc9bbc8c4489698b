package com.scholary.video.fetcher.config;

import com.scholary.video.fetcher.extraction.ExtractionOptions;
import com.scholary.video.fetcher.extraction.YtDlpProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the extraction engine.
 *
 * <p>Enables the YtDlpProperties and turns the environment-specific parts of them into the
 * ExtractionOptions handed to every extraction call.
 */
@Configuration
@EnableConfigurationProperties(YtDlpProperties.class)
public class ExtractionConfig {

  @Bean
  public ExtractionOptions extractionOptions(YtDlpProperties properties) {
    return new ExtractionOptions(properties.cookiesFromBrowser(), properties.remoteComponents());
  }
}
