package com.scholary.video.fetcher.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for download jobs and the artifact directory.
 *
 * <p>Maps to the "fetcher.*" keys in application.yml. {@code publicBaseUrl} is optional; when it is
 * blank the file server address is derived from the LAN address and {@code server.port}. Audio-only
 * jobs are converted to {@code audioCodec} at {@code audioQuality} kbit/s.
 */
@ConfigurationProperties(prefix = "fetcher")
@Validated
public record DownloadProperties(
    @NotBlank String downloadDir,
    String publicBaseUrl,
    @NotNull Duration progressInterval,
    @Positive int listingLimit,
    @Positive int tokenStoreCapacity,
    @Positive int workerThreads,
    @Positive int workerQueueSize,
    @NotBlank String audioCodec,
    @Positive int audioQuality) {}
