package com.scholary.video.fetcher.extraction;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the yt-dlp binding.
 *
 * <p>{@code cookiesFromBrowser} and {@code remoteComponents} are optional and environment
 * specific; they are passed through as ExtractionOptions.
 */
@ConfigurationProperties(prefix = "ytdlp")
@Validated
public record YtDlpProperties(
    @NotBlank String executable,
    String cookiesFromBrowser,
    List<String> remoteComponents,
    @Positive int probeTimeoutSeconds) {}
