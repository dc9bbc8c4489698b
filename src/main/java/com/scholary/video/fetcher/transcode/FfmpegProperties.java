package com.scholary.video.fetcher.transcode;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg re-encoding.
 *
 * <p>Maps to the "ffmpeg.*" keys in application.yml. Defaults: preset fast, CRF 23, 192k AAC.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String executable,
    @NotBlank String preset,
    @PositiveOrZero int crf,
    @NotBlank String audioBitrate) {}
