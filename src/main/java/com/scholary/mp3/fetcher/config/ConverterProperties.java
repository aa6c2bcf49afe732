package com.scholary.mp3.fetcher.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for conversion jobs.
 *
 * <p>Controls where job directories live, how long finished files are kept, how the external
 * engine is invoked and how many jobs may run at once.
 */
@ConfigurationProperties(prefix = "converter")
@Validated
public record ConverterProperties(
    @NotBlank String workDir,
    @NotNull Duration retention,
    @NotNull Duration keepAliveInterval,
    @NotBlank String audioFormat,
    @NotBlank String audioQuality,
    @NotBlank String ytDlpPath,
    String ffmpegLocation,
    String apiKey,
    @Positive int workerThreads,
    @Positive int workerQueueSize,
    @Positive int streamThreads,
    @Positive int reclaimerThreads) {

  /** True when a shared secret is configured and requests must carry it. */
  public boolean apiKeyRequired() {
    return apiKey != null && !apiKey.isBlank();
  }
}
