package com.scholary.mp3.fetcher.job;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A finished conversion waiting to be downloaded or reclaimed.
 *
 * <p>The output file always sits directly inside a directory private to this job, so deleting
 * {@link #jobDirectory()} removes everything the job produced.
 */
public record Job(String token, Path outputPath, String displayName, Instant expiresAt) {

  public Job {
    if (token == null || token.isBlank()) {
      throw new IllegalArgumentException("token must not be blank");
    }
    if (outputPath == null || outputPath.getParent() == null) {
      throw new IllegalArgumentException("outputPath must live inside a job directory");
    }
  }

  public Path jobDirectory() {
    return outputPath.getParent();
  }
}
