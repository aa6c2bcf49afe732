package com.scholary.mp3.fetcher.cleanup;

import com.scholary.mp3.fetcher.job.Job;
import com.scholary.mp3.fetcher.job.JobStore;
import com.scholary.mp3.fetcher.logging.StructuredLogger;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

/**
 * Deletes job directories once nobody is going to ask for them.
 *
 * <p>Each finished job gets a one-shot timer. When it fires the job is taken from the store; if
 * the download endpoint already took it the timer does nothing. All deletion is best-effort:
 * failures are logged and never reach a caller.
 */
@Component
public class ResourceReclaimer {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResourceReclaimer.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final JobStore jobStore;
  private final TaskScheduler scheduler;
  private final Clock clock;

  public ResourceReclaimer(
      JobStore jobStore,
      @Qualifier("reclaimerScheduler") TaskScheduler scheduler,
      Clock clock) {
    this.jobStore = jobStore;
    this.scheduler = scheduler;
    this.clock = clock;
  }

  /** Arm a one-shot reclamation for the token after the given delay. */
  public void schedule(String token, Duration delay) {
    scheduler.schedule(() -> reclaim(token), clock.instant().plus(delay));
    LOGGER.debug("Reclamation scheduled: jobId={}, delay={}", token, delay);
  }

  /**
   * Take the job for the token and delete its directory.
   *
   * @return true if this call reclaimed the job, false if it had already been consumed
   */
  public boolean reclaim(String token) {
    Optional<Job> job = jobStore.takeIfPresent(token);
    if (job.isEmpty()) {
      LOGGER.debug("Nothing to reclaim, job already consumed: jobId={}", token);
      return false;
    }
    deleteJobDirectory(job.get());
    structuredLogger.logJobReclaimed(token, "expired");
    return true;
  }

  /** Delete everything a job produced. */
  public void deleteJobDirectory(Job job) {
    deleteDirectory(job.jobDirectory());
  }

  /** Recursively delete a directory, logging instead of throwing on failure. */
  public void deleteDirectory(Path directory) {
    if (directory == null) {
      return;
    }
    try {
      boolean deleted = FileSystemUtils.deleteRecursively(directory);
      if (deleted) {
        LOGGER.debug("Deleted directory: {}", directory);
      }
    } catch (IOException | RuntimeException e) {
      LOGGER.warn("Failed to delete directory {}: {}", directory, e.getMessage(), e);
    }
  }
}
