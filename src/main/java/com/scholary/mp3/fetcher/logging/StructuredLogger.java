package com.scholary.mp3.fetcher.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Job lifecycle events carry an {@code event_type} field plus event-specific fields so they
 * can be filtered in a log aggregator.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log job started event. */
  public void logJobStarted(String jobId, String url) {
    try {
      MDC.put("event_type", "job_started");
      logger.info("Job started: jobId={}, url={}", jobId, url);
    } finally {
      clearEventFields();
    }
  }

  /** Log job succeeded event. */
  public void logJobSucceeded(String jobId, String displayName, boolean archive, long elapsedMs) {
    try {
      MDC.put("event_type", "job_succeeded");
      MDC.put("displayName", displayName);
      MDC.put("archive", String.valueOf(archive));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Job succeeded: jobId={}, file={}, archive={}, elapsed={}ms",
          jobId,
          displayName,
          archive,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log job failed event. */
  public void logJobFailed(String jobId, Throwable error) {
    try {
      MDC.put("event_type", "job_failed");
      MDC.put("errorType", error.getClass().getSimpleName());

      logger.error("Job failed: jobId={}, error={}", jobId, error.getMessage(), error);
    } finally {
      clearEventFields();
    }
  }

  /** Log job reclaimed event. */
  public void logJobReclaimed(String jobId, String reason) {
    try {
      MDC.put("event_type", "job_reclaimed");
      MDC.put("reason", reason);

      logger.info("Job reclaimed: jobId={}, reason={}", jobId, reason);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String url) {
    MDC.put("jobId", jobId);
    if (url != null) {
      MDC.put("url", url);
    }
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("url");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("displayName");
    MDC.remove("archive");
    MDC.remove("elapsedMs");
    MDC.remove("errorType");
    MDC.remove("reason");
  }
}
