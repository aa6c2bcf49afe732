package com.scholary.mp3.fetcher.service;

import com.scholary.mp3.fetcher.cleanup.ResourceReclaimer;
import com.scholary.mp3.fetcher.config.ConverterProperties;
import com.scholary.mp3.fetcher.engine.EngineException;
import com.scholary.mp3.fetcher.engine.EngineListener;
import com.scholary.mp3.fetcher.engine.EngineProgress;
import com.scholary.mp3.fetcher.engine.MediaEngine;
import com.scholary.mp3.fetcher.engine.MediaInfo;
import com.scholary.mp3.fetcher.job.Job;
import com.scholary.mp3.fetcher.job.JobStore;
import com.scholary.mp3.fetcher.logging.StructuredLogger;
import com.scholary.mp3.fetcher.output.Deliverable;
import com.scholary.mp3.fetcher.output.DeliverableAssembler;
import com.scholary.mp3.fetcher.output.OutputNotFoundException;
import com.scholary.mp3.fetcher.progress.ProgressChannel;
import com.scholary.mp3.fetcher.progress.ProgressEvent;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Drives conversion jobs from URL to registered download.
 *
 * <p>Per job:
 *
 * <ol>
 *   <li>Allocate a private temp directory and a progress channel
 *   <li>Run the engine on a worker thread, translating its callbacks into progress events
 *   <li>Assemble the deliverable (single file or playlist zip)
 *   <li>Register the job and arm its reclamation timer
 * </ol>
 *
 * <p>Every job ends with exactly one terminal event on its channel, pushed from a finally block.
 * On failure the temp directory is deleted straight away.
 */
@Service
public class ConversionOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConversionOrchestrator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String CONVERTING_NOTE = "download finished, converting...";
  static final String UNKNOWN_ERROR = "unknown error";
  static final String BUSY_MESSAGE = "server busy, try again later";
  private static final String JOB_DIR_PREFIX = "ydl_";

  private final MediaEngine engine;
  private final DeliverableAssembler assembler;
  private final JobStore jobStore;
  private final ResourceReclaimer reclaimer;
  private final AsyncTaskExecutor executor;
  private final Clock clock;

  private final Path workDir;
  private final Duration retention;

  private final Map<String, ConversionJob> activeJobs = new ConcurrentHashMap<>();

  public ConversionOrchestrator(
      MediaEngine engine,
      DeliverableAssembler assembler,
      JobStore jobStore,
      ResourceReclaimer reclaimer,
      @Qualifier("conversionExecutor") AsyncTaskExecutor executor,
      Clock clock,
      ConverterProperties properties) {

    this.engine = engine;
    this.assembler = assembler;
    this.jobStore = jobStore;
    this.reclaimer = reclaimer;
    this.executor = executor;
    this.clock = clock;
    this.workDir = Paths.get(properties.workDir());
    this.retention = properties.retention();

    try {
      Files.createDirectories(this.workDir);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to create work directory: " + workDir, e);
    }
  }

  /**
   * Start a conversion in the background.
   *
   * <p>Returns immediately. Progress and the final outcome arrive on the handle's channel.
   */
  public ConversionHandle start(String url) {
    String token = UUID.randomUUID().toString();
    ProgressChannel channel = new ProgressChannel(token);

    Path tempDir;
    try {
      tempDir = createJobDirectory();
    } catch (IOException e) {
      LOGGER.error("Failed to allocate job directory: jobId={}", token, e);
      channel.finish(new ProgressEvent.Failed("failed to allocate job directory"));
      return new ConversionHandle(token, channel);
    }

    ConversionJob job = new ConversionJob(token, new ConversionRequest(url, tempDir), channel);
    activeJobs.put(token, job);
    try {
      Future<?> task = executor.submit(() -> runJob(job));
      job.setTask(task);
    } catch (TaskRejectedException e) {
      LOGGER.warn("Conversion rejected, worker pool saturated: jobId={}", token);
      activeJobs.remove(token);
      reclaimer.deleteDirectory(tempDir);
      job.setState(ConversionState.FAILED);
      channel.finish(new ProgressEvent.Failed(BUSY_MESSAGE));
    }
    return new ConversionHandle(token, channel);
  }

  /**
   * Convert synchronously on the calling thread.
   *
   * <p>On success the caller owns the returned temp directory. On failure it has already been
   * deleted.
   *
   * @throws EngineException if the engine fails
   * @throws OutputNotFoundException if no output was produced
   * @throws ConversionException for any other failure, carrying the cause's message
   */
  public ConversionResult convert(String url) {
    String jobId = UUID.randomUUID().toString();
    Path tempDir;
    try {
      tempDir = createJobDirectory();
    } catch (IOException e) {
      throw new ConversionException("failed to allocate job directory", e);
    }

    StructuredLogger.setJobContext(jobId, url);
    try {
      structuredLogger.logJobStarted(jobId, url);
      long startTime = System.currentTimeMillis();
      Deliverable deliverable = produce(new ConversionRequest(url, tempDir), EngineListener.NONE);
      structuredLogger.logJobSucceeded(
          jobId,
          deliverable.displayName(),
          deliverable.archive(),
          System.currentTimeMillis() - startTime);
      return new ConversionResult(tempDir, deliverable);

    } catch (IOException e) {
      structuredLogger.logJobFailed(jobId, e);
      reclaimer.deleteDirectory(tempDir);
      throw new ConversionException(messageOf(e), e);
    } catch (EngineException | OutputNotFoundException | ConversionException e) {
      structuredLogger.logJobFailed(jobId, e);
      reclaimer.deleteDirectory(tempDir);
      throw e;
    } catch (RuntimeException e) {
      structuredLogger.logJobFailed(jobId, e);
      reclaimer.deleteDirectory(tempDir);
      throw new ConversionException(messageOf(e), e);
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  public int activeJobCount() {
    return activeJobs.size();
  }

  public Optional<ConversionJob> findActive(String token) {
    return Optional.ofNullable(activeJobs.get(token));
  }

  /** Worker body. Always leaves exactly one terminal event on the channel. */
  void runJob(ConversionJob job) {
    String token = job.getToken();
    ConversionRequest request = job.getRequest();
    ProgressChannel channel = job.getChannel();
    StructuredLogger.setJobContext(token, request.url());

    ProgressEvent terminal = null;
    try {
      job.setState(ConversionState.RUNNING);
      structuredLogger.logJobStarted(token, request.url());
      long startTime = System.currentTimeMillis();

      Deliverable deliverable = produce(request, listenerFor(channel));
      register(token, deliverable);

      job.setState(ConversionState.SUCCEEDED);
      terminal = new ProgressEvent.Done(token, deliverable.displayName());
      structuredLogger.logJobSucceeded(
          token,
          deliverable.displayName(),
          deliverable.archive(),
          System.currentTimeMillis() - startTime);

    } catch (Exception e) {
      structuredLogger.logJobFailed(token, e);
      reclaimer.deleteDirectory(request.tempDir());
      job.setState(ConversionState.FAILED);
      terminal = new ProgressEvent.Failed(messageOf(e));
    } finally {
      if (terminal == null) {
        LOGGER.error("Worker ended abnormally: jobId={}", token);
        reclaimer.deleteDirectory(request.tempDir());
        job.setState(ConversionState.FAILED);
        terminal = new ProgressEvent.Failed(UNKNOWN_ERROR);
      }
      activeJobs.remove(token);
      channel.finish(terminal);
      StructuredLogger.clearJobContext();
    }
  }

  private Deliverable produce(ConversionRequest request, EngineListener listener)
      throws IOException {
    MediaInfo info = engine.extract(request.url(), request.tempDir(), listener);
    return assembler.assemble(info, request.tempDir(), engine.outputExtension());
  }

  private void register(String token, Deliverable deliverable) {
    Job job =
        new Job(token, deliverable.path(), deliverable.displayName(), clock.instant().plus(retention));
    jobStore.put(job);
    try {
      reclaimer.schedule(token, retention);
    } catch (RuntimeException e) {
      jobStore.takeIfPresent(token);
      throw e;
    }
  }

  private EngineListener listenerFor(ProgressChannel channel) {
    return progress -> {
      try {
        toEvent(progress).ifPresent(channel::push);
      } catch (RuntimeException e) {
        LOGGER.warn("Progress callback error: jobId={}", channel.getJobId(), e);
      }
    };
  }

  /** Map an engine callback onto a progress event, if it has one. */
  static Optional<ProgressEvent> toEvent(EngineProgress progress) {
    if (progress.isDownloading()) {
      return Optional.of(
          new ProgressEvent.Downloading(
              percentOf(progress), progress.speed(), progress.eta(), progress.filename()));
    }
    if (progress.isFinished()) {
      return Optional.of(new ProgressEvent.StatusNote(CONVERTING_NOTE));
    }
    return Optional.empty();
  }

  /** downloaded / total * 100, using the size estimate when the exact size is unknown. */
  static Double percentOf(EngineProgress progress) {
    double total = 0;
    if (progress.totalBytes() != null && progress.totalBytes() > 0) {
      total = progress.totalBytes();
    } else if (progress.totalBytesEstimate() != null && progress.totalBytesEstimate() > 0) {
      total = progress.totalBytesEstimate();
    }
    if (total <= 0) {
      return null;
    }
    long downloaded = progress.downloadedBytes() != null ? progress.downloadedBytes() : 0;
    double percent = downloaded / total * 100;
    return Math.max(0, Math.min(100, percent));
  }

  private static String messageOf(Throwable e) {
    String message = e.getMessage();
    return message != null && !message.isBlank() ? message : UNKNOWN_ERROR;
  }

  private Path createJobDirectory() throws IOException {
    return Files.createTempDirectory(workDir, JOB_DIR_PREFIX);
  }
}
