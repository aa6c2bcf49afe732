package com.scholary.mp3.fetcher.api;

import com.scholary.mp3.fetcher.cleanup.ResourceReclaimer;
import com.scholary.mp3.fetcher.job.Job;
import com.scholary.mp3.fetcher.job.JobStore;
import com.scholary.mp3.fetcher.output.Deliverable;
import com.scholary.mp3.fetcher.output.OutputNotFoundException;
import com.scholary.mp3.fetcher.progress.ProgressEvent;
import com.scholary.mp3.fetcher.progress.ProgressStreamer;
import com.scholary.mp3.fetcher.service.ConversionHandle;
import com.scholary.mp3.fetcher.service.ConversionOrchestrator;
import com.scholary.mp3.fetcher.service.ConversionResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

/**
 * REST API for URL-to-MP3 conversion.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Starting a conversion and streaming its progress as Server-Sent Events
 *   <li>One-shot download of a finished job by token
 *   <li>Synchronous conversion that returns the file directly
 * </ul>
 *
 * <p>The API key check runs in {@link ApiKeyInterceptor} before any of these handlers.
 */
@RestController
@Tag(name = "Conversion", description = "Media URL to MP3 conversion API")
public class ConversionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConversionController.class);

  private final ConversionOrchestrator orchestrator;
  private final ProgressStreamer streamer;
  private final JobStore jobStore;
  private final ResourceReclaimer reclaimer;
  private final SourceUrlValidator urlValidator;
  private final AsyncTaskExecutor streamExecutor;

  public ConversionController(
      ConversionOrchestrator orchestrator,
      ProgressStreamer streamer,
      JobStore jobStore,
      ResourceReclaimer reclaimer,
      SourceUrlValidator urlValidator,
      @Qualifier("streamExecutor") AsyncTaskExecutor streamExecutor) {
    this.orchestrator = orchestrator;
    this.streamer = streamer;
    this.jobStore = jobStore;
    this.reclaimer = reclaimer;
    this.urlValidator = urlValidator;
    this.streamExecutor = streamExecutor;
  }

  /**
   * Start a conversion and stream its progress.
   *
   * <p>Emits {@code progress} events while the job runs, then exactly one {@code done} (with the
   * download token) or {@code error} event, after which the stream is closed. Idle periods are
   * filled with keep-alive comments.
   */
  @GetMapping("/progress")
  @Operation(
      summary = "Convert with live progress",
      description =
          "Start a conversion in the background and stream its progress as Server-Sent Events. "
              + "The final 'done' event carries a token for /download/{token}.")
  public SseEmitter progress(@RequestParam(value = "url", required = false) String url) {
    urlValidator.validate(url);

    ConversionHandle handle = orchestrator.start(url);
    LOGGER.info("Streaming progress: jobId={}", handle.token());

    // no timeout; the stream ends with the terminal event
    SseEmitter emitter = new SseEmitter(0L);
    SseEventSink sink = new SseEventSink(emitter);
    try {
      streamExecutor.execute(() -> streamer.stream(handle.channel(), sink));
    } catch (TaskRejectedException e) {
      LOGGER.warn("No stream thread available: jobId={}", handle.token());
      try {
        sink.sendEvent(new ProgressEvent.Failed("server busy, progress unavailable"));
        sink.complete();
      } catch (IOException sendFailure) {
        sink.abort(sendFailure);
      }
    }
    return emitter;
  }

  /**
   * Download a finished job's file.
   *
   * <p>The token is consumed: a second request gets 404. The job directory is deleted once the
   * transfer ends, whether or not it completed.
   */
  @GetMapping("/download/{token}")
  @Operation(
      summary = "Download converted file",
      description = "Fetch the file of a finished job once. The token is invalid afterwards.")
  public ResponseEntity<StreamingResponseBody> download(@PathVariable String token) {
    Job job = jobStore.takeIfPresent(token).orElseThrow(() -> new JobNotFoundException(token));
    LOGGER.info("Serving download: jobId={}, file={}", token, job.displayName());
    return attachment(
        job.outputPath(),
        job.displayName(),
        job.jobDirectory(),
        () -> new JobNotFoundException(token));
  }

  /**
   * Convert synchronously and return the file.
   *
   * <p>Blocks until the conversion finishes. Failures are returned as 500 with the error message.
   */
  @GetMapping("/fetch")
  @Operation(
      summary = "Convert and download",
      description = "Convert the URL and return the resulting file in the same response.")
  public ResponseEntity<StreamingResponseBody> fetch(
      @RequestParam(value = "url", required = false) String url) {
    urlValidator.validate(url);

    ConversionResult result = orchestrator.convert(url);
    Deliverable deliverable = result.deliverable();
    return attachment(
        deliverable.path(),
        deliverable.displayName(),
        result.tempDir(),
        () -> new OutputNotFoundException("expected output file not found"));
  }

  private ResponseEntity<StreamingResponseBody> attachment(
      Path file,
      String displayName,
      Path directoryToDelete,
      Supplier<RuntimeException> whenMissing) {
    long size;
    try {
      size = Files.size(file);
    } catch (IOException e) {
      LOGGER.warn("Output file vanished before transfer: {}", file);
      reclaimer.deleteDirectory(directoryToDelete);
      throw whenMissing.get();
    }

    StreamingResponseBody body =
        out -> {
          try {
            Files.copy(file, out);
            out.flush();
          } finally {
            reclaimer.deleteDirectory(directoryToDelete);
          }
        };

    MediaType contentType =
        MediaTypeFactory.getMediaType(displayName).orElse(MediaType.APPLICATION_OCTET_STREAM);
    ContentDisposition disposition =
        ContentDisposition.attachment().filename(displayName, StandardCharsets.UTF_8).build();

    return ResponseEntity.ok()
        .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
        .contentType(contentType)
        .contentLength(size)
        .body(body);
  }
}
