package com.scholary.mp3.fetcher.progress;

import com.scholary.mp3.fetcher.config.ConverterProperties;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Drains a {@link ProgressChannel} into an {@link EventSink}.
 *
 * <p>The loop polls the channel; whenever it is empty a keep-alive is written and the loop sleeps
 * for the idle interval. It ends as soon as the terminal event has been written, or when the
 * channel is drained, so a terminal event that lands just as the producer finishes is still
 * delivered and nothing follows it.
 *
 * <p>A failed write means the client has gone away. Streaming stops but the producing worker is
 * left alone: it still registers its job and the reclaimer still cleans up after it.
 */
@Component
public class ProgressStreamer {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProgressStreamer.class);

  static final String STREAM_FAILURE_MESSAGE = "internal server error in progress stream";

  private final Duration idleInterval;

  @Autowired
  public ProgressStreamer(ConverterProperties properties) {
    this(properties.keepAliveInterval());
  }

  public ProgressStreamer(Duration idleInterval) {
    this.idleInterval = idleInterval;
  }

  /**
   * Stream every event of the channel to the sink, blocking until the terminal event is written
   * or the client disconnects.
   *
   * @return true if the terminal event was delivered
   */
  public boolean stream(ProgressChannel channel, EventSink sink) {
    try {
      while (!channel.isDrained()) {
        Optional<ProgressEvent> next = channel.tryPop();
        if (next.isPresent()) {
          sink.sendEvent(next.get());
          if (next.get().isTerminal()) {
            break;
          }
        } else {
          sink.sendKeepAlive();
          Thread.sleep(idleInterval.toMillis());
        }
      }
      sink.complete();
      return true;

    } catch (IOException e) {
      LOGGER.info("Progress client disconnected: jobId={}", channel.getJobId());
      sink.abort(e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Progress stream interrupted: jobId={}", channel.getJobId());
      sink.abort(e);
    } catch (RuntimeException e) {
      LOGGER.error("Exception in progress stream: jobId={}", channel.getJobId(), e);
      try {
        sink.sendEvent(new ProgressEvent.Failed(STREAM_FAILURE_MESSAGE));
      } catch (IOException | RuntimeException sendFailure) {
        LOGGER.debug("Could not report stream failure to client: {}", sendFailure.getMessage());
      }
      sink.abort(e);
    }
    return false;
  }
}
