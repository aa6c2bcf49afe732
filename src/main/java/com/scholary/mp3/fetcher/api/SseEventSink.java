package com.scholary.mp3.fetcher.api;

import com.scholary.mp3.fetcher.progress.EventSink;
import com.scholary.mp3.fetcher.progress.ProgressEvent;
import java.io.IOException;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Writes progress events to an {@link SseEmitter}.
 *
 * <p>Events become named SSE events with a JSON data line; keep-alives become comment lines.
 */
class SseEventSink implements EventSink {

  static final String KEEP_ALIVE = "keep-alive";

  private final SseEmitter emitter;

  SseEventSink(SseEmitter emitter) {
    this.emitter = emitter;
  }

  @Override
  public void sendEvent(ProgressEvent event) throws IOException {
    send(SseEmitter.event().name(event.eventName()).data(event.payload(), MediaType.APPLICATION_JSON));
  }

  @Override
  public void sendKeepAlive() throws IOException {
    send(SseEmitter.event().comment(KEEP_ALIVE));
  }

  @Override
  public void complete() {
    emitter.complete();
  }

  @Override
  public void abort(Throwable cause) {
    emitter.completeWithError(cause);
  }

  private void send(SseEmitter.SseEventBuilder builder) throws IOException {
    try {
      emitter.send(builder);
    } catch (IllegalStateException e) {
      // emitter already completed by the container (timeout or client gone)
      throw new IOException("SSE emitter closed", e);
    }
  }
}
