package com.scholary.mp3.fetcher.progress;

import java.io.IOException;

/**
 * Destination of a progress stream.
 *
 * <p>Any {@link IOException} means the client is gone and nothing more should be written.
 */
public interface EventSink {

  void sendEvent(ProgressEvent event) throws IOException;

  void sendKeepAlive() throws IOException;

  /** Called once after the terminal event has been written. */
  void complete();

  /** Called once if the stream ends abnormally. */
  void abort(Throwable cause);
}
