package com.scholary.mp3.fetcher.progress;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/** Test sink that records everything written to it and can simulate a disconnect. */
public class RecordingSink implements EventSink {

  public final List<ProgressEvent> events = new CopyOnWriteArrayList<>();
  public final AtomicInteger keepAlives = new AtomicInteger();
  public volatile boolean completed;
  public volatile Throwable abortCause;

  private final int failAfterWrites;
  private final AtomicInteger writes = new AtomicInteger();

  public RecordingSink() {
    this(Integer.MAX_VALUE);
  }

  /** A sink whose client disconnects after the given number of successful writes. */
  public RecordingSink(int failAfterWrites) {
    this.failAfterWrites = failAfterWrites;
  }

  @Override
  public void sendEvent(ProgressEvent event) throws IOException {
    checkConnected();
    events.add(event);
  }

  @Override
  public void sendKeepAlive() throws IOException {
    checkConnected();
    keepAlives.incrementAndGet();
  }

  @Override
  public void complete() {
    completed = true;
  }

  @Override
  public void abort(Throwable cause) {
    abortCause = cause;
  }

  private void checkConnected() throws IOException {
    if (writes.incrementAndGet() > failAfterWrites) {
      throw new IOException("Broken pipe");
    }
  }
}
