package com.scholary.mp3.fetcher.progress;

import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Ordered, unbounded event queue between one conversion worker and one stream consumer.
 *
 * <p>The worker calls {@link #push} for intermediate events and {@link #finish} once with the
 * terminal event. The consumer polls {@link #tryPop} and stops when {@link #isDrained()} is true,
 * which only happens after the terminal event has been both enqueued and taken.
 *
 * <p>Producer calls are serialized so nothing can be enqueued behind the terminal event.
 */
public class ProgressChannel {

  private final String jobId;
  private final Queue<ProgressEvent> queue = new ConcurrentLinkedQueue<>();
  private final Object producerLock = new Object();
  private boolean finished;
  private volatile boolean complete;

  public ProgressChannel(String jobId) {
    this.jobId = jobId;
  }

  public String getJobId() {
    return jobId;
  }

  /**
   * Append an intermediate event.
   *
   * @return false if the channel is already finished and the event was dropped
   * @throws IllegalArgumentException for terminal events, which must go through {@link #finish}
   */
  public boolean push(ProgressEvent event) {
    if (event.isTerminal()) {
      throw new IllegalArgumentException("terminal events must be pushed with finish()");
    }
    synchronized (producerLock) {
      if (finished) {
        return false;
      }
      return queue.offer(event);
    }
  }

  /**
   * Append the terminal event and mark the channel complete.
   *
   * <p>The event is enqueued before the completion flag is raised. Only the first call has any
   * effect.
   *
   * @return true if this call closed the channel
   */
  public boolean finish(ProgressEvent terminal) {
    if (!terminal.isTerminal()) {
      throw new IllegalArgumentException("finish() requires a terminal event: " + terminal);
    }
    synchronized (producerLock) {
      if (finished) {
        return false;
      }
      finished = true;
      queue.offer(terminal);
      complete = true;
      return true;
    }
  }

  public Optional<ProgressEvent> tryPop() {
    return Optional.ofNullable(queue.poll());
  }

  public boolean isComplete() {
    return complete;
  }

  /** True once the producer has finished and every event, terminal included, has been taken. */
  public boolean isDrained() {
    return complete && queue.isEmpty();
  }
}
