package com.scholary.mp3.fetcher.service;

import com.scholary.mp3.fetcher.progress.ProgressChannel;
import java.util.concurrent.Future;

/**
 * A conversion that has been started but has not yet pushed its terminal event.
 *
 * <p>Held by the orchestrator only while the worker runs, together with the worker's task handle.
 */
public class ConversionJob {

  private final String token;
  private final ConversionRequest request;
  private final ProgressChannel channel;

  private volatile ConversionState state;
  private volatile Future<?> task;

  public ConversionJob(String token, ConversionRequest request, ProgressChannel channel) {
    this.token = token;
    this.request = request;
    this.channel = channel;
    this.state = ConversionState.CREATED;
  }

  public String getToken() {
    return token;
  }

  public ConversionRequest getRequest() {
    return request;
  }

  public ProgressChannel getChannel() {
    return channel;
  }

  public ConversionState getState() {
    return state;
  }

  void setState(ConversionState state) {
    this.state = state;
  }

  public Future<?> getTask() {
    return task;
  }

  void setTask(Future<?> task) {
    this.task = task;
  }
}
