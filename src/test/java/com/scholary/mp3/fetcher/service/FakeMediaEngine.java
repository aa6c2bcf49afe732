package com.scholary.mp3.fetcher.service;

import com.scholary.mp3.fetcher.engine.EngineListener;
import com.scholary.mp3.fetcher.engine.EngineProgress;
import com.scholary.mp3.fetcher.engine.MediaEngine;
import com.scholary.mp3.fetcher.engine.MediaInfo;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/** Scripted engine: reports the given progress, writes the given files, returns the info. */
class FakeMediaEngine implements MediaEngine {

  private final MediaInfo info;
  private final List<String> files;
  private final List<EngineProgress> progress;
  private RuntimeException failure;
  private Error error;
  private CountDownLatch gate;
  volatile Path lastOutputDir;

  FakeMediaEngine(MediaInfo info, List<String> files, List<EngineProgress> progress) {
    this.info = info;
    this.files = files;
    this.progress = progress;
  }

  FakeMediaEngine failingWith(RuntimeException failure) {
    this.failure = failure;
    return this;
  }

  FakeMediaEngine crashingWith(Error error) {
    this.error = error;
    return this;
  }

  /** Block inside extract until the latch opens. */
  FakeMediaEngine waitingFor(CountDownLatch gate) {
    this.gate = gate;
    return this;
  }

  @Override
  public MediaInfo extract(String url, Path outputDir, EngineListener listener) {
    lastOutputDir = outputDir;
    progress.forEach(listener::onProgress);
    if (gate != null) {
      try {
        gate.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    if (failure != null) {
      throw failure;
    }
    if (error != null) {
      throw error;
    }
    try {
      for (String file : files) {
        Files.writeString(outputDir.resolve(file), "audio:" + file);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return info;
  }

  @Override
  public String outputExtension() {
    return "mp3";
  }
}
