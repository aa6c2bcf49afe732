package com.scholary.mp3.fetcher.engine;

/** Receives progress callbacks from a running extraction, on the thread driving the engine. */
@FunctionalInterface
public interface EngineListener {

  EngineListener NONE = progress -> {};

  void onProgress(EngineProgress progress);
}
