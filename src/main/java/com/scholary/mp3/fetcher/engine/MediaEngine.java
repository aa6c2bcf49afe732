package com.scholary.mp3.fetcher.engine;

import java.nio.file.Path;

/**
 * The external media fetch/transcode engine.
 *
 * <p>Implementations download everything the URL points at into {@code outputDir}, converting
 * each item to the configured audio format, and report progress through the listener.
 */
public interface MediaEngine {

  /**
   * Download and convert the media behind a URL.
   *
   * @param url the source URL
   * @param outputDir an existing directory private to this job
   * @param listener receives progress callbacks
   * @return the extracted metadata
   * @throws EngineException if extraction or conversion fails
   */
  MediaInfo extract(String url, Path outputDir, EngineListener listener);

  /** File extension (without dot) of the files this engine produces. */
  String outputExtension();
}
