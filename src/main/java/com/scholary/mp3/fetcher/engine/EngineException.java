package com.scholary.mp3.fetcher.engine;

/**
 * Exception thrown when the external media engine fails.
 *
 * <p>This covers network failures, unsupported media and engine crashes. The message is shown to
 * the client as-is.
 */
public class EngineException extends RuntimeException {

  public EngineException(String message) {
    super(message);
  }

  public EngineException(String message, Throwable cause) {
    super(message, cause);
  }
}
