package com.scholary.mp3.fetcher.service;

/**
 * Exception thrown when a conversion fails for reasons other than the engine itself, such as
 * being unable to create a job directory or write the archive.
 */
public class ConversionException extends RuntimeException {

  public ConversionException(String message, Throwable cause) {
    super(message, cause);
  }
}
