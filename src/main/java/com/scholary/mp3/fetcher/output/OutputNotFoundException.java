package com.scholary.mp3.fetcher.output;

/** Thrown when the engine reported success but left no usable output file behind. */
public class OutputNotFoundException extends RuntimeException {

  public OutputNotFoundException(String message) {
    super(message);
  }
}
