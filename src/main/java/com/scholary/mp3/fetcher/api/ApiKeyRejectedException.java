package com.scholary.mp3.fetcher.api;

/** The API key header is missing or wrong. Maps to 403. */
public class ApiKeyRejectedException extends RuntimeException {

  public ApiKeyRejectedException(String message) {
    super(message);
  }
}
