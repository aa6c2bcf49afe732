package com.scholary.mp3.fetcher.api;

/** No job is registered for the token, either because it never existed or it was consumed. */
public class JobNotFoundException extends RuntimeException {

  static final String MESSAGE = "invalid or expired token";

  private final String token;

  public JobNotFoundException(String token) {
    super(MESSAGE);
    this.token = token;
  }

  public String getToken() {
    return token;
  }
}
