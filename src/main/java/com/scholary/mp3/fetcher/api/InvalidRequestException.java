package com.scholary.mp3.fetcher.api;

/** The request is missing a parameter or carries one we cannot accept. Maps to 400. */
public class InvalidRequestException extends RuntimeException {

  public InvalidRequestException(String message) {
    super(message);
  }
}
