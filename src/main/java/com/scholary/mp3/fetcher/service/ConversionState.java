package com.scholary.mp3.fetcher.service;

/** Lifecycle of a conversion job. */
public enum ConversionState {
  CREATED,
  RUNNING,
  SUCCEEDED,
  FAILED;

  public boolean isTerminal() {
    return this == SUCCEEDED || this == FAILED;
  }
}
