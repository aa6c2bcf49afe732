package com.scholary.mp3.fetcher.service;

import java.nio.file.Path;

/** A URL to convert and the private directory its output goes to. */
public record ConversionRequest(String url, Path tempDir) {}
