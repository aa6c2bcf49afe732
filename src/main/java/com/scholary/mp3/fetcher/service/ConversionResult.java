package com.scholary.mp3.fetcher.service;

import com.scholary.mp3.fetcher.output.Deliverable;
import java.nio.file.Path;

/**
 * Outcome of a synchronous conversion.
 *
 * <p>The caller owns {@code tempDir} and must delete it once the deliverable has been sent.
 */
public record ConversionResult(Path tempDir, Deliverable deliverable) {}
