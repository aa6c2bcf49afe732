package com.scholary.mp3.fetcher.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One progress callback from the engine.
 *
 * <p>Field names follow the engine's progress dictionary. Any numeric field may be missing.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineProgress(
    @JsonProperty("status") String status,
    @JsonProperty("downloaded_bytes") Long downloadedBytes,
    @JsonProperty("total_bytes") Long totalBytes,
    @JsonProperty("total_bytes_estimate") Double totalBytesEstimate,
    @JsonProperty("speed") Double speed,
    @JsonProperty("eta") Long eta,
    @JsonProperty("filename") String filename) {

  public static final String DOWNLOADING = "downloading";
  public static final String FINISHED = "finished";

  public boolean isDownloading() {
    return DOWNLOADING.equals(status);
  }

  public boolean isFinished() {
    return FINISHED.equals(status);
  }
}
