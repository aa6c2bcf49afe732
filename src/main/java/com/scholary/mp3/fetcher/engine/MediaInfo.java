package com.scholary.mp3.fetcher.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Metadata the engine returns after an extraction.
 *
 * <p>A non-empty {@code entries} list marks a collection (playlist). Entries may contain nulls
 * for items the engine could not resolve.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MediaInfo(String id, String title, List<MediaInfo> entries) {

  public static MediaInfo single(String id, String title) {
    return new MediaInfo(id, title, null);
  }

  public static MediaInfo collection(String title, List<MediaInfo> entries) {
    return new MediaInfo(null, title, entries);
  }

  public boolean isCollection() {
    return entries != null && !entries.isEmpty();
  }
}
