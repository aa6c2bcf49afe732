package com.scholary.mp3.fetcher.api;

import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Accepts only URLs of the supported source.
 *
 * <p>Recognized shapes:
 *
 * <ul>
 *   <li>{@code youtube.com/watch?...}, {@code youtube.com/playlist?...}, {@code
 *       youtube.com/shorts/<id>} with optional {@code www.}, {@code m.} or {@code music.}
 *   <li>{@code youtu.be/<id>}
 * </ul>
 *
 * <p>The scheme is optional but must be http or https when present. Matching ignores case.
 */
@Component
public class SourceUrlValidator {

  static final String MISSING_URL = "missing url parameter";
  static final String UNSUPPORTED_URL = "unsupported url domain";

  private static final String SCHEME = "^(?:https?://)?";
  private static final String YOUTUBE_HOST = "(?:www\\.|m\\.|music\\.)?youtube\\.com";

  private static final List<Pattern> SUPPORTED =
      List.of(
          Pattern.compile(
              SCHEME + YOUTUBE_HOST + "/(?:watch|playlist)(?:[?#/].*)?$",
              Pattern.CASE_INSENSITIVE),
          Pattern.compile(
              SCHEME + YOUTUBE_HOST + "/shorts/[\\w-]+(?:[?#/].*)?$", Pattern.CASE_INSENSITIVE),
          Pattern.compile(SCHEME + "youtu\\.be/[\\w-]+(?:[?#/].*)?$", Pattern.CASE_INSENSITIVE));

  public boolean isSupported(String url) {
    if (url == null || url.isBlank()) {
      return false;
    }
    String candidate = url.strip();
    return SUPPORTED.stream().anyMatch(p -> p.matcher(candidate).matches());
  }

  /**
   * Validate a request URL.
   *
   * @throws InvalidRequestException if the URL is missing or not supported
   */
  public void validate(String url) {
    if (url == null || url.isBlank()) {
      throw new InvalidRequestException(MISSING_URL);
    }
    if (!isSupported(url)) {
      throw new InvalidRequestException(UNSUPPORTED_URL);
    }
  }
}
