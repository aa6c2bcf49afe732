package com.scholary.mp3.fetcher.output;

import java.util.regex.Pattern;

/** Turns arbitrary media titles into safe file names. */
public final class FileNames {

  public static final String DEFAULT_NAME = "untitled";
  public static final int MAX_LENGTH = 200;

  private static final Pattern UNSAFE_CHARACTERS = Pattern.compile("[\\\\/:*?\"<>|]+");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private FileNames() {}

  /** Sanitize with the default fallback and length cap. */
  public static String sanitize(String name) {
    return sanitize(name, DEFAULT_NAME, MAX_LENGTH);
  }

  /** Sanitize, falling back to {@code fallback} when nothing usable is left. */
  public static String sanitize(String name, String fallback) {
    return sanitize(name, fallback, MAX_LENGTH);
  }

  /**
   * Strip file-system-unsafe characters, collapse whitespace and cap the length.
   *
   * <p>Each run of unsafe characters becomes a single space before whitespace is collapsed, so
   * {@code "My:/Song"} becomes {@code "My Song"} rather than {@code "MySong"}.
   */
  public static String sanitize(String name, String fallback, int maxLength) {
    if (name == null || name.isEmpty()) {
      return fallback;
    }
    String cleaned = UNSAFE_CHARACTERS.matcher(name).replaceAll(" ");
    cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ").strip();
    if (cleaned.length() > maxLength) {
      cleaned = cleaned.substring(0, maxLength).stripTrailing();
    }
    return cleaned.isEmpty() ? fallback : cleaned;
  }

  /** True if the file name ends with the extension, ignoring case. */
  public static boolean hasExtension(String fileName, String extension) {
    return fileName.toLowerCase().endsWith("." + extension.toLowerCase());
  }
}
