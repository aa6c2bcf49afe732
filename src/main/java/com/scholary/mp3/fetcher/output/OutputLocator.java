package com.scholary.mp3.fetcher.output;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds the converted file for a media item inside a job directory.
 *
 * <p>The engine names files after titles, but it applies its own escaping, so the expected name
 * does not always exist. Matching is therefore exact first, then by substring on the item id or
 * its sanitized title. Substring matching is an approximation: two items with near-identical
 * titles can pick each other's file.
 */
public class OutputLocator {

  private final Path directory;
  private final String extension;

  public OutputLocator(Path directory, String extension) {
    this.directory = directory;
    this.extension = extension;
  }

  /** All files with the expected extension, sorted by name. */
  public List<Path> candidates() {
    try (Stream<Path> files = Files.list(directory)) {
      return files
          .filter(Files::isRegularFile)
          .filter(p -> FileNames.hasExtension(p.getFileName().toString(), extension))
          .sorted()
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list " + directory, e);
    }
  }

  /**
   * Locate the file for one item.
   *
   * @param id the item id, may be null
   * @param sanitizedTitle the item's title after {@link FileNames#sanitize}
   * @param exclude files already claimed by other items
   */
  public Optional<Path> locate(String id, String sanitizedTitle, Collection<Path> exclude) {
    Path exact = directory.resolve(sanitizedTitle + "." + extension);
    if (Files.isRegularFile(exact) && !exclude.contains(exact)) {
      return Optional.of(exact);
    }
    return candidates().stream()
        .filter(p -> !exclude.contains(p))
        .filter(p -> matches(p.getFileName().toString(), id, sanitizedTitle))
        .findFirst();
  }

  private static boolean matches(String fileName, String id, String sanitizedTitle) {
    return (id != null && !id.isEmpty() && fileName.contains(id))
        || fileName.contains(sanitizedTitle);
  }
}
