package com.scholary.mp3.fetcher.output;

import com.scholary.mp3.fetcher.engine.MediaInfo;
import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds the final deliverable from what the engine left in a job directory.
 *
 * <p>A single item is delivered as its converted file. A collection is packed into one zip named
 * after the collection; entries whose file cannot be found are skipped.
 */
@Component
public class DeliverableAssembler {

  private static final Logger LOGGER = LoggerFactory.getLogger(DeliverableAssembler.class);

  static final String OUTPUT_NOT_FOUND = "expected output file not found";

  /**
   * Assemble the deliverable.
   *
   * @param info metadata returned by the engine
   * @param directory the job directory the engine wrote into
   * @param extension extension of the converted files
   * @throws OutputNotFoundException if a single item produced no file
   * @throws IOException if the archive cannot be written
   */
  public Deliverable assemble(MediaInfo info, Path directory, String extension)
      throws IOException {
    OutputLocator locator = new OutputLocator(directory, extension);
    if (info.isCollection()) {
      return assembleCollection(info, directory, locator);
    }
    return assembleSingle(info, locator);
  }

  private Deliverable assembleCollection(MediaInfo info, Path directory, OutputLocator locator)
      throws IOException {
    String collectionTitle = FileNames.sanitize(info.title(), "playlist");
    Set<Path> packed = new HashSet<>();
    Map<String, Path> entries = new LinkedHashMap<>();

    for (MediaInfo entry : info.entries()) {
      if (entry == null) {
        continue;
      }
      String entryTitle = FileNames.sanitize(firstNonEmpty(entry.title(), entry.id()));
      Optional<Path> file = locator.locate(entry.id(), entryTitle, packed);
      if (file.isPresent()) {
        packed.add(file.get());
        entries.put(file.get().getFileName().toString(), file.get());
      } else {
        LOGGER.info("No output file for playlist entry: id={}, title={}", entry.id(), entryTitle);
      }
    }

    String archiveName = collectionTitle + ".zip";
    Path archive = directory.resolve(archiveName);
    ArchiveWriter.write(archive, entries);
    LOGGER.info(
        "Packed {} of {} playlist entries into {}",
        entries.size(),
        info.entries().size(),
        archiveName);
    return new Deliverable(archive, archiveName, true, entries.size());
  }

  private Deliverable assembleSingle(MediaInfo info, OutputLocator locator) {
    String title = FileNames.sanitize(firstNonEmpty(info.title(), info.id()), "video");
    Path file =
        locator
            .locate(info.id(), title, Set.of())
            .orElseGet(
                () -> {
                  List<Path> candidates = locator.candidates();
                  if (candidates.isEmpty()) {
                    throw new OutputNotFoundException(OUTPUT_NOT_FOUND);
                  }
                  return candidates.get(0);
                });
    return new Deliverable(file, file.getFileName().toString(), false, 1);
  }

  private static String firstNonEmpty(String first, String second) {
    return first != null && !first.isEmpty() ? first : second;
  }
}
