package com.scholary.mp3.fetcher.output;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/** Packs files into a deflated zip archive. */
public final class ArchiveWriter {

  private ArchiveWriter() {}

  /**
   * Write an archive.
   *
   * @param archive the zip file to create
   * @param entries entry name to source file, in archive order
   */
  public static void write(Path archive, Map<String, Path> entries) throws IOException {
    try (ZipOutputStream zos = new ZipOutputStream(Files.newOutputStream(archive))) {
      zos.setMethod(ZipOutputStream.DEFLATED);
      for (Map.Entry<String, Path> entry : entries.entrySet()) {
        zos.putNextEntry(new ZipEntry(entry.getKey()));
        Files.copy(entry.getValue(), zos);
        zos.closeEntry();
      }
    }
  }
}
