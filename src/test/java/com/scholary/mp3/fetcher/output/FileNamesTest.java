package com.scholary.mp3.fetcher.output;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class FileNamesTest {

  @Test
  void sanitize_shouldStripUnsafeCharactersAndCollapseWhitespace() {
    assertThat(FileNames.sanitize("  My:/Song*?  ")).isEqualTo("My Song");
  }

  @Test
  void sanitize_shouldFallBackWhenEmpty() {
    assertThat(FileNames.sanitize("")).isEqualTo(FileNames.DEFAULT_NAME);
    assertThat(FileNames.sanitize(null)).isEqualTo(FileNames.DEFAULT_NAME);
    assertThat(FileNames.sanitize("   ")).isEqualTo(FileNames.DEFAULT_NAME);
    assertThat(FileNames.sanitize("<>|", "playlist")).isEqualTo("playlist");
  }

  @Test
  void sanitize_shouldKeepOrdinaryPunctuation() {
    assertThat(FileNames.sanitize("Artist - Title (Live) [2020]"))
        .isEqualTo("Artist - Title (Live) [2020]");
  }

  @Test
  void sanitize_shouldCapLengthWithoutTrailingSpace() {
    String longTitle = "a".repeat(199) + " bcd";

    String sanitized = FileNames.sanitize(longTitle);

    assertThat(sanitized).hasSize(199).isEqualTo("a".repeat(199));
  }

  @Test
  void hasExtension_shouldIgnoreCase() {
    assertThat(FileNames.hasExtension("SONG.MP3", "mp3")).isTrue();
    assertThat(FileNames.hasExtension("song.mp3.part", "mp3")).isFalse();
  }
}
