package com.scholary.mp3.fetcher.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class SourceUrlValidatorTest {

  private final SourceUrlValidator validator = new SourceUrlValidator();

  @Test
  void isSupported_shouldAcceptKnownShapes() {
    assertThat(validator.isSupported("https://www.youtube.com/watch?v=dQw4w9WgXcQ")).isTrue();
    assertThat(validator.isSupported("http://youtube.com/watch?v=abc&list=PL1")).isTrue();
    assertThat(validator.isSupported("https://m.youtube.com/watch?v=abc")).isTrue();
    assertThat(validator.isSupported("https://music.youtube.com/playlist?list=PL123")).isTrue();
    assertThat(validator.isSupported("https://www.youtube.com/shorts/abc-_123")).isTrue();
    assertThat(validator.isSupported("https://youtu.be/dQw4w9WgXcQ?t=10")).isTrue();
    assertThat(validator.isSupported("youtu.be/dQw4w9WgXcQ")).isTrue();
    assertThat(validator.isSupported("HTTPS://WWW.YOUTUBE.COM/WATCH?V=ABC")).isTrue();
  }

  @Test
  void isSupported_shouldRejectOtherHostsAndPaths() {
    assertThat(validator.isSupported("https://vimeo.com/12345")).isFalse();
    assertThat(validator.isSupported("https://www.youtube.com/channel/UC123")).isFalse();
    assertThat(validator.isSupported("https://evil.example/youtube.com/watch?v=x")).isFalse();
    assertThat(validator.isSupported("https://youtube.com.evil.example/watch?v=x")).isFalse();
    assertThat(validator.isSupported("ftp://youtube.com/watch?v=x")).isFalse();
    assertThat(validator.isSupported("https://youtu.be/")).isFalse();
    assertThat(validator.isSupported(null)).isFalse();
  }

  @Test
  void validate_shouldDistinguishMissingFromUnsupported() {
    assertThatThrownBy(() -> validator.validate(" "))
        .isInstanceOf(InvalidRequestException.class)
        .hasMessage("missing url parameter");
    assertThatThrownBy(() -> validator.validate("https://vimeo.com/1"))
        .isInstanceOf(InvalidRequestException.class)
        .hasMessage("unsupported url domain");
  }
}
