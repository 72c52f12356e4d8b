package com.scholary.transcriber.audio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FfmpegAudioDecoderTest {

  @TempDir Path tempDir;

  @Test
  void constructor_shouldCreateTempDirectory() {
    Path nested = tempDir.resolve("decoder/work");

    new FfmpegAudioDecoder("ffmpeg", nested, 16000);

    assertThat(nested).isDirectory();
  }

  @Test
  void decode_missingBinary_shouldFailAndCleanUpTempFiles() throws IOException {
    FfmpegAudioDecoder decoder =
        new FfmpegAudioDecoder(tempDir.resolve("no-such-ffmpeg").toString(), tempDir, 16000);

    assertThatThrownBy(() -> decoder.decode(new byte[] {1, 2, 3}))
        .isInstanceOf(UncheckedIOException.class)
        .hasMessageContaining("ffmpeg");
    try (Stream<Path> leftovers = Files.list(tempDir)) {
      assertThat(leftovers).isEmpty();
    }
  }
}
