package com.scholary.transcriber.audio;

import com.scholary.transcriber.exception.TranscriptionCancelledException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes any format ffmpeg understands (mp3, m4a, ogg, webm, ...) into 16-bit mono PCM.
 *
 * <p>The upload is written to a temp file because several containers (mp4 in particular) need a
 * seekable input. ffmpeg writes raw s16le to stdout, which we read fully before waiting on the
 * process. stderr goes to a side file so a chatty ffmpeg cannot fill the pipe and block.
 */
public class FfmpegAudioDecoder implements AudioDecoder {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegAudioDecoder.class);

  private final String ffmpegBinary;
  private final Path tempDir;
  private final int sampleRate;

  public FfmpegAudioDecoder(String ffmpegBinary, Path tempDir, int sampleRate) {
    this.ffmpegBinary = ffmpegBinary;
    this.tempDir = tempDir;
    this.sampleRate = sampleRate;

    try {
      Files.createDirectories(this.tempDir);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create temp directory: " + tempDir, e);
    }
  }

  @Override
  public AudioBuffer decode(byte[] encoded) {
    String id = UUID.randomUUID().toString();
    Path input = tempDir.resolve("upload_" + id);
    Path errorLog = tempDir.resolve("ffmpeg_" + id + ".log");

    try {
      Files.write(input, encoded);

      ProcessBuilder pb =
          new ProcessBuilder(
              ffmpegBinary,
              "-v", "error",
              "-nostdin",
              "-i", input.toString(),
              "-f", "s16le",
              "-acodec", "pcm_s16le",
              "-ac", "1",
              "-ar", String.valueOf(sampleRate),
              "pipe:1");
      pb.redirectError(errorLog.toFile());

      Process process = pb.start();
      byte[] pcm;
      try (InputStream stdout = process.getInputStream()) {
        pcm = stdout.readAllBytes();
      }
      int exitCode = process.waitFor();

      if (exitCode != 0) {
        String error = Files.readString(errorLog).trim();
        LOGGER.warn("ffmpeg exited with code {}: {}", exitCode, error);
        throw new DecodeException(
            String.format("ffmpeg could not decode the upload (exit code %d)", exitCode));
      }
      if (pcm.length < PcmFormat.BYTES_PER_SAMPLE) {
        throw new DecodeException("ffmpeg produced no audio samples");
      }
      if (pcm.length % PcmFormat.BYTES_PER_SAMPLE != 0) {
        pcm = Arrays.copyOf(pcm, pcm.length - 1);
      }

      LOGGER.debug("ffmpeg decoded {} bytes into {} bytes of PCM", encoded.length, pcm.length);
      return new AudioBuffer(pcm, PcmFormat.mono(sampleRate));

    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TranscriptionCancelledException("Audio decoding interrupted", e);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to run ffmpeg", e);
    } finally {
      deleteQuietly(input);
      deleteQuietly(errorLog);
    }
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete temp file {}: {}", file, e.getMessage());
    }
  }
}
