package com.scholary.transcriber.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for transcription processing.
 *
 * <p>Controls how recordings are cut into chunks, how many chunks are in flight at once, and the
 * resources given to background jobs.
 */
@ConfigurationProperties(prefix = "transcription")
@Validated
public record TranscriptionProperties(
    @Valid @NotNull SegmentationProperties segmentation,
    @Valid @NotNull OrchestrationProperties orchestration,
    @NotBlank String decoder,
    @NotBlank String tempDir,
    @Positive int jobExecutorThreads,
    @Positive int jobExecutorQueueSize,
    @NotEmpty List<String> supportedLanguages) {

  public static final String DECODER_FFMPEG = "ffmpeg";
  public static final String DECODER_JAVASOUND = "javasound";

  public record SegmentationProperties(
      @Positive int sampleRate,
      @NotNull Duration maxChunkDuration,
      @NotNull Duration minSilence,
      @NotNull Duration keepSilence,
      @Positive double silenceThresholdOffsetDb,
      @NotNull Duration analysisWindow) {}

  public record OrchestrationProperties(
      @Positive int maxInFlightChunks, @NotNull Duration jobTimeout) {}
}
