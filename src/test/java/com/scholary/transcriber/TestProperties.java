package com.scholary.transcriber;

import com.scholary.transcriber.config.TranscriptionProperties;
import com.scholary.transcriber.config.TranscriptionProperties.OrchestrationProperties;
import com.scholary.transcriber.config.TranscriptionProperties.SegmentationProperties;
import com.scholary.transcriber.recognition.SpeechProperties;
import java.time.Duration;
import java.util.List;

/** Property records with the production defaults, for tests that build beans by hand. */
public final class TestProperties {

  private TestProperties() {}

  public static TranscriptionProperties transcription(int sampleRate, Duration maxChunkDuration) {
    return transcription(sampleRate, maxChunkDuration, Duration.ofHours(2));
  }

  public static TranscriptionProperties transcription(
      int sampleRate, Duration maxChunkDuration, Duration jobTimeout) {
    return new TranscriptionProperties(
        new SegmentationProperties(
            sampleRate,
            maxChunkDuration,
            Duration.ofSeconds(1),
            Duration.ofMillis(500),
            14.0,
            Duration.ofMillis(10)),
        new OrchestrationProperties(4, jobTimeout),
        TranscriptionProperties.DECODER_JAVASOUND,
        System.getProperty("java.io.tmpdir"),
        1,
        10,
        List.of("it", "en"));
  }

  public static SpeechProperties speech(String baseUrl, int maxAttempts, boolean retryOnTimeout) {
    return new SpeechProperties(
        baseUrl,
        "test-key",
        Duration.ofSeconds(2),
        Duration.ofSeconds(5),
        Duration.ofSeconds(5),
        Duration.ofMillis(20),
        maxAttempts,
        Duration.ofMillis(1),
        retryOnTimeout,
        "video",
        1,
        10);
  }
}
