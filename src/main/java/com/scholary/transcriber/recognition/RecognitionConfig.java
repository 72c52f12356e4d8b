package com.scholary.transcriber.recognition;

/**
 * Options sent with every recognition request.
 *
 * <p>Audio is always LINEAR16 (raw 16-bit PCM) since chunks are cut from decoded samples.
 */
public record RecognitionConfig(
    String languageCode,
    int sampleRateHertz,
    boolean enableWordTimeOffsets,
    boolean enableAutomaticPunctuation,
    int minSpeakerCount,
    int maxSpeakerCount,
    String model) {

  public RecognitionConfig {
    if (minSpeakerCount > maxSpeakerCount) {
      throw new IllegalArgumentException(
          String.format(
              "Speaker count range is empty: [%d, %d]", minSpeakerCount, maxSpeakerCount));
    }
  }
}
