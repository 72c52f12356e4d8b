package com.scholary.transcriber.audio;

/**
 * A detected run of silence, in frames of the analysed buffer.
 *
 * <p>Silence gives the segmenter natural places to cut: instead of splitting mid-word we cut a
 * little way into a pause.
 */
public record SilenceInterval(long startFrame, long endFrame, int sampleRate) {

  public SilenceInterval {
    if (startFrame < 0 || endFrame < startFrame) {
      throw new IllegalArgumentException(
          String.format("Invalid silence interval [%d, %d)", startFrame, endFrame));
    }
  }

  public double start() {
    return (double) startFrame / sampleRate;
  }

  public double end() {
    return (double) endFrame / sampleRate;
  }

  public double duration() {
    return end() - start();
  }
}
