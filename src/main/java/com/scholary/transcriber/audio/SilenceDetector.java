package com.scholary.transcriber.audio;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds pauses in a recording by comparing short-window loudness with the recording's overall
 * loudness.
 *
 * <p>The threshold is relative: a window counts as silent when its RMS level is at least {@code
 * thresholdOffsetDb} below the RMS of the whole buffer. That adapts to quiet and loud recordings
 * alike, which a fixed dBFS threshold does not. Windows exactly at the threshold count as silent.
 *
 * <p>Only runs of silent windows lasting at least {@code minSilence} are reported. A pure
 * digital-zero recording has an overall RMS of zero, so every window sits at the threshold and
 * the whole buffer is one silence.
 */
public class SilenceDetector {

  private final Duration analysisWindow;
  private final Duration minSilence;
  private final double thresholdOffsetDb;

  public SilenceDetector(Duration analysisWindow, Duration minSilence, double thresholdOffsetDb) {
    if (analysisWindow.isZero() || analysisWindow.isNegative()) {
      throw new IllegalArgumentException("Analysis window must be positive: " + analysisWindow);
    }
    this.analysisWindow = analysisWindow;
    this.minSilence = minSilence;
    this.thresholdOffsetDb = thresholdOffsetDb;
  }

  /**
   * Detect silences in the buffer.
   *
   * @param audio the buffer to analyse (any channel layout; all channels are pooled)
   * @return silences in ascending order, never overlapping
   */
  public List<SilenceInterval> detect(AudioBuffer audio) {
    long totalFrames = audio.frameCount();
    if (totalFrames == 0) {
      return List.of();
    }
    PcmFormat format = audio.format();
    long windowFrames = Math.max(1, format.framesFor(analysisWindow));
    long minSilenceFrames = format.framesFor(minSilence);
    double threshold = rms(audio, 0, totalFrames) * Math.pow(10, -thresholdOffsetDb / 20.0);

    List<SilenceInterval> silences = new ArrayList<>();
    long runStart = -1;
    for (long windowStart = 0; windowStart < totalFrames; windowStart += windowFrames) {
      long windowEnd = Math.min(windowStart + windowFrames, totalFrames);
      boolean silent = rms(audio, windowStart, windowEnd) <= threshold;
      if (silent && runStart < 0) {
        runStart = windowStart;
      } else if (!silent && runStart >= 0) {
        addIfLongEnough(silences, runStart, windowStart, minSilenceFrames, format.sampleRate());
        runStart = -1;
      }
    }
    if (runStart >= 0) {
      addIfLongEnough(silences, runStart, totalFrames, minSilenceFrames, format.sampleRate());
    }
    return silences;
  }

  private static void addIfLongEnough(
      List<SilenceInterval> silences, long start, long end, long minFrames, int sampleRate) {
    if (end - start >= minFrames) {
      silences.add(new SilenceInterval(start, end, sampleRate));
    }
  }

  static double rms(AudioBuffer audio, long startFrame, long endFrame) {
    int channels = audio.format().channels();
    double sumSquares = 0;
    long count = 0;
    for (long frame = startFrame; frame < endFrame; frame++) {
      for (int channel = 0; channel < channels; channel++) {
        double sample = audio.sampleAt(frame, channel);
        sumSquares += sample * sample;
        count++;
      }
    }
    return count == 0 ? 0 : Math.sqrt(sumSquares / count);
  }
}
