package com.scholary.transcriber.audio;

import java.time.Duration;

/**
 * Layout of decoded PCM audio.
 *
 * <p>Samples are always signed 16-bit little-endian; only the sample rate and channel count vary.
 * A frame is one sample for every channel.
 */
public record PcmFormat(int sampleRate, int channels) {

  public static final int BYTES_PER_SAMPLE = 2;

  public PcmFormat {
    if (sampleRate <= 0) {
      throw new IllegalArgumentException("Sample rate must be positive: " + sampleRate);
    }
    if (channels <= 0) {
      throw new IllegalArgumentException("Channel count must be positive: " + channels);
    }
  }

  public static PcmFormat mono(int sampleRate) {
    return new PcmFormat(sampleRate, 1);
  }

  public int frameSize() {
    return channels * BYTES_PER_SAMPLE;
  }

  /** Number of whole frames covered by the given duration. */
  public long framesFor(Duration duration) {
    return duration.toMillis() * sampleRate / 1000;
  }

  public double secondsFor(long frames) {
    return (double) frames / sampleRate;
  }
}
