package com.scholary.transcriber.audio;

import java.util.Objects;

/**
 * A fully decoded recording held in memory as PCM.
 *
 * <p>The sample array is not copied: a buffer is created once by a decoder and must not be
 * mutated afterwards. Long recordings are large (one hour of 16 kHz mono is about 115 MB), so the
 * segmenter works on offsets into this array and only copies when it cuts chunks.
 */
public record AudioBuffer(byte[] samples, PcmFormat format) {

  public AudioBuffer {
    Objects.requireNonNull(samples, "samples");
    Objects.requireNonNull(format, "format");
    if (samples.length % format.frameSize() != 0) {
      throw new IllegalArgumentException(
          String.format(
              "Sample data (%d bytes) is not a whole number of %d-byte frames",
              samples.length, format.frameSize()));
    }
  }

  public long frameCount() {
    return samples.length / format.frameSize();
  }

  public double durationSeconds() {
    return format.secondsFor(frameCount());
  }

  /** Read one signed 16-bit sample. */
  public short sampleAt(long frame, int channel) {
    int offset = (int) (frame * format.frameSize()) + channel * PcmFormat.BYTES_PER_SAMPLE;
    return (short) ((samples[offset] & 0xff) | (samples[offset + 1] << 8));
  }
}
