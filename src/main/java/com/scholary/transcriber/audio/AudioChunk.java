package com.scholary.transcriber.audio;

/**
 * A bounded slice of the normalized recording, the unit of work sent to the speech service.
 *
 * <p>Chunks are numbered from zero with no gaps. {@code startFrame} locates the chunk in the
 * normalized recording; it is kept for logging only, since transcript assembly rebuilds the
 * timeline from the recognized words themselves.
 */
public record AudioChunk(int index, byte[] samples, PcmFormat format, long startFrame) {

  public AudioChunk {
    if (index < 0) {
      throw new IllegalArgumentException("Chunk index cannot be negative: " + index);
    }
  }

  public long frameCount() {
    return samples.length / format.frameSize();
  }

  public double duration() {
    return format.secondsFor(frameCount());
  }

  /** Position of this chunk in the original recording, in seconds. */
  public TimeRange span() {
    return new TimeRange(
        format.secondsFor(startFrame), format.secondsFor(startFrame + frameCount()));
  }
}
