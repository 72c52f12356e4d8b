package com.scholary.transcriber.audio;

/**
 * Represents a time range in seconds with start and end points.
 *
 * <p>Used to report where chunks and silences sit in the original recording. All times are in
 * seconds with fractional precision.
 */
public record TimeRange(double start, double end) {

  public TimeRange {
    if (start < 0) {
      throw new IllegalArgumentException("Start time cannot be negative");
    }
    if (end < start) {
      throw new IllegalArgumentException("End time must be >= start time");
    }
  }

  public double duration() {
    return end - start;
  }

  /**
   * Check if this range overlaps with another range.
   *
   * <p>Ranges that only touch at a boundary do not overlap.
   *
   * @param other the other range
   * @return true if the ranges overlap
   */
  public boolean overlaps(TimeRange other) {
    return this.start < other.end && other.start < this.end;
  }
}
