package com.scholary.transcriber.transcript;

import java.util.List;

/**
 * The assembled transcript of a whole recording.
 *
 * <p>{@code text} is the rendered form, one {@code "Speaker N: ..."} line per turn. {@code
 * totalSpeakerCount} is an upper bound: speaker tags are not matched across chunks.
 */
public record TranscriptResult(
    String text, int durationSeconds, int totalSpeakerCount, List<SpeakerTurn> turns) {

  public TranscriptResult {
    turns = List.copyOf(turns);
  }

  public static TranscriptResult empty() {
    return new TranscriptResult("", 0, 0, List.of());
  }
}
