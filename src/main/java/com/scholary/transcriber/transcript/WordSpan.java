package com.scholary.transcriber.transcript;

/**
 * A recognized word with its timing and speaker.
 *
 * <p>Offsets are seconds. Straight out of the speech service they are relative to the chunk
 * start; after assembly they are relative to the start of the recording. Speaker tags are only
 * meaningful within the chunk that produced them.
 */
public record WordSpan(String text, double startOffset, double endOffset, int speakerTag) {

  public WordSpan shiftedBy(double seconds) {
    return new WordSpan(text, startOffset + seconds, endOffset + seconds, speakerTag);
  }
}
