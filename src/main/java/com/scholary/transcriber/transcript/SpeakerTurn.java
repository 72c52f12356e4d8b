package com.scholary.transcriber.transcript;

import java.util.List;
import java.util.stream.Collectors;

/** Consecutive words spoken by the same speaker. Never empty. */
public record SpeakerTurn(int speakerTag, List<WordSpan> words) {

  public SpeakerTurn {
    if (words.isEmpty()) {
      throw new IllegalArgumentException("A speaker turn needs at least one word");
    }
    words = List.copyOf(words);
  }

  public double start() {
    return words.get(0).startOffset();
  }

  public double end() {
    return words.get(words.size() - 1).endOffset();
  }

  public String text() {
    return words.stream().map(WordSpan::text).collect(Collectors.joining(" "));
  }
}
