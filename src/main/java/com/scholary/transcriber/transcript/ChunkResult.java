package com.scholary.transcriber.transcript;

import java.util.List;

/** Recognized words for one chunk, with the number of speakers the service found in it. */
public record ChunkResult(int chunkIndex, List<WordSpan> words, int localSpeakerCount) {

  public ChunkResult {
    words = List.copyOf(words);
  }
}
