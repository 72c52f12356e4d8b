package com.scholary.transcriber.recognition;

import java.util.List;

/** Words recognized in one chunk, in the order the service returned them. */
public record RecognitionResponse(List<RecognizedWord> words) {

  public RecognitionResponse {
    words = List.copyOf(words);
  }
}
