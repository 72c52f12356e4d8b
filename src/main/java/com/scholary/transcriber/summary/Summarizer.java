package com.scholary.transcriber.summary;

/** Produces a short summary of a finished transcript. */
public interface Summarizer {

  /**
   * Summarize transcript text.
   *
   * @param text the rendered transcript
   * @param language language code of the transcript
   * @return the summary; never null
   */
  String summarize(String text, String language);
}
