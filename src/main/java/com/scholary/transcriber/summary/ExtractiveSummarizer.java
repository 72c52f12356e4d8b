package com.scholary.transcriber.summary;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Summary built from sentences of the transcript itself.
 *
 * <p>Short transcripts (five sentences or fewer) are kept whole. Longer ones keep the first three
 * and last two sentences, which for meetings usually covers the agenda and the wrap-up.
 */
@Component
public class ExtractiveSummarizer implements Summarizer {

  static final String ITALIAN = "it";

  private static final int MAX_FULL_SENTENCES = 5;
  private static final int LEADING_SENTENCES = 3;
  private static final int TRAILING_SENTENCES = 2;

  @Override
  public String summarize(String text, String language) {
    boolean italian = ITALIAN.equals(language);
    if (text == null || text.isBlank()) {
      return italian ? "Riassunto non disponibile." : "Summary not available.";
    }

    List<String> sentences = Arrays.asList(text.split("\\. "));
    List<String> kept;
    if (sentences.size() <= MAX_FULL_SENTENCES) {
      kept = sentences;
    } else {
      kept = new ArrayList<>(sentences.subList(0, LEADING_SENTENCES));
      kept.addAll(sentences.subList(sentences.size() - TRAILING_SENTENCES, sentences.size()));
    }

    String prefix =
        italian ? "Riassunto automatico della riunione:\n\n" : "Automatic meeting summary:\n\n";
    return prefix + String.join(". ", kept);
  }
}
