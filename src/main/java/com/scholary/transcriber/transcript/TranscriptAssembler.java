package com.scholary.transcriber.transcript;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stitches per-chunk results into one speaker-labelled transcript.
 *
 * <p>Chunks are cut at silences, so there is no overlap to resolve: words are concatenated in
 * chunk order with their timestamps moved onto a single timeline. The offset for chunk {@code i}
 * is the furthest word end seen once chunks {@code 0..i-1} have been rebased. This is the
 * recognized speech, not the chunk's audio length, so leading and trailing silence inside a chunk
 * is not counted.
 *
 * <p>Speaker tags are used as the service returned them. Speaker 1 in chunk 0 and speaker 1 in
 * chunk 1 may be different people, and the reported speaker count is only an upper bound.
 *
 * <p>Rendered text has one line per turn:
 *
 * <pre>
 * Speaker 1: good morning everyone
 * Speaker 2: morning
 * </pre>
 */
@Component
public class TranscriptAssembler {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptAssembler.class);

  /**
   * Merge chunk results into a transcript.
   *
   * @param results one result per chunk, ordered by chunk index starting at 0
   * @return the assembled transcript; empty when there are no words
   * @throws AssemblyException if the results are out of order or have gaps
   */
  public TranscriptResult merge(List<ChunkResult> results) {
    List<WordSpan> timeline = new ArrayList<>();
    double timelineOffset = 0.0;
    int totalSpeakerCount = 0;

    for (int i = 0; i < results.size(); i++) {
      ChunkResult chunk = results.get(i);
      if (chunk.chunkIndex() != i) {
        throw new AssemblyException(
            String.format("Expected chunk %d at position %d, found %d", i, i, chunk.chunkIndex()));
      }

      double chunkEnd = timelineOffset;
      for (WordSpan word : chunk.words()) {
        WordSpan rebased = word.shiftedBy(timelineOffset);
        timeline.add(rebased);
        chunkEnd = Math.max(chunkEnd, rebased.endOffset());
      }
      LOGGER.debug(
          "Chunk {}: {} words rebased by {}s", i, chunk.words().size(), timelineOffset);

      timelineOffset = chunkEnd;
      totalSpeakerCount = Math.max(totalSpeakerCount, chunk.localSpeakerCount());
    }

    if (timeline.isEmpty()) {
      LOGGER.info("No words recognized in {} chunks", results.size());
      return new TranscriptResult("", (int) timelineOffset, totalSpeakerCount, List.of());
    }

    // List.sort is stable, so words with equal start keep their recognition order
    timeline.sort(Comparator.comparingDouble(WordSpan::startOffset));
    List<SpeakerTurn> turns = toTurns(timeline);
    String text = turns.stream().map(TranscriptAssembler::render).collect(Collectors.joining("\n"));

    LOGGER.info(
        "Assembled transcript: {} words, {} turns, {}s, up to {} speakers",
        timeline.size(),
        turns.size(),
        (int) timelineOffset,
        totalSpeakerCount);
    return new TranscriptResult(text, (int) timelineOffset, totalSpeakerCount, turns);
  }

  private static List<SpeakerTurn> toTurns(List<WordSpan> sortedWords) {
    List<SpeakerTurn> turns = new ArrayList<>();
    List<WordSpan> current = new ArrayList<>();
    int currentTag = sortedWords.get(0).speakerTag();
    for (WordSpan word : sortedWords) {
      if (word.speakerTag() != currentTag) {
        turns.add(new SpeakerTurn(currentTag, current));
        current = new ArrayList<>();
        currentTag = word.speakerTag();
      }
      current.add(word);
    }
    turns.add(new SpeakerTurn(currentTag, current));
    return turns;
  }

  private static String render(SpeakerTurn turn) {
    return "Speaker " + turn.speakerTag() + ": " + turn.text();
  }
}
