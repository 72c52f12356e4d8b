package com.scholary.transcriber.recognition;

import com.scholary.transcriber.audio.AudioChunk;
import com.scholary.transcriber.exception.TranscriptionCancelledException;
import com.scholary.transcriber.exception.TranscriptionException;
import com.scholary.transcriber.logging.StructuredLogger;
import com.scholary.transcriber.transcript.ChunkResult;
import com.scholary.transcriber.transcript.WordSpan;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Transcribes one chunk, retrying transient failures.
 *
 * <p>Every chunk is recognized with word timestamps, punctuation and speaker diarization on.
 * Failures are handled by kind:
 *
 * <ul>
 *   <li>{@link RemoteUnavailableException}: retried with exponential backoff plus jitter, up to
 *       {@code maxAttempts} attempts in total
 *   <li>{@link RemoteTimeoutException}: the operation already ran for the full deadline, so it is
 *       only retried when {@code retryOnTimeout} is set
 *   <li>{@link RemoteRejectedException}: thrown straight away
 * </ul>
 *
 * <p>Stateless apart from configuration; safe to call from many threads at once.
 */
@Component
public class ChunkTranscriptionClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkTranscriptionClient.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final SpeechRecognitionService speechService;
  private final SpeechProperties properties;

  public ChunkTranscriptionClient(
      SpeechRecognitionService speechService, SpeechProperties properties) {
    this.speechService = speechService;
    this.properties = properties;
  }

  /**
   * Transcribe a chunk, blocking until the service answers.
   *
   * @param chunk the audio to recognize
   * @param language language code, e.g. {@code it} or {@code en}
   * @return words with offsets relative to the chunk start
   * @throws TranscriptionException the last failure once retries are exhausted
   */
  public ChunkResult transcribe(AudioChunk chunk, String language) {
    RecognitionConfig config = configFor(chunk, language);
    int attempt = 0;

    while (true) {
      attempt++;
      try {
        RecognitionResponse response =
            speechService.submit(chunk, config).await(properties.operationTimeout());
        return toChunkResult(chunk.index(), response);
      } catch (RemoteUnavailableException | RemoteTimeoutException e) {
        boolean retryable = e instanceof RemoteUnavailableException || properties.retryOnTimeout();
        if (!retryable || attempt >= properties.maxAttempts()) {
          STRUCTURED_LOGGER.logTranscribeFailed(
              chunk.index(), attempt, e.kind().name(), e.getMessage());
          throw e;
        }
        long backoffMs = backoffMillis(attempt);
        STRUCTURED_LOGGER.logTranscribeRetry(
            chunk.index(), attempt, properties.maxAttempts(), e.kind().name(), e.getMessage());
        LOGGER.debug("Retrying chunk {} in {}ms", chunk.index(), backoffMs);
        sleep(backoffMs);
      } catch (RemoteRejectedException e) {
        STRUCTURED_LOGGER.logTranscribeFailed(
            chunk.index(), attempt, e.kind().name(), e.getMessage());
        throw e;
      }
    }
  }

  RecognitionConfig configFor(AudioChunk chunk, String language) {
    return new RecognitionConfig(
        language,
        chunk.format().sampleRate(),
        true,
        true,
        properties.minSpeakerCount(),
        properties.maxSpeakerCount(),
        properties.model());
  }

  /** Exponential backoff with jitter: base * 2^(attempt-1) plus up to one base interval. */
  private long backoffMillis(int attempt) {
    long base = properties.initialBackoff().toMillis();
    long exponential = base * (1L << Math.min(attempt - 1, 20));
    long jitter = base > 0 ? ThreadLocalRandom.current().nextLong(base) : 0;
    return exponential + jitter;
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TranscriptionCancelledException("Transcription interrupted during backoff", e);
    }
  }

  private static ChunkResult toChunkResult(int chunkIndex, RecognitionResponse response) {
    List<WordSpan> words = new ArrayList<>(response.words().size());
    int speakers = 0;
    for (RecognizedWord word : response.words()) {
      words.add(
          new WordSpan(word.word(), word.startSeconds(), word.endSeconds(), word.speakerTag()));
      speakers = Math.max(speakers, word.speakerTag());
    }
    return new ChunkResult(chunkIndex, words, speakers);
  }
}
