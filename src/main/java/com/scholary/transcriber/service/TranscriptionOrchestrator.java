package com.scholary.transcriber.service;

import com.scholary.transcriber.audio.AudioBuffer;
import com.scholary.transcriber.audio.AudioChunk;
import com.scholary.transcriber.audio.AudioSegmenter;
import com.scholary.transcriber.config.TranscriptionProperties;
import com.scholary.transcriber.exception.TranscriptionCancelledException;
import com.scholary.transcriber.logging.StructuredLogger;
import com.scholary.transcriber.recognition.ChunkTranscriptionClient;
import com.scholary.transcriber.transcript.ChunkResult;
import com.scholary.transcriber.transcript.TranscriptAssembler;
import com.scholary.transcriber.transcript.TranscriptResult;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs one recording through segmentation, parallel recognition and assembly.
 *
 * <p>Chunks are handed to the shared chunk executor, whose pool size caps how many recognition
 * calls are in flight across all jobs. Results arrive in completion order and are parked in a
 * per-job array by chunk index; only this thread touches that array.
 *
 * <p>A job succeeds only if every chunk does. The first failure to complete cancels the remaining
 * chunks (interrupting those already running) and is rethrown unchanged. The same happens when
 * the job deadline passes or the calling thread is interrupted, except the caller sees a {@link
 * TranscriptionCancelledException}.
 */
@Service
public class TranscriptionOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionOrchestrator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final AudioSegmenter segmenter;
  private final ChunkTranscriptionClient transcriptionClient;
  private final TranscriptAssembler assembler;
  private final Executor chunkExecutor;
  private final Duration jobTimeout;

  public TranscriptionOrchestrator(
      AudioSegmenter segmenter,
      ChunkTranscriptionClient transcriptionClient,
      TranscriptAssembler assembler,
      @Qualifier("chunkExecutor") Executor chunkExecutor,
      TranscriptionProperties properties) {
    this.segmenter = segmenter;
    this.transcriptionClient = transcriptionClient;
    this.assembler = assembler;
    this.chunkExecutor = chunkExecutor;
    this.jobTimeout = properties.orchestration().jobTimeout();
  }

  /**
   * Transcribe a decoded recording.
   *
   * @param audio the decoded recording
   * @param language language code passed to the speech service
   * @return the assembled transcript
   * @throws com.scholary.transcriber.exception.TranscriptionException the first chunk failure, or
   *     a cancellation
   */
  public TranscriptResult run(AudioBuffer audio, String language) {
    List<AudioChunk> chunks = segmenter.split(audio);
    String jobId = MDC.get("jobId");
    LOGGER.info("Transcribing {} chunks, language={}", chunks.size(), language);

    Map<String, String> context = MDC.getCopyOfContextMap();
    CompletionService<ChunkResult> completion = new ExecutorCompletionService<>(chunkExecutor);
    List<Future<ChunkResult>> futures = new ArrayList<>(chunks.size());
    ChunkResult[] results = new ChunkResult[chunks.size()];
    long deadline = System.nanoTime() + jobTimeout.toNanos();

    try {
      for (AudioChunk chunk : chunks) {
        futures.add(completion.submit(() -> transcribeChunk(chunk, language, context)));
      }

      for (int received = 0; received < chunks.size(); received++) {
        long remaining = deadline - System.nanoTime();
        Future<ChunkResult> done =
            remaining > 0 ? completion.poll(remaining, TimeUnit.NANOSECONDS) : null;
        if (done == null) {
          throw new TranscriptionCancelledException(
              String.format(
                  "Job did not finish within %s (%d of %d chunks done)",
                  jobTimeout, received, chunks.size()));
        }
        ChunkResult result = resultOf(done);
        results[result.chunkIndex()] = result;
        structuredLogger.logJobProgress(jobId, received + 1, chunks.size(), "transcribing");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TranscriptionCancelledException("Transcription interrupted", e);
    } finally {
      // No-op for finished chunks; interrupts the rest when we are bailing out
      futures.forEach(future -> future.cancel(true));
    }

    return assembler.merge(Arrays.asList(results));
  }

  private ChunkResult transcribeChunk(
      AudioChunk chunk, String language, Map<String, String> context) {
    if (context != null) {
      MDC.setContextMap(context);
    }
    try {
      structuredLogger.logChunkStarted(
          chunk.index(), chunk.span().start(), chunk.span().end(), chunk.duration());
      long startedAt = System.currentTimeMillis();

      ChunkResult result = transcriptionClient.transcribe(chunk, language);

      structuredLogger.logChunkFinished(
          chunk.index(),
          result.words().size(),
          result.localSpeakerCount(),
          System.currentTimeMillis() - startedAt);
      return result;
    } finally {
      MDC.clear();
    }
  }

  private static ChunkResult resultOf(Future<ChunkResult> future) throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new IllegalStateException("Chunk transcription failed", cause);
    }
  }
}
