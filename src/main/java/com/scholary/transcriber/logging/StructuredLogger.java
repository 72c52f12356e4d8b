package com.scholary.transcriber.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts its fields into the MDC for the duration of a single log call, so a JSON
 * encoder or log shipper can index them. Job context ({@code jobId}, {@code ownerId}) is set once
 * per job and stays until the job finishes.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log chunk planning event. */
  public void logChunkPlanned(int chunkIndex, double start, double end, boolean forcedCut) {
    try {
      MDC.put("event_type", "chunk_planned");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));
      MDC.put("forcedCut", String.valueOf(forcedCut));

      logger.debug(
          "Chunk planned: index={}, range=[{}-{}], forcedCut={}",
          chunkIndex,
          start,
          end,
          forcedCut);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk started event. */
  public void logChunkStarted(int chunkIndex, double start, double end, double durationSeconds) {
    try {
      MDC.put("event_type", "chunk_started");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));
      MDC.put("durationSeconds", String.valueOf(durationSeconds));

      logger.debug(
          "Chunk started: index={}, range=[{}-{}], duration={}s",
          chunkIndex,
          start,
          end,
          durationSeconds);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk finished event. */
  public void logChunkFinished(
      int chunkIndex, int wordCount, int localSpeakerCount, long transcribeMs) {
    try {
      MDC.put("event_type", "chunk_finished");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("wordCount", String.valueOf(wordCount));
      MDC.put("speakerCount", String.valueOf(localSpeakerCount));
      MDC.put("transcribeMs", String.valueOf(transcribeMs));

      logger.debug(
          "Chunk finished: index={}, words={}, speakers={}, transcribe={}ms",
          chunkIndex,
          wordCount,
          localSpeakerCount,
          transcribeMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log transcription retry event. */
  public void logTranscribeRetry(
      int chunkIndex, int attempt, int maxAttempts, String errorType, String message) {
    try {
      MDC.put("event_type", "transcribe_retry");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));
      MDC.put("errorType", errorType);

      logger.warn(
          "Transcribe retry: chunk={}, attempt={}/{}, error={}, message={}",
          chunkIndex,
          attempt,
          maxAttempts,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log transcription failure event. */
  public void logTranscribeFailed(int chunkIndex, int attempts, String errorType, String message) {
    try {
      MDC.put("event_type", "transcribe_failed");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("attempt", String.valueOf(attempts));
      MDC.put("errorType", errorType);

      logger.error(
          "Transcribe failed: chunk={}, attempts={}, error={}, message={}",
          chunkIndex,
          attempts,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(String jobId, int chunksProcessed, int totalChunks, String phase) {
    int percentComplete = totalChunks == 0 ? 100 : chunksProcessed * 100 / totalChunks;
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("chunksProcessed", String.valueOf(chunksProcessed));
      MDC.put("totalChunks", String.valueOf(totalChunks));
      MDC.put("percentComplete", String.valueOf(percentComplete));
      MDC.put("phase", phase);

      logger.info(
          "Job progress: jobId={}, phase={}, chunks={}/{}, progress={}%",
          jobId,
          phase,
          chunksProcessed,
          totalChunks,
          percentComplete);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String ownerId) {
    MDC.put("jobId", jobId);
    MDC.put("ownerId", ownerId);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("ownerId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("chunk_index");
    MDC.remove("start");
    MDC.remove("end");
    MDC.remove("forcedCut");
    MDC.remove("durationSeconds");
    MDC.remove("wordCount");
    MDC.remove("speakerCount");
    MDC.remove("transcribeMs");
    MDC.remove("attempt");
    MDC.remove("maxAttempts");
    MDC.remove("errorType");
    MDC.remove("chunksProcessed");
    MDC.remove("totalChunks");
    MDC.remove("percentComplete");
    MDC.remove("phase");
  }
}
