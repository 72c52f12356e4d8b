package com.scholary.transcriber.job;

import com.scholary.transcriber.exception.ErrorKind;
import java.time.Instant;

/**
 * Stored state of one transcription job.
 *
 * <p>Immutable: every status change produces a new record through {@link #apply}. Result fields
 * are null until the job is {@code DONE}; {@code errorKind} is null unless it is {@code ERROR}.
 */
public record TranscriptRecord(
    String jobId,
    String ownerId,
    String language,
    String originalFilename,
    JobStatus status,
    String text,
    String summary,
    Integer durationSeconds,
    Integer speakerCount,
    String audioUri,
    ErrorKind errorKind,
    Instant createdAt,
    Instant completedAt) {

  public static TranscriptRecord pending(
      String jobId, String ownerId, String language, String originalFilename, Instant now) {
    return new TranscriptRecord(
        jobId,
        ownerId,
        language,
        originalFilename,
        JobStatus.PENDING,
        null,
        null,
        null,
        null,
        null,
        null,
        now,
        null);
  }

  /**
   * Apply an update.
   *
   * @throws IllegalStateException if the record is already in a terminal status
   */
  public TranscriptRecord apply(TranscriptUpdate update, Instant now) {
    if (status.isTerminal()) {
      throw new IllegalStateException(
          String.format("Job %s is already %s; cannot apply %s", jobId, status, update));
    }
    if (update instanceof TranscriptUpdate.SetProcessing) {
      return withStatus(JobStatus.PROCESSING);
    }
    if (update instanceof TranscriptUpdate.SetDone) {
      TranscriptUpdate.SetDone done = (TranscriptUpdate.SetDone) update;
      return new TranscriptRecord(
          jobId,
          ownerId,
          language,
          originalFilename,
          JobStatus.DONE,
          done.text(),
          done.summary(),
          done.durationSeconds(),
          done.speakerCount(),
          done.audioUri(),
          null,
          createdAt,
          now);
    }
    if (update instanceof TranscriptUpdate.SetError) {
      TranscriptUpdate.SetError error = (TranscriptUpdate.SetError) update;
      return new TranscriptRecord(
          jobId,
          ownerId,
          language,
          originalFilename,
          JobStatus.ERROR,
          null,
          null,
          null,
          null,
          audioUri,
          error.kind(),
          createdAt,
          null);
    }
    throw new IllegalArgumentException("Unknown update: " + update);
  }

  private TranscriptRecord withStatus(JobStatus newStatus) {
    return new TranscriptRecord(
        jobId,
        ownerId,
        language,
        originalFilename,
        newStatus,
        text,
        summary,
        durationSeconds,
        speakerCount,
        audioUri,
        errorKind,
        createdAt,
        completedAt);
  }
}
