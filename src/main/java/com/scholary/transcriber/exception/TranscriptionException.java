package com.scholary.transcriber.exception;

/**
 * Base class for every failure raised by the transcription pipeline.
 *
 * <p>Unchecked, like the object store and recognition errors it generalizes: a failed chunk fails
 * the whole job, so there is nothing an intermediate caller could do with a checked exception
 * except rethrow it. The job service is the single place that catches these and turns them into
 * an error status.
 */
public abstract class TranscriptionException extends RuntimeException {

  private final ErrorKind kind;

  protected TranscriptionException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  protected TranscriptionException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind kind() {
    return kind;
  }
}
