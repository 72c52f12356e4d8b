package com.scholary.transcriber.exception;

/**
 * Thrown when a job is cancelled, either because its deadline passed or because the thread
 * running it was interrupted.
 *
 * <p>Cancellation is terminal: the job is marked failed and never retried automatically.
 */
public class TranscriptionCancelledException extends TranscriptionException {

  public TranscriptionCancelledException(String message) {
    super(ErrorKind.CANCELLED, message);
  }

  public TranscriptionCancelledException(String message, Throwable cause) {
    super(ErrorKind.CANCELLED, message, cause);
  }
}
