package com.scholary.transcriber.recognition;

import com.scholary.transcriber.exception.ErrorKind;
import com.scholary.transcriber.exception.TranscriptionException;

/**
 * Thrown when the speech service cannot be reached or reports a transient failure (connection
 * errors, HTTP 429 and 5xx).
 *
 * <p>Safe to retry with backoff.
 */
public class RemoteUnavailableException extends TranscriptionException {

  public RemoteUnavailableException(String message) {
    super(ErrorKind.REMOTE_UNAVAILABLE, message);
  }

  public RemoteUnavailableException(String message, Throwable cause) {
    super(ErrorKind.REMOTE_UNAVAILABLE, message, cause);
  }
}
