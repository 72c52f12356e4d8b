package com.scholary.transcriber.recognition;

import com.scholary.transcriber.exception.ErrorKind;
import com.scholary.transcriber.exception.TranscriptionException;

/**
 * Thrown when the speech service refuses a request: bad audio, bad configuration, or invalid
 * credentials.
 *
 * <p>Never retried; the same request would be refused again.
 */
public class RemoteRejectedException extends TranscriptionException {

  public RemoteRejectedException(String message) {
    super(ErrorKind.REMOTE_REJECTED, message);
  }

  public RemoteRejectedException(String message, Throwable cause) {
    super(ErrorKind.REMOTE_REJECTED, message, cause);
  }
}
