package com.scholary.transcriber.recognition;

import com.scholary.transcriber.exception.ErrorKind;
import com.scholary.transcriber.exception.TranscriptionException;

/** Thrown when a recognition operation does not finish within its deadline. */
public class RemoteTimeoutException extends TranscriptionException {

  public RemoteTimeoutException(String message) {
    super(ErrorKind.REMOTE_TIMEOUT, message);
  }

  public RemoteTimeoutException(String message, Throwable cause) {
    super(ErrorKind.REMOTE_TIMEOUT, message, cause);
  }
}
