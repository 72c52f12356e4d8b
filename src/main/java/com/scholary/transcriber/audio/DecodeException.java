package com.scholary.transcriber.audio;

import com.scholary.transcriber.exception.ErrorKind;
import com.scholary.transcriber.exception.TranscriptionException;

/**
 * Thrown when the uploaded bytes are not audio we can decode.
 *
 * <p>Unrecoverable for the job: retrying the same bytes cannot succeed.
 */
public class DecodeException extends TranscriptionException {

  public DecodeException(String message) {
    super(ErrorKind.DECODE_ERROR, message);
  }

  public DecodeException(String message, Throwable cause) {
    super(ErrorKind.DECODE_ERROR, message, cause);
  }
}
