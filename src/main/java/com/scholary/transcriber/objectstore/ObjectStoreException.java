package com.scholary.transcriber.objectstore;

import com.scholary.transcriber.exception.ErrorKind;
import com.scholary.transcriber.exception.TranscriptionException;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>The AWS SDK has already retried transient errors by the time this is thrown, so the job
 * fails with {@code STORAGE_ERROR}.
 */
public class ObjectStoreException extends TranscriptionException {

  public ObjectStoreException(String message) {
    super(ErrorKind.STORAGE_ERROR, message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(ErrorKind.STORAGE_ERROR, message, cause);
  }
}
