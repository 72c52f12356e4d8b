package com.scholary.transcriber.exception;

/**
 * Internal classification of a failed job.
 *
 * <p>Stored on the transcript record for diagnostics. Callers only ever see the kind, never the
 * remote service's own error payload.
 */
public enum ErrorKind {
  DECODE_ERROR,
  REMOTE_UNAVAILABLE,
  REMOTE_TIMEOUT,
  REMOTE_REJECTED,
  ASSEMBLY_ERROR,
  CANCELLED,
  STORAGE_ERROR,
  INTERNAL
}
