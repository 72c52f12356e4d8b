package com.scholary.transcriber.job;

/** Lifecycle of a transcription job. {@code DONE} and {@code ERROR} are terminal. */
public enum JobStatus {
  PENDING,
  PROCESSING,
  DONE,
  ERROR;

  public boolean isTerminal() {
    return this == DONE || this == ERROR;
  }
}
