package com.scholary.transcriber.usage;

import java.time.Instant;
import java.time.LocalDate;

/** Tracks transcribed audio seconds per owner and month. */
public interface UsageLedger {

  /** Add {@code seconds} to the period containing {@code at}. */
  void record(String ownerId, Instant at, long seconds);

  /** Total seconds recorded for the period starting on {@code periodStart}; 0 if none. */
  long secondsFor(String ownerId, LocalDate periodStart);
}
