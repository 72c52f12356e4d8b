package com.scholary.transcriber.job;

import java.util.List;
import java.util.Optional;

/** Storage for transcript records. */
public interface TranscriptStore {

  /**
   * Store a new record.
   *
   * @throws IllegalStateException if a record with the same job id exists
   */
  void create(TranscriptRecord record);

  /**
   * Apply an update to an existing record.
   *
   * @return the updated record
   * @throws java.util.NoSuchElementException if the job is unknown
   */
  TranscriptRecord apply(String jobId, TranscriptUpdate update);

  Optional<TranscriptRecord> findById(String jobId);

  /** All records of one owner, newest first. */
  List<TranscriptRecord> findByOwner(String ownerId);
}
