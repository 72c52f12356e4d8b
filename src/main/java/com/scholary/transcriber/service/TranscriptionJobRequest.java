package com.scholary.transcriber.service;

import java.util.Objects;

/**
 * A transcription job as submitted by a caller.
 *
 * @param jobId caller-chosen id, unique across jobs
 * @param caller the submitting user
 * @param audio the uploaded file, in any format the configured decoder accepts
 * @param originalFilename the upload's file name, used for the archive key
 * @param language language code of the recording
 */
public record TranscriptionJobRequest(
    String jobId,
    CallerIdentity caller,
    byte[] audio,
    String originalFilename,
    String language) {

  public TranscriptionJobRequest {
    Objects.requireNonNull(jobId, "jobId");
    Objects.requireNonNull(caller, "caller");
    Objects.requireNonNull(audio, "audio");
    Objects.requireNonNull(originalFilename, "originalFilename");
    Objects.requireNonNull(language, "language");
  }
}
