package com.scholary.transcriber.job;

import com.scholary.transcriber.exception.ErrorKind;
import java.util.Objects;

/**
 * A change to a stored transcript record.
 *
 * <p>There are exactly three kinds of update, one per status transition; {@link
 * TranscriptRecord#apply} rejects anything else.
 */
public interface TranscriptUpdate {

  /** The job has been picked up by a worker. */
  record SetProcessing() implements TranscriptUpdate {}

  /** The job finished; carries everything the caller gets back. */
  record SetDone(
      String text, String summary, int durationSeconds, int speakerCount, String audioUri)
      implements TranscriptUpdate {

    public SetDone {
      Objects.requireNonNull(text, "text");
      Objects.requireNonNull(summary, "summary");
    }
  }

  /** The job failed. Only the kind is kept, never the underlying error payload. */
  record SetError(ErrorKind kind) implements TranscriptUpdate {

    public SetError {
      Objects.requireNonNull(kind, "kind");
    }
  }
}
