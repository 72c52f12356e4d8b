package com.scholary.transcriber.recognition;

import java.time.Duration;

/** A recognition operation that has been accepted by the service and may still be running. */
public interface RecognitionJob {

  /**
   * Block until the operation finishes.
   *
   * @param timeout how long to wait before giving up
   * @return the recognized words
   * @throws RemoteTimeoutException if the operation is still running after {@code timeout}
   * @throws RemoteUnavailableException on transient transport or service failures
   * @throws RemoteRejectedException if the service refused the audio or configuration
   */
  RecognitionResponse await(Duration timeout);
}
