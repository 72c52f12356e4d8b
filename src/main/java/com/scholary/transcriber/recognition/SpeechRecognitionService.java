package com.scholary.transcriber.recognition;

import com.scholary.transcriber.audio.AudioChunk;

/**
 * Interface for the remote speech-to-text service.
 *
 * <p>This abstraction lets us swap the HTTP client for a stub in tests. Recognition is
 * long-running: {@link #submit} returns as soon as the service has accepted the audio.
 */
public interface SpeechRecognitionService {

  /**
   * Start recognizing a chunk.
   *
   * @throws RemoteUnavailableException on transient transport or service failures
   * @throws RemoteRejectedException if the service refused the request
   */
  RecognitionJob submit(AudioChunk chunk, RecognitionConfig config);
}
