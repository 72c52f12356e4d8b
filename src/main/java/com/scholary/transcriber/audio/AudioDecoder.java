package com.scholary.transcriber.audio;

/**
 * Turns an encoded audio file into PCM.
 *
 * <p>Implementations may already resample to the pipeline's format (ffmpeg does) or return the
 * source layout; the segmenter normalizes either way.
 */
public interface AudioDecoder {

  /**
   * Decode a complete audio file.
   *
   * @param encoded the raw file contents (any container/codec the implementation supports)
   * @return the decoded samples
   * @throws DecodeException if the bytes are not a supported audio format
   */
  AudioBuffer decode(byte[] encoded);
}
