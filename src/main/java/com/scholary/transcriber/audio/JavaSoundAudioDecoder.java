package com.scholary.transcriber.audio;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Arrays;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;

/**
 * Decoder built on {@code javax.sound.sampled}; needs no external binary.
 *
 * <p>Handles the formats the JDK ships readers for (WAV, AIFF, AU). Output keeps the source rate
 * and channel count, converted to signed 16-bit little-endian.
 */
public class JavaSoundAudioDecoder implements AudioDecoder {

  @Override
  public AudioBuffer decode(byte[] encoded) {
    try (AudioInputStream source =
        AudioSystem.getAudioInputStream(new ByteArrayInputStream(encoded))) {
      AudioFormat sourceFormat = source.getFormat();
      int channels = sourceFormat.getChannels();
      float rate = sourceFormat.getSampleRate();
      if (channels <= 0 || rate <= 0) {
        throw new DecodeException("Audio header does not declare rate and channels");
      }

      AudioFormat target =
          new AudioFormat(
              AudioFormat.Encoding.PCM_SIGNED,
              rate,
              16,
              channels,
              channels * PcmFormat.BYTES_PER_SAMPLE,
              rate,
              false);
      if (!AudioSystem.isConversionSupported(target, sourceFormat)) {
        throw new DecodeException("Unsupported audio encoding: " + sourceFormat.getEncoding());
      }

      try (AudioInputStream pcm = AudioSystem.getAudioInputStream(target, source)) {
        PcmFormat format = new PcmFormat(Math.round(rate), channels);
        byte[] samples = pcm.readAllBytes();
        int whole = samples.length - samples.length % format.frameSize();
        return new AudioBuffer(
            whole == samples.length ? samples : Arrays.copyOf(samples, whole), format);
      }
    } catch (UnsupportedAudioFileException e) {
      throw new DecodeException("Unsupported audio container", e);
    } catch (IOException e) {
      throw new DecodeException("Failed to read audio stream", e);
    }
  }
}
