package com.scholary.transcriber.audio;

/**
 * Converts decoded PCM to the mono, fixed-rate layout the rest of the pipeline expects.
 *
 * <p>Channels are averaged; the sample rate is changed by linear interpolation. This is not a
 * band-limited resampler, but speech recognition at 16 kHz is not sensitive to the aliasing it
 * introduces.
 */
public final class PcmNormalizer {

  private PcmNormalizer() {}

  public static AudioBuffer normalize(AudioBuffer audio, int targetSampleRate) {
    PcmFormat target = PcmFormat.mono(targetSampleRate);
    if (audio.format().equals(target)) {
      return audio;
    }
    short[] mono = downmix(audio);
    short[] resampled = resample(mono, audio.format().sampleRate(), targetSampleRate);
    return new AudioBuffer(toBytes(resampled), target);
  }

  private static short[] downmix(AudioBuffer audio) {
    int frames = (int) audio.frameCount();
    int channels = audio.format().channels();
    short[] mono = new short[frames];
    for (int frame = 0; frame < frames; frame++) {
      int sum = 0;
      for (int channel = 0; channel < channels; channel++) {
        sum += audio.sampleAt(frame, channel);
      }
      mono[frame] = (short) Math.round((double) sum / channels);
    }
    return mono;
  }

  private static short[] resample(short[] source, int sourceRate, int targetRate) {
    if (sourceRate == targetRate || source.length == 0) {
      return source;
    }
    int outputLength = (int) ((long) source.length * targetRate / sourceRate);
    short[] output = new short[outputLength];
    double step = (double) sourceRate / targetRate;
    int last = source.length - 1;
    for (int i = 0; i < outputLength; i++) {
      double position = i * step;
      int left = Math.min((int) position, last);
      int right = Math.min(left + 1, last);
      double fraction = position - left;
      double value = source[left] * (1.0 - fraction) + source[right] * fraction;
      output[i] = clamp(Math.round(value));
    }
    return output;
  }

  private static short clamp(long value) {
    return (short) Math.max(Short.MIN_VALUE, Math.min(Short.MAX_VALUE, value));
  }

  private static byte[] toBytes(short[] samples) {
    byte[] bytes = new byte[samples.length * PcmFormat.BYTES_PER_SAMPLE];
    for (int i = 0; i < samples.length; i++) {
      bytes[2 * i] = (byte) samples[i];
      bytes[2 * i + 1] = (byte) (samples[i] >> 8);
    }
    return bytes;
  }
}
