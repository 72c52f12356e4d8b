package com.scholary.transcriber.audio;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class PcmNormalizerTest {

  @Test
  void normalize_shouldReturnSameBufferWhenAlreadyInTargetFormat() {
    AudioBuffer audio = TestAudio.mono(16000, TestAudio.tone(16000, 0.1));

    assertThat(PcmNormalizer.normalize(audio, 16000)).isSameAs(audio);
  }

  @Test
  void normalize_shouldAverageChannels() {
    // two stereo frames: (100, 300) and (-200, -400)
    byte[] samples = {100, 0, 44, 1, 56, -1, 112, -2};
    AudioBuffer stereo = new AudioBuffer(samples, new PcmFormat(8000, 2));

    AudioBuffer mono = PcmNormalizer.normalize(stereo, 8000);

    assertThat(mono.format()).isEqualTo(PcmFormat.mono(8000));
    assertThat(mono.frameCount()).isEqualTo(2);
    assertThat(mono.sampleAt(0, 0)).isEqualTo((short) 200);
    assertThat(mono.sampleAt(1, 0)).isEqualTo((short) -300);
  }

  @Test
  void normalize_shouldResamplePreservingDuration() {
    AudioBuffer audio = TestAudio.mono(8000, TestAudio.tone(8000, 2.0));

    AudioBuffer upsampled = PcmNormalizer.normalize(audio, 16000);
    AudioBuffer downsampled = PcmNormalizer.normalize(audio, 4000);

    assertThat(upsampled.frameCount()).isEqualTo(32000);
    assertThat(upsampled.durationSeconds()).isEqualTo(2.0);
    assertThat(downsampled.frameCount()).isEqualTo(8000);
  }

  @Test
  void normalize_shouldInterpolateBetweenSamples() {
    // 0 then 1000 at 1 kHz; upsampling to 2 kHz puts 500 between them
    byte[] samples = {0, 0, (byte) 0xe8, 0x03};
    AudioBuffer audio = new AudioBuffer(samples, PcmFormat.mono(1000));

    AudioBuffer upsampled = PcmNormalizer.normalize(audio, 2000);

    assertThat(upsampled.frameCount()).isEqualTo(4);
    assertThat(upsampled.sampleAt(0, 0)).isEqualTo((short) 0);
    assertThat(upsampled.sampleAt(1, 0)).isEqualTo((short) 500);
    assertThat(upsampled.sampleAt(2, 0)).isEqualTo((short) 1000);
  }
}
