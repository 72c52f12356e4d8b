package com.scholary.transcriber.config;

import com.scholary.transcriber.audio.AudioDecoder;
import com.scholary.transcriber.audio.FfmpegAudioDecoder;
import com.scholary.transcriber.audio.JavaSoundAudioDecoder;
import java.nio.file.Paths;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for transcription-related beans.
 *
 * <p>Enables the TranscriptionProperties to be loaded from application.yml and picks the audio
 * decoder: {@code ffmpeg} (default, any format) or {@code javasound} (WAV/AIFF/AU, no external
 * binary).
 */
@Configuration
@EnableConfigurationProperties(TranscriptionProperties.class)
public class TranscriptionConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public AudioDecoder audioDecoder(TranscriptionProperties properties) {
    if (TranscriptionProperties.DECODER_JAVASOUND.equals(properties.decoder())) {
      return new JavaSoundAudioDecoder();
    }
    if (TranscriptionProperties.DECODER_FFMPEG.equals(properties.decoder())) {
      return new FfmpegAudioDecoder(
          "ffmpeg", Paths.get(properties.tempDir()), properties.segmentation().sampleRate());
    }
    throw new IllegalStateException("Unknown audio decoder: " + properties.decoder());
  }
}
