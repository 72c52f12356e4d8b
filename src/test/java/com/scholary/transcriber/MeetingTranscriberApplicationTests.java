package com.scholary.transcriber;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.transcriber.audio.AudioDecoder;
import com.scholary.transcriber.audio.JavaSoundAudioDecoder;
import com.scholary.transcriber.recognition.HttpSpeechRecognitionService;
import com.scholary.transcriber.recognition.SpeechRecognitionService;
import com.scholary.transcriber.service.TranscriptionJobService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class MeetingTranscriberApplicationTests {

  @Autowired private TranscriptionJobService jobService;
  @Autowired private AudioDecoder audioDecoder;
  @Autowired private SpeechRecognitionService speechRecognitionService;

  @Test
  void contextLoads() {
    assertThat(jobService).isNotNull();
    assertThat(audioDecoder).isInstanceOf(JavaSoundAudioDecoder.class);
    assertThat(speechRecognitionService).isInstanceOf(HttpSpeechRecognitionService.class);
  }
}
