package com.scholary.transcriber.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.matches;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.transcriber.TestProperties;
import com.scholary.transcriber.audio.AudioBuffer;
import com.scholary.transcriber.audio.AudioSegmenter;
import com.scholary.transcriber.audio.DecodeException;
import com.scholary.transcriber.audio.PcmFormat;
import com.scholary.transcriber.exception.ErrorKind;
import com.scholary.transcriber.job.InMemoryTranscriptStore;
import com.scholary.transcriber.job.JobStatus;
import com.scholary.transcriber.job.TranscriptRecord;
import com.scholary.transcriber.objectstore.ObjectStoreClient;
import com.scholary.transcriber.objectstore.ObjectStoreException;
import com.scholary.transcriber.recognition.RemoteUnavailableException;
import com.scholary.transcriber.summary.ExtractiveSummarizer;
import com.scholary.transcriber.transcript.SpeakerTurn;
import com.scholary.transcriber.transcript.TranscriptResult;
import com.scholary.transcriber.transcript.WordSpan;
import com.scholary.transcriber.usage.InMemoryUsageLedger;
import com.scholary.transcriber.usage.UsageLedger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TranscriptionJobServiceTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneOffset.UTC);
  private static final byte[] UPLOAD = {1, 2, 3, 4};
  private static final AudioBuffer AUDIO = new AudioBuffer(new byte[64], PcmFormat.mono(16000));

  @Mock private AudioSegmenter segmenter;
  @Mock private TranscriptionOrchestrator orchestrator;
  @Mock private ObjectStoreClient objectStore;

  private InMemoryTranscriptStore store;
  private InMemoryUsageLedger usageLedger;
  private TranscriptionJobService service;

  @BeforeEach
  void setUp() {
    store = new InMemoryTranscriptStore(100, 60, CLOCK);
    usageLedger = new InMemoryUsageLedger(CLOCK);
    service =
        new TranscriptionJobService(
            segmenter,
            orchestrator,
            new ExtractiveSummarizer(),
            store,
            usageLedger,
            objectStore,
            Runnable::run,
            TestProperties.transcription(16000, Duration.ofMinutes(5)),
            CLOCK);
  }

  private static TranscriptionJobRequest request(String jobId, String language) {
    return new TranscriptionJobRequest(
        jobId, new CallerIdentity("user-1"), UPLOAD, "weekly sync.mp3", language);
  }

  private static TranscriptResult transcript() {
    WordSpan hello = new WordSpan("Hello.", 0.0, 1.0, 1);
    WordSpan bye = new WordSpan("Bye.", 40.0, 42.5, 2);
    return new TranscriptResult(
        "Speaker 1: Hello.\nSpeaker 2: Bye.",
        42,
        2,
        List.of(new SpeakerTurn(1, List.of(hello)), new SpeakerTurn(2, List.of(bye))));
  }

  @Test
  void submit_shouldRejectUnsupportedLanguage() {
    assertThatThrownBy(() -> service.submit(request("job-1", "fr")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("fr");

    assertThat(store.findById("job-1")).isEmpty();
    verifyNoInteractions(segmenter, orchestrator, objectStore);
  }

  @Test
  void submit_shouldRunJobToDone() {
    when(objectStore.putObject(anyString(), eq(UPLOAD), anyString()))
        .thenReturn("s3://meeting-audio/audio/x/weekly sync.mp3");
    when(segmenter.decode(UPLOAD)).thenReturn(AUDIO);
    when(orchestrator.run(AUDIO, "en")).thenReturn(transcript());

    TranscriptRecord pending = service.submit(request("job-1", "en"));

    assertThat(pending.status()).isEqualTo(JobStatus.PENDING);
    TranscriptRecord done = store.findById("job-1").orElseThrow();
    assertThat(done.status()).isEqualTo(JobStatus.DONE);
    assertThat(done.ownerId()).isEqualTo("user-1");
    assertThat(done.text()).isEqualTo("Speaker 1: Hello.\nSpeaker 2: Bye.");
    assertThat(done.summary()).startsWith("Automatic meeting summary:");
    assertThat(done.durationSeconds()).isEqualTo(42);
    assertThat(done.speakerCount()).isEqualTo(2);
    assertThat(done.audioUri()).isEqualTo("s3://meeting-audio/audio/x/weekly sync.mp3");
    assertThat(done.completedAt()).isEqualTo(CLOCK.instant());
    assertThat(usageLedger.secondsFor("user-1", LocalDate.of(2024, 3, 1))).isEqualTo(42);
  }

  @Test
  void process_shouldArchiveUnderUniqueAudioKey() {
    when(objectStore.putObject(anyString(), any(), anyString())).thenReturn("s3://b/k");
    when(segmenter.decode(UPLOAD)).thenReturn(AUDIO);
    when(orchestrator.run(AUDIO, "it")).thenReturn(TranscriptResult.empty());
    store.create(
        TranscriptRecord.pending("job-2", "user-1", "it", "a/b/memo.wav", CLOCK.instant()));

    service.process(
        new TranscriptionJobRequest(
            "job-2", new CallerIdentity("user-1"), UPLOAD, "a/b/memo.wav", "it"));

    verify(objectStore)
        .putObject(
            matches("audio/[0-9a-f\\-]{36}/memo\\.wav"), eq(UPLOAD), anyString());
    TranscriptRecord done = store.findById("job-2").orElseThrow();
    assertThat(done.summary()).isEqualTo("Riassunto non disponibile.");
  }

  @Test
  void process_decodeFailure_shouldMarkErrorWithoutUsage() {
    when(objectStore.putObject(anyString(), any(), anyString())).thenReturn("s3://b/k");
    when(segmenter.decode(UPLOAD)).thenThrow(new DecodeException("not audio"));

    service.submit(request("job-3", "en"));

    TranscriptRecord failed = store.findById("job-3").orElseThrow();
    assertThat(failed.status()).isEqualTo(JobStatus.ERROR);
    assertThat(failed.errorKind()).isEqualTo(ErrorKind.DECODE_ERROR);
    assertThat(failed.text()).isNull();
    assertThat(failed.completedAt()).isNull();
    assertThat(usageLedger.secondsFor("user-1", LocalDate.of(2024, 3, 1))).isZero();
  }

  @Test
  void process_chunkFailure_shouldMarkErrorWithRemoteKind() {
    when(objectStore.putObject(anyString(), any(), anyString())).thenReturn("s3://b/k");
    when(segmenter.decode(UPLOAD)).thenReturn(AUDIO);
    when(orchestrator.run(AUDIO, "en")).thenThrow(new RemoteUnavailableException("503"));

    service.submit(request("job-4", "en"));

    assertThat(store.findById("job-4").orElseThrow().errorKind())
        .isEqualTo(ErrorKind.REMOTE_UNAVAILABLE);
  }

  @Test
  void process_storageFailure_shouldMarkStorageError() {
    when(objectStore.putObject(anyString(), any(), anyString()))
        .thenThrow(new ObjectStoreException("bucket missing"));

    service.submit(request("job-5", "en"));

    assertThat(store.findById("job-5").orElseThrow().errorKind())
        .isEqualTo(ErrorKind.STORAGE_ERROR);
    verifyNoInteractions(segmenter, orchestrator);
  }

  @Test
  void process_unexpectedFailure_shouldMarkInternalError() {
    when(objectStore.putObject(anyString(), any(), anyString())).thenReturn("s3://b/k");
    when(segmenter.decode(UPLOAD)).thenThrow(new IllegalStateException("bug"));

    service.submit(request("job-6", "en"));

    assertThat(store.findById("job-6").orElseThrow().errorKind()).isEqualTo(ErrorKind.INTERNAL);
  }

  @Test
  void submit_duplicateJobId_shouldBeRejected() {
    store.create(TranscriptRecord.pending("job-7", "user-1", "en", "x.mp3", CLOCK.instant()));

    assertThatThrownBy(() -> service.submit(request("job-7", "en")))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void process_recordMissingFromStore_shouldReturnEmptyWithoutThrowing() {
    assertThat(service.process(request("job-8", "en"))).isEmpty();

    assertThat(store.findById("job-8")).isEmpty();
    verifyNoInteractions(segmenter, orchestrator, objectStore);
    assertThat(usageLedger.secondsFor("user-1", LocalDate.of(2024, 3, 1))).isZero();
  }

  @Test
  void process_usageLedgerFailure_shouldLeaveJobDone() {
    UsageLedger brokenLedger = mock(UsageLedger.class);
    doThrow(new IllegalStateException("ledger offline"))
        .when(brokenLedger)
        .record(anyString(), any(), anyLong());
    TranscriptionJobService withBrokenLedger =
        new TranscriptionJobService(
            segmenter,
            orchestrator,
            new ExtractiveSummarizer(),
            store,
            brokenLedger,
            objectStore,
            Runnable::run,
            TestProperties.transcription(16000, Duration.ofMinutes(5)),
            CLOCK);
    when(objectStore.putObject(anyString(), any(), anyString())).thenReturn("s3://b/k");
    when(segmenter.decode(UPLOAD)).thenReturn(AUDIO);
    when(orchestrator.run(AUDIO, "en")).thenReturn(transcript());
    store.create(
        TranscriptRecord.pending("job-9", "user-1", "en", "weekly sync.mp3", CLOCK.instant()));

    TranscriptRecord result = withBrokenLedger.process(request("job-9", "en")).orElseThrow();

    assertThat(result.status()).isEqualTo(JobStatus.DONE);
    assertThat(store.findById("job-9").orElseThrow().status()).isEqualTo(JobStatus.DONE);
  }
}
