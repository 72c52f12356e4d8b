package com.scholary.transcriber.service;

import com.scholary.transcriber.audio.AudioBuffer;
import com.scholary.transcriber.audio.AudioSegmenter;
import com.scholary.transcriber.config.TranscriptionProperties;
import com.scholary.transcriber.exception.ErrorKind;
import com.scholary.transcriber.exception.TranscriptionException;
import com.scholary.transcriber.job.TranscriptRecord;
import com.scholary.transcriber.job.TranscriptStore;
import com.scholary.transcriber.job.TranscriptUpdate;
import com.scholary.transcriber.logging.StructuredLogger;
import com.scholary.transcriber.objectstore.ObjectStoreClient;
import com.scholary.transcriber.summary.Summarizer;
import com.scholary.transcriber.transcript.TranscriptResult;
import com.scholary.transcriber.usage.UsageLedger;
import java.net.URLConnection;
import java.time.Clock;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Entry point for transcription jobs.
 *
 * <p>{@link #submit} records the job as {@code PENDING} and returns at once; the work runs on the
 * job executor. {@link #process} drives a job to a terminal status:
 *
 * <ol>
 *   <li>mark {@code PROCESSING}
 *   <li>archive the upload under {@code audio/{uuid}/{filename}}
 *   <li>decode, transcribe, summarize
 *   <li>mark {@code DONE} and add the transcribed seconds to the owner's monthly usage
 * </ol>
 *
 * <p>Any failure marks the job {@code ERROR} with its {@link ErrorKind}; no usage is recorded for
 * failed jobs. A usage-recording failure after {@code DONE} is logged and leaves the job done.
 */
@Service
public class TranscriptionJobService {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionJobService.class);

  private final AudioSegmenter segmenter;
  private final TranscriptionOrchestrator orchestrator;
  private final Summarizer summarizer;
  private final TranscriptStore store;
  private final UsageLedger usageLedger;
  private final ObjectStoreClient objectStore;
  private final Executor jobExecutor;
  private final List<String> supportedLanguages;
  private final Clock clock;

  public TranscriptionJobService(
      AudioSegmenter segmenter,
      TranscriptionOrchestrator orchestrator,
      Summarizer summarizer,
      TranscriptStore store,
      UsageLedger usageLedger,
      ObjectStoreClient objectStore,
      @Qualifier("jobExecutor") Executor jobExecutor,
      TranscriptionProperties properties,
      Clock clock) {
    this.segmenter = segmenter;
    this.orchestrator = orchestrator;
    this.summarizer = summarizer;
    this.store = store;
    this.usageLedger = usageLedger;
    this.objectStore = objectStore;
    this.jobExecutor = jobExecutor;
    this.supportedLanguages = List.copyOf(properties.supportedLanguages());
    this.clock = clock;
  }

  /**
   * Accept a job for background processing.
   *
   * @return the stored {@code PENDING} record
   * @throws IllegalArgumentException if the language is not supported
   * @throws IllegalStateException if the job id is already taken
   */
  public TranscriptRecord submit(TranscriptionJobRequest request) {
    if (!supportedLanguages.contains(request.language())) {
      throw new IllegalArgumentException(
          String.format(
              "Unsupported language '%s'; expected one of %s",
              request.language(), supportedLanguages));
    }

    TranscriptRecord pending =
        TranscriptRecord.pending(
            request.jobId(),
            request.caller().userId(),
            request.language(),
            request.originalFilename(),
            clock.instant());
    store.create(pending);
    LOGGER.info(
        "Accepted job {}: owner={}, file={}, {} bytes",
        request.jobId(),
        request.caller().userId(),
        request.originalFilename(),
        request.audio().length);

    try {
      jobExecutor.execute(() -> process(request));
    } catch (RejectedExecutionException e) {
      LOGGER.error("Job queue is full, rejecting job {}", request.jobId());
      store.apply(request.jobId(), new TranscriptUpdate.SetError(ErrorKind.INTERNAL));
      throw e;
    }
    return pending;
  }

  /**
   * Run a submitted job to completion on the current thread. Never throws.
   *
   * @return the job's terminal record, or empty if the record is no longer in the store
   */
  public Optional<TranscriptRecord> process(TranscriptionJobRequest request) {
    String jobId = request.jobId();
    String ownerId = request.caller().userId();
    StructuredLogger.setJobContext(jobId, ownerId);

    try {
      store.apply(jobId, new TranscriptUpdate.SetProcessing());

      String audioUri =
          objectStore.putObject(
              archiveKey(request.originalFilename()),
              request.audio(),
              contentTypeOf(request.originalFilename()));

      AudioBuffer audio = segmenter.decode(request.audio());
      TranscriptResult result = orchestrator.run(audio, request.language());
      String summary = summarizer.summarize(result.text(), request.language());

      TranscriptRecord done =
          store.apply(
              jobId,
              new TranscriptUpdate.SetDone(
                  result.text(),
                  summary,
                  result.durationSeconds(),
                  result.totalSpeakerCount(),
                  audioUri));
      LOGGER.info(
          "Job {} done: {}s of audio, up to {} speakers",
          jobId,
          result.durationSeconds(),
          result.totalSpeakerCount());
      recordUsage(jobId, ownerId, result.durationSeconds());
      return Optional.of(done);

    } catch (TranscriptionException e) {
      LOGGER.error("Job {} failed: kind={}, message={}", jobId, e.kind(), e.getMessage(), e);
      return markFailed(jobId, e.kind());

    } catch (RuntimeException e) {
      LOGGER.error("Job {} failed unexpectedly", jobId, e);
      return markFailed(jobId, ErrorKind.INTERNAL);

    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private void recordUsage(String jobId, String ownerId, int seconds) {
    try {
      usageLedger.record(ownerId, clock.instant(), seconds);
    } catch (RuntimeException e) {
      LOGGER.error("Job {} is done but its {}s of usage were not recorded", jobId, seconds, e);
    }
  }

  private Optional<TranscriptRecord> markFailed(String jobId, ErrorKind kind) {
    try {
      return Optional.of(store.apply(jobId, new TranscriptUpdate.SetError(kind)));
    } catch (NoSuchElementException e) {
      LOGGER.error("Job {} is no longer stored; dropping its {} status", jobId, kind, e);
      return Optional.empty();
    } catch (IllegalStateException e) {
      LOGGER.error("Job {} already finished; ignoring {}", jobId, kind, e);
      return store.findById(jobId);
    }
  }

  static String archiveKey(String originalFilename) {
    String name = originalFilename.replaceAll(".*[/\\\\]", "");
    if (name.isBlank()) {
      name = "upload";
    }
    return String.format("audio/%s/%s", UUID.randomUUID(), name);
  }

  private static String contentTypeOf(String filename) {
    String guessed = URLConnection.guessContentTypeFromName(filename);
    return guessed != null ? guessed : "application/octet-stream";
  }
}
