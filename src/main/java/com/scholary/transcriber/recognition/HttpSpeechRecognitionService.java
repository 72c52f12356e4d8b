package com.scholary.transcriber.recognition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcriber.audio.AudioChunk;
import com.scholary.transcriber.exception.TranscriptionCancelledException;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the Google Cloud Speech-to-Text v1 REST API.
 *
 * <p>Recognition of anything longer than a minute has to go through the long-running endpoint:
 * {@code POST /v1/speech:longrunningrecognize} returns an operation name, and {@code GET
 * /v1/operations/{name}} is polled until the operation reports {@code done}. Audio is sent inline
 * as base64 LINEAR16.
 *
 * <p>With diarization on, the service repeats every word of the chunk, speaker-tagged, in the
 * last result. Earlier results carry the same words without tags. We take the last tagged result
 * and fall back to all words only when no result is tagged.
 *
 * <p>This class does not retry. It classifies failures so {@link ChunkTranscriptionClient} can
 * decide:
 *
 * <ul>
 *   <li>connection errors, HTTP 408/429/5xx: {@link RemoteUnavailableException}
 *   <li>HTTP 400/401/403/404, operation errors for bad input or credentials: {@link
 *       RemoteRejectedException}
 *   <li>operation still running at the deadline: {@link RemoteTimeoutException}
 * </ul>
 */
@Component
public class HttpSpeechRecognitionService implements SpeechRecognitionService {

  private static final Logger LOGGER =
      LoggerFactory.getLogger(HttpSpeechRecognitionService.class);

  // google.rpc.Code values that mean the request itself is bad
  private static final int CODE_INVALID_ARGUMENT = 3;
  private static final int CODE_DEADLINE_EXCEEDED = 4;
  private static final int CODE_NOT_FOUND = 5;
  private static final int CODE_PERMISSION_DENIED = 7;
  private static final int CODE_UNAUTHENTICATED = 16;

  private final HttpClient httpClient;
  private final SpeechProperties properties;
  private final ObjectMapper objectMapper;

  public HttpSpeechRecognitionService(SpeechProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient = HttpClient.newBuilder().connectTimeout(properties.connectTimeout()).build();

    LOGGER.info(
        "Initialized speech client: baseUrl={}, model={}",
        properties.baseUrl(),
        properties.model());
  }

  @Override
  public RecognitionJob submit(AudioChunk chunk, RecognitionConfig config) {
    RecognizeRequest body = RecognizeRequest.of(chunk, config);
    HttpRequest request;
    try {
      request =
          HttpRequest.newBuilder()
              .uri(endpoint("/v1/speech:longrunningrecognize"))
              .timeout(properties.requestTimeout())
              .header("Content-Type", "application/json")
              .POST(BodyPublishers.ofByteArray(objectMapper.writeValueAsBytes(body)))
              .build();
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize recognition request", e);
    }

    Operation operation = send(request);
    if (operation.name() == null && !operation.done()) {
      throw new RemoteUnavailableException("Speech service returned an operation without a name");
    }
    LOGGER.debug(
        "Submitted chunk {} ({} bytes): operation={}",
        chunk.index(),
        chunk.samples().length,
        operation.name());
    return new PollingRecognitionJob(operation);
  }

  private Operation poll(String operationName) {
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(
                endpoint(
                    "/v1/operations/" + URLEncoder.encode(operationName, StandardCharsets.UTF_8)))
            .timeout(properties.requestTimeout())
            .GET()
            .build();
    return send(request);
  }

  private Operation send(HttpRequest request) {
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new RemoteUnavailableException("Speech service request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TranscriptionCancelledException("Speech request interrupted", e);
    }

    int status = response.statusCode();
    if (status == 400 || status == 401 || status == 403 || status == 404) {
      LOGGER.warn("Speech service rejected request: status={}, body={}", status, response.body());
      throw new RemoteRejectedException("Speech service rejected request with status " + status);
    }
    if (status != 200) {
      throw new RemoteUnavailableException("Speech service returned status " + status);
    }

    try {
      return objectMapper.readValue(response.body(), Operation.class);
    } catch (JsonProcessingException e) {
      throw new RemoteUnavailableException("Unreadable response from speech service", e);
    }
  }

  private URI endpoint(String path) {
    String uri = properties.baseUrl() + path;
    if (!properties.apiKey().isBlank()) {
      uri += "?key=" + URLEncoder.encode(properties.apiKey(), StandardCharsets.UTF_8);
    }
    return URI.create(uri);
  }

  static RecognitionResponse toResponse(Operation operation) {
    if (operation.error() != null) {
      throw toException(operation.error());
    }
    List<Result> results =
        operation.response() == null || operation.response().results() == null
            ? List.of()
            : operation.response().results();

    List<WordInfo> diarized = null;
    List<WordInfo> all = new ArrayList<>();
    for (Result result : results) {
      List<WordInfo> words = result.firstAlternativeWords();
      all.addAll(words);
      if (words.stream().anyMatch(w -> w.speakerTag() > 0)) {
        diarized = words;
      }
    }

    List<RecognizedWord> recognized = new ArrayList<>();
    for (WordInfo word : diarized != null ? diarized : all) {
      recognized.add(
          new RecognizedWord(
              word.word(),
              parseDuration(word.startTime()),
              parseDuration(word.endTime()),
              word.speakerTag()));
    }
    return new RecognitionResponse(recognized);
  }

  private static RuntimeException toException(Status error) {
    String message =
        String.format("Recognition failed with code %d: %s", error.code(), error.message());
    switch (error.code()) {
      case CODE_INVALID_ARGUMENT:
      case CODE_NOT_FOUND:
      case CODE_PERMISSION_DENIED:
      case CODE_UNAUTHENTICATED:
        return new RemoteRejectedException(message);
      case CODE_DEADLINE_EXCEEDED:
        return new RemoteTimeoutException(message);
      default:
        return new RemoteUnavailableException(message);
    }
  }

  /** Parse a protobuf JSON duration such as {@code "1.200s"}. */
  static double parseDuration(String value) {
    if (value == null || value.isEmpty()) {
      return 0.0;
    }
    String number = value.endsWith("s") ? value.substring(0, value.length() - 1) : value;
    return Double.parseDouble(number);
  }

  /** Polls the operation until it is done or the caller's timeout passes. */
  private class PollingRecognitionJob implements RecognitionJob {

    private Operation operation;

    PollingRecognitionJob(Operation operation) {
      this.operation = operation;
    }

    @Override
    public RecognitionResponse await(Duration timeout) {
      Instant deadline = Instant.now().plus(timeout);
      while (!operation.done()) {
        Duration remaining = Duration.between(Instant.now(), deadline);
        if (remaining.isNegative() || remaining.isZero()) {
          throw new RemoteTimeoutException(
              String.format(
                  "Operation %s not finished after %ds", operation.name(), timeout.toSeconds()));
        }
        Duration interval = properties.pollInterval();
        sleep(remaining.compareTo(interval) < 0 ? remaining : interval);
        operation = poll(operation.name());
      }
      return toResponse(operation);
    }

    private void sleep(Duration duration) {
      try {
        Thread.sleep(duration.toMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new TranscriptionCancelledException("Interrupted while waiting for recognition", e);
      }
    }
  }

  // Wire format. Field names follow the REST API's JSON mapping.

  @JsonInclude(JsonInclude.Include.NON_NULL)
  record RecognizeRequest(Config config, Audio audio) {

    static RecognizeRequest of(AudioChunk chunk, RecognitionConfig config) {
      return new RecognizeRequest(
          new Config(
              "LINEAR16",
              config.sampleRateHertz(),
              config.languageCode(),
              config.enableWordTimeOffsets(),
              config.enableAutomaticPunctuation(),
              config.model(),
              new DiarizationConfig(true, config.minSpeakerCount(), config.maxSpeakerCount())),
          new Audio(Base64.getEncoder().encodeToString(chunk.samples())));
    }
  }

  record Config(
      String encoding,
      int sampleRateHertz,
      String languageCode,
      boolean enableWordTimeOffsets,
      boolean enableAutomaticPunctuation,
      String model,
      DiarizationConfig diarizationConfig) {}

  record DiarizationConfig(
      boolean enableSpeakerDiarization, int minSpeakerCount, int maxSpeakerCount) {}

  record Audio(String content) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Operation(String name, boolean done, Status error, RecognizeResponse response) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Status(int code, String message) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record RecognizeResponse(List<Result> results) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Result(List<Alternative> alternatives) {

    List<WordInfo> firstAlternativeWords() {
      if (alternatives == null || alternatives.isEmpty() || alternatives.get(0).words() == null) {
        return List.of();
      }
      return alternatives.get(0).words();
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Alternative(String transcript, List<WordInfo> words) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record WordInfo(String word, String startTime, String endTime, int speakerTag) {}
}
