package com.scholary.transcriber.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory transcript store.
 *
 * <p>Jobs that are still {@code PENDING} or {@code PROCESSING} live in an unbounded map and are
 * never evicted. Once a job reaches a terminal status its record moves to a Caffeine cache, which
 * bounds memory by evicting old finished jobs. Updates of an in-flight job go through {@link
 * ConcurrentHashMap#computeIfPresent}, so two concurrent updates are applied one after the other.
 */
@Repository
public class InMemoryTranscriptStore implements TranscriptStore {

  private final Map<String, TranscriptRecord> inFlight = new ConcurrentHashMap<>();
  private final Cache<String, TranscriptRecord> finished;
  private final Clock clock;

  public InMemoryTranscriptStore(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes,
      Clock clock) {

    this.finished =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();
    this.clock = clock;
  }

  @Override
  public void create(TranscriptRecord record) {
    TranscriptRecord existing =
        inFlight.compute(
            record.jobId(),
            (id, current) -> {
              if (current != null || finished.getIfPresent(id) != null) {
                throw new IllegalStateException("Job already exists: " + id);
              }
              return record;
            });
    if (existing.status().isTerminal()) {
      moveToFinished(existing);
    }
  }

  @Override
  public TranscriptRecord apply(String jobId, TranscriptUpdate update) {
    TranscriptRecord updated =
        inFlight.computeIfPresent(jobId, (id, current) -> current.apply(update, clock.instant()));
    if (updated == null) {
      TranscriptRecord done = finished.getIfPresent(jobId);
      if (done == null) {
        throw new NoSuchElementException("Unknown job: " + jobId);
      }
      // terminal records reject every update
      return done.apply(update, clock.instant());
    }
    if (updated.status().isTerminal()) {
      moveToFinished(updated);
    }
    return updated;
  }

  @Override
  public Optional<TranscriptRecord> findById(String jobId) {
    TranscriptRecord record = inFlight.get(jobId);
    if (record != null) {
      return Optional.of(record);
    }
    return Optional.ofNullable(finished.getIfPresent(jobId));
  }

  @Override
  public List<TranscriptRecord> findByOwner(String ownerId) {
    Map<String, TranscriptRecord> byId = new LinkedHashMap<>();
    Stream.concat(finished.asMap().values().stream(), inFlight.values().stream())
        .filter(record -> record.ownerId().equals(ownerId))
        .forEach(record -> byId.put(record.jobId(), record));
    return byId.values().stream()
        .sorted(Comparator.comparing(TranscriptRecord::createdAt).reversed())
        .collect(Collectors.toList());
  }

  private void moveToFinished(TranscriptRecord record) {
    finished.put(record.jobId(), record);
    inFlight.remove(record.jobId(), record);
  }
}
