package com.scholary.transcriber.usage;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/** Usage ledger kept in a concurrent map; lost on restart. */
@Repository
public class InMemoryUsageLedger implements UsageLedger {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryUsageLedger.class);

  private final Map<PeriodKey, Long> totals = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryUsageLedger(Clock clock) {
    this.clock = clock;
  }

  @Override
  public void record(String ownerId, Instant at, long seconds) {
    if (seconds < 0) {
      throw new IllegalArgumentException("Usage cannot be negative: " + seconds);
    }
    LocalDate period = UsagePeriods.periodStart(at, clock.getZone());
    long total = totals.merge(new PeriodKey(ownerId, period), seconds, Long::sum);
    LOGGER.debug("Usage for {} in {}: +{}s, total {}s", ownerId, period, seconds, total);
  }

  @Override
  public long secondsFor(String ownerId, LocalDate periodStart) {
    return totals.getOrDefault(new PeriodKey(ownerId, periodStart), 0L);
  }

  private record PeriodKey(String ownerId, LocalDate periodStart) {}
}
