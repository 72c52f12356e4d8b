package com.scholary.transcriber.usage;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/** Billing periods are calendar months. */
public final class UsagePeriods {

  private UsagePeriods() {}

  /** First day of the month containing {@code instant}, in the given zone. */
  public static LocalDate periodStart(Instant instant, ZoneId zone) {
    return LocalDate.ofInstant(instant, zone).withDayOfMonth(1);
  }
}
