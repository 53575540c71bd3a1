package com.ospicorp.waterquality.prediction.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * The UTC bounds of one calendar day, inclusive at both ends:
 * {@code [date 00:00:00.000000000Z, date 23:59:59.999999999Z]}.
 */
public record DayWindow(LocalDate date, Instant start, Instant end) {

  public DayWindow {
    Objects.requireNonNull(date, "date is required");
    Objects.requireNonNull(start, "start is required");
    Objects.requireNonNull(end, "end is required");
    if (start.isAfter(end)) {
      throw new IllegalArgumentException("start must not be after end");
    }
  }

  public static DayWindow of(LocalDate date) {
    Objects.requireNonNull(date, "date is required");
    return new DayWindow(date,
        date.atStartOfDay(ZoneOffset.UTC).toInstant(),
        date.atTime(LocalTime.MAX).toInstant(ZoneOffset.UTC));
  }

  public boolean contains(Instant instant) {
    return instant != null && !instant.isBefore(start) && !instant.isAfter(end);
  }
}
