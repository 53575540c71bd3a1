package com.ospicorp.waterquality.job;

import java.time.LocalDate;

/** A run for the same date is already in flight. Coordination signal, not a job failure. */
public class ConcurrentRunRejectedException extends RuntimeException {
  private final LocalDate date;

  public ConcurrentRunRejectedException(LocalDate date) {
    super("Daily prediction for " + date + " is already running");
    this.date = date;
  }

  public LocalDate date() {
    return date;
  }
}
