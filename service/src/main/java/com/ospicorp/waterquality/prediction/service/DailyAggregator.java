package com.ospicorp.waterquality.prediction.service;

import com.ospicorp.waterquality.prediction.model.DailyAggregate;
import com.ospicorp.waterquality.prediction.model.DayWindow;
import com.ospicorp.waterquality.reading.model.SensorReading;
import java.util.List;
import java.util.Optional;

/**
 * Reduces one day of readings to per-parameter means. Readings outside the window are ignored,
 * and an empty result means "no data for this day", not a failure.
 */
public final class DailyAggregator {
  private DailyAggregator() {
  }

  public static Optional<DailyAggregate> aggregate(List<SensorReading> readings, DayWindow window) {
    if (readings == null || readings.isEmpty()) return Optional.empty();
    double ph = 0d;
    double tds = 0d;
    double turbidity = 0d;
    double temperature = 0d;
    int count = 0;
    for (SensorReading r : readings) {
      if (r == null || !window.contains(r.getRecordedAt())) continue;
      ph += r.getPh();
      tds += r.getTds();
      turbidity += r.getTurbidity();
      temperature += r.getTemperature();
      count++;
    }
    if (count == 0) return Optional.empty();
    return Optional.of(new DailyAggregate(window.date(),
        ph / count, tds / count, turbidity / count, temperature / count, count));
  }
}
