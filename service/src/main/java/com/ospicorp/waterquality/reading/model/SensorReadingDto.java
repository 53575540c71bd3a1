package com.ospicorp.waterquality.reading.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record SensorReadingDto(
    long id,
    double ph,
    double tds,
    double turbidity,
    double temperature,
    @JsonProperty("timestamp") Instant recordedAt
) {

  public static SensorReadingDto from(SensorReading reading) {
    return new SensorReadingDto(
        reading.getId(),
        reading.getPh(),
        reading.getTds(),
        reading.getTurbidity(),
        reading.getTemperature(),
        reading.getRecordedAt());
  }
}
