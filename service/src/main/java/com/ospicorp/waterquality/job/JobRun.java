package com.ospicorp.waterquality.job;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.waterquality.prediction.model.DailyPrediction;
import java.time.Instant;
import java.time.LocalDate;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobRun(
    @JsonProperty("date") LocalDate date,
    JobState state,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("finished_at") Instant finishedAt,
    DailyPrediction prediction,
    String message
) {

  static JobRun completed(LocalDate date, Instant startedAt, Instant finishedAt,
      DailyPrediction prediction) {
    return new JobRun(date, JobState.COMPLETED, startedAt, finishedAt, prediction,
        "Prediction stored from " + prediction.readingCount() + " readings");
  }

  static JobRun skipped(LocalDate date, Instant startedAt, Instant finishedAt) {
    return new JobRun(date, JobState.SKIPPED_NO_DATA, startedAt, finishedAt, null,
        "No sensor readings for " + date);
  }

  static JobRun failed(LocalDate date, Instant startedAt, Instant finishedAt, String message) {
    return new JobRun(date, JobState.FAILED, startedAt, finishedAt, null, message);
  }
}
