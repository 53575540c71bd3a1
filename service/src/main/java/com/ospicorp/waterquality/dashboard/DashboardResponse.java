package com.ospicorp.waterquality.dashboard;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.waterquality.prediction.model.DailyPrediction;
import com.ospicorp.waterquality.reading.model.SensorReadingDto;

/** Either side is null until the first reading or prediction exists. */
public record DashboardResponse(
    @JsonProperty("latest_reading") SensorReadingDto latestReading,
    @JsonProperty("latest_prediction") DailyPrediction latestPrediction
) {}
