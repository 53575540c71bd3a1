package com.ospicorp.waterquality.prediction.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.time.LocalDate;

@JsonPropertyOrder({"id", "date", "avg_ph", "avg_tds", "avg_turbidity", "avg_temperature",
    "label", "confidence", "reading_count", "computed_at"})
public record DailyPrediction(
    long id,
    @JsonProperty("date") LocalDate date,
    @JsonProperty("avg_ph") double avgPh,
    @JsonProperty("avg_tds") double avgTds,
    @JsonProperty("avg_turbidity") double avgTurbidity,
    @JsonProperty("avg_temperature") double avgTemperature,
    String label,
    Double confidence,
    @JsonProperty("reading_count") int readingCount,
    @JsonProperty("computed_at") Instant computedAt
) {}
