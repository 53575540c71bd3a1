package com.ospicorp.waterquality.prediction.model;

import java.time.LocalDate;

public record DailyAggregate(
    LocalDate date,
    double avgPh,
    double avgTds,
    double avgTurbidity,
    double avgTemperature,
    int readingCount
) {}
