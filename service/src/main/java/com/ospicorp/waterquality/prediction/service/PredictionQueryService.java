package com.ospicorp.waterquality.prediction.service;

import com.ospicorp.waterquality.prediction.model.DailyPrediction;
import com.ospicorp.waterquality.prediction.repository.DailyPredictionDao;
import com.ospicorp.waterquality.web.InvalidParameterException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;

@Service
public class PredictionQueryService {
  static final int DEFAULT_HISTORY_DAYS = 30;
  static final int MAX_HISTORY_DAYS = 366;

  private final DailyPredictionDao dao;
  private final Clock clock;

  public PredictionQueryService(DailyPredictionDao dao, Clock clock) {
    this.dao = dao;
    this.clock = clock;
  }

  public Optional<DailyPrediction> latest() {
    return dao.findLatest();
  }

  public Optional<DailyPrediction> forDate(LocalDate date) {
    return dao.findByDate(date);
  }

  public List<DailyPrediction> history(LocalDate start, LocalDate end) {
    LocalDate effectiveEnd = end != null ? end : LocalDate.now(clock);
    LocalDate effectiveStart = start != null
        ? start
        : effectiveEnd.minusDays(DEFAULT_HISTORY_DAYS - 1L);

    if (effectiveStart.isAfter(effectiveEnd)) {
      throw InvalidParameterException.of("start must be before or equal to end", 3001);
    }
    if (ChronoUnit.DAYS.between(effectiveStart, effectiveEnd) >= MAX_HISTORY_DAYS) {
      throw InvalidParameterException.of(
          "Date range too large. Maximum span is " + MAX_HISTORY_DAYS + " days.", 3002);
    }
    return dao.findRange(effectiveStart, effectiveEnd);
  }
}
