package com.ospicorp.waterquality.reading.service;

import com.ospicorp.waterquality.reading.model.SensorReading;
import com.ospicorp.waterquality.reading.model.SensorReadingDto;
import com.ospicorp.waterquality.reading.model.SensorReadingRequest;
import com.ospicorp.waterquality.reading.repository.SensorReadingRepository;
import com.ospicorp.waterquality.web.InvalidParameterException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class SensorReadingService {

  private static final Logger log = LoggerFactory.getLogger(SensorReadingService.class);
  static final Duration MAX_CLOCK_SKEW = Duration.ofMinutes(5);

  private final SensorReadingRepository repository;
  private final Clock clock;

  public SensorReadingService(SensorReadingRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  @Transactional
  public SensorReadingDto record(SensorReadingRequest request) {
    Objects.requireNonNull(request, "request is required");
    requireFinite("ph", request.ph());
    requireFinite("tds", request.tds());
    requireFinite("turbidity", request.turbidity());
    requireFinite("temperature", request.temperature());

    Instant now = clock.instant();
    // Postgres stores microseconds; rounding on write could move a reading into the next day.
    Instant recordedAt = (request.timestamp() != null ? request.timestamp() : now)
        .truncatedTo(ChronoUnit.MICROS);
    if (recordedAt.isAfter(now.plus(MAX_CLOCK_SKEW))) {
      throw InvalidParameterException.of("timestamp must not be in the future", 2002);
    }

    SensorReading saved = repository.save(new SensorReading(
        request.ph(), request.tds(), request.turbidity(), request.temperature(), recordedAt));
    log.info("Stored sensor reading {} recorded at {}", saved.getId(), saved.getRecordedAt());
    return SensorReadingDto.from(saved);
  }

  @Transactional(readOnly = true)
  public Optional<SensorReadingDto> latest() {
    return repository.findFirstByOrderByRecordedAtDescIdDesc().map(SensorReadingDto::from);
  }

  private static void requireFinite(String name, Double value) {
    if (value == null || !Double.isFinite(value)) {
      throw InvalidParameterException.of(name + " must be a finite number", 2001);
    }
  }
}
