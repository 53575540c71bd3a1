package com.ospicorp.waterquality.config;

import com.ospicorp.waterquality.reading.model.SensorReading;
import com.ospicorp.waterquality.reading.repository.SensorReadingRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** Fills an empty development database with plausible probe readings. */
@Component
public class ReadingSeeder implements CommandLineRunner {

  private static final Logger log = LoggerFactory.getLogger(ReadingSeeder.class);
  private static final Duration REPORTING_INTERVAL = Duration.ofHours(3);

  private final SensorReadingRepository repository;
  private final Environment environment;
  private final Clock clock;
  private final boolean seedEnabled;
  private final int days;
  private final Random random = new Random(8675309L);

  public ReadingSeeder(SensorReadingRepository repository,
      Environment environment,
      Clock clock,
      @Value("${waterquality.seed.enabled:false}") boolean seedEnabled,
      @Value("${waterquality.seed.days:7}") int days) {
    this.repository = repository;
    this.environment = environment;
    this.clock = clock;
    this.seedEnabled = seedEnabled;
    this.days = days;
  }

  @Override
  public void run(String... args) {
    if (!seedEnabled) {
      log.info("Reading seeding disabled via property waterquality.seed.enabled=false");
      return;
    }
    if (environment.acceptsProfiles(Profiles.of("prod"))) {
      log.info("Skipping reading seeding because active profile includes prod");
      return;
    }
    long existing = repository.count();
    if (existing > 0) {
      log.info("Database already contains {} sensor readings; skipping seeding", existing);
      return;
    }
    seed();
  }

  @Transactional
  void seed() {
    LocalDate today = LocalDate.now(clock);
    Instant from = today.minusDays(days).atStartOfDay(ZoneOffset.UTC).toInstant();
    Instant until = clock.instant();
    List<SensorReading> readings = new ArrayList<>();
    for (Instant at = from; at.isBefore(until); at = at.plus(REPORTING_INTERVAL)) {
      readings.add(new SensorReading(
          round(clamp(7.2 + random.nextGaussian() * 0.4, 0, 14)),
          round(Math.max(0, 320 + random.nextGaussian() * 60)),
          round(Math.max(0, 2.5 + random.nextGaussian() * 1.2)),
          round(clamp(18 + random.nextGaussian() * 3, -20, 100)),
          at));
    }
    repository.saveAll(readings);
    log.info("Seeded {} sensor readings covering {} days from {}", readings.size(), days, from);
  }

  private static double clamp(double value, double min, double max) {
    return Math.max(min, Math.min(max, value));
  }

  private static double round(double value) {
    return Math.round(value * 100.0) / 100.0;
  }
}
