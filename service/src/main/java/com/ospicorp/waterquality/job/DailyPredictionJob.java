package com.ospicorp.waterquality.job;

import com.ospicorp.waterquality.classifier.ArtifactNotLoadedException;
import com.ospicorp.waterquality.classifier.Classification;
import com.ospicorp.waterquality.classifier.RiskClassifier;
import com.ospicorp.waterquality.prediction.model.DailyAggregate;
import com.ospicorp.waterquality.prediction.model.DailyPrediction;
import com.ospicorp.waterquality.prediction.model.DayWindow;
import com.ospicorp.waterquality.prediction.repository.DailyPredictionDao;
import com.ospicorp.waterquality.prediction.service.DailyAggregator;
import com.ospicorp.waterquality.reading.model.SensorReading;
import com.ospicorp.waterquality.reading.repository.SensorReadingRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Aggregates one UTC day of readings, classifies the means and stores the dated prediction.
 *
 * <p>Scheduled and manual triggers both call {@link #run(LocalDate)}. At most one run per date is
 * in flight; a second trigger for the same date gets {@link ConcurrentRunRejectedException}.
 * Every other outcome, including classifier and database failures, comes back as a {@link JobRun}
 * instead of an exception so the scheduler keeps its cadence.
 */
@Service
public class DailyPredictionJob {

  private static final Logger log = LoggerFactory.getLogger(DailyPredictionJob.class);

  private final SensorReadingRepository readings;
  private final RiskClassifier classifier;
  private final DailyPredictionDao predictions;
  private final Clock clock;

  private final ConcurrentMap<LocalDate, Instant> inFlight = new ConcurrentHashMap<>();
  private final AtomicReference<JobRun> lastRun = new AtomicReference<>();

  public DailyPredictionJob(SensorReadingRepository readings, RiskClassifier classifier,
      DailyPredictionDao predictions, Clock clock) {
    this.readings = readings;
    this.classifier = classifier;
    this.predictions = predictions;
    this.clock = clock;
  }

  public JobRun runForYesterday() {
    return run(yesterday());
  }

  public JobRun run(LocalDate date) {
    Objects.requireNonNull(date, "date is required");
    Instant startedAt = clock.instant();
    if (inFlight.putIfAbsent(date, startedAt) != null) {
      log.warn("Rejected daily prediction trigger for {}: a run is already in flight", date);
      throw new ConcurrentRunRejectedException(date);
    }
    try {
      log.info("Daily prediction for {} {}", date, JobState.RUNNING);
      JobRun run = execute(date, startedAt);
      lastRun.set(run);
      log.info("Daily prediction for {} finished {}: {}", date, run.state(), run.message());
      return run;
    } finally {
      inFlight.remove(date);
    }
  }

  public LocalDate yesterday() {
    return LocalDate.now(clock).minusDays(1);
  }

  public Optional<JobRun> lastRun() {
    return Optional.ofNullable(lastRun.get());
  }

  public Set<LocalDate> runningDates() {
    return new TreeSet<>(inFlight.keySet());
  }

  private JobRun execute(LocalDate date, Instant startedAt) {
    DayWindow window = DayWindow.of(date);

    Optional<DailyAggregate> aggregate;
    try {
      List<SensorReading> dayReadings = readings.findWindow(window.start(), window.end());
      aggregate = DailyAggregator.aggregate(dayReadings, window);
    } catch (DataAccessException ex) {
      log.error("Could not load readings for {} in [{}, {}]", date, window.start(), window.end(), ex);
      return JobRun.failed(date, startedAt, clock.instant(),
          "Reading query failed: " + ex.getMostSpecificCause().getMessage());
    }

    if (aggregate.isEmpty()) {
      log.warn("No sensor data available for {}; skipping prediction", date);
      return JobRun.skipped(date, startedAt, clock.instant());
    }

    DailyAggregate agg = aggregate.get();
    log.info("Daily aggregates for {}: ph={} tds={} turbidity={} temperature={} from {} readings",
        date, agg.avgPh(), agg.avgTds(), agg.avgTurbidity(), agg.avgTemperature(),
        agg.readingCount());

    Classification classification;
    try {
      classification = classifier.classify(
          agg.avgPh(), agg.avgTds(), agg.avgTurbidity(), agg.avgTemperature());
    } catch (ArtifactNotLoadedException ex) {
      log.error("Daily prediction for {} failed: {} (aggregate {})", date, ex.getMessage(), agg);
      return JobRun.failed(date, startedAt, clock.instant(), ex.getMessage());
    } catch (RuntimeException ex) {
      log.error("Classifier failed for {} with aggregate {}", date, agg, ex);
      return JobRun.failed(date, startedAt, clock.instant(),
          "Classification failed: " + ex.getMessage());
    }

    DailyPrediction stored;
    try {
      stored = predictions.upsert(agg, classification, clock.instant());
    } catch (DataAccessException ex) {
      log.error("Could not store prediction {} for {} (aggregate {})",
          classification, date, agg, ex);
      return JobRun.failed(date, startedAt, clock.instant(),
          "Prediction write failed: " + ex.getMostSpecificCause().getMessage());
    }

    log.info("Stored prediction for {}: {} (confidence {}) based on {} readings",
        stored.date(), stored.label(),
        stored.confidence() == null ? "n/a" : String.format("%.2f%%", stored.confidence() * 100),
        stored.readingCount());
    return JobRun.completed(date, startedAt, clock.instant(), stored);
  }
}
