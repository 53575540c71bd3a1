package com.ospicorp.waterquality.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.ospicorp.waterquality.classifier.ArtifactNotLoadedException;
import com.ospicorp.waterquality.classifier.Classification;
import com.ospicorp.waterquality.classifier.RiskClassifier;
import com.ospicorp.waterquality.prediction.model.DailyAggregate;
import com.ospicorp.waterquality.prediction.model.DailyPrediction;
import com.ospicorp.waterquality.prediction.repository.DailyPredictionDao;
import com.ospicorp.waterquality.reading.model.SensorReading;
import com.ospicorp.waterquality.reading.repository.SensorReadingRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;

class DailyPredictionJobTest {

  private static final LocalDate DAY = LocalDate.of(2024, 1, 1);
  private static final Instant NOW = Instant.parse("2024-01-02T00:00:05Z");

  private SensorReadingRepository readings;
  private RiskClassifier classifier;
  private DailyPredictionDao predictions;
  private DailyPredictionJob job;
  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    readings = mock(SensorReadingRepository.class);
    classifier = mock(RiskClassifier.class);
    predictions = mock(DailyPredictionDao.class);
    job = new DailyPredictionJob(readings, classifier, predictions,
        Clock.fixed(NOW, ZoneOffset.UTC));
    executor = Executors.newSingleThreadExecutor();
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void classifiesDailyMeansAndStoresThePrediction() {
    when(readings.findWindow(any(), any())).thenReturn(threeReadings());
    when(classifier.classify(anyDouble(), anyDouble(), anyDouble(), anyDouble()))
        .thenReturn(new Classification("Safe", 0.91));
    when(predictions.upsert(any(), any(), any())).thenAnswer(inv -> stored(inv.getArgument(0),
        inv.getArgument(1), inv.getArgument(2)));

    JobRun run = job.run(DAY);

    assertThat(run.state()).isEqualTo(JobState.COMPLETED);
    assertThat(run.prediction().label()).isEqualTo("Safe");
    assertThat(run.prediction().confidence()).isEqualTo(0.91);
    assertThat(run.startedAt()).isEqualTo(NOW);
    assertThat(job.lastRun()).contains(run);

    ArgumentCaptor<DailyAggregate> aggregate = ArgumentCaptor.forClass(DailyAggregate.class);
    verify(predictions).upsert(aggregate.capture(), eq(new Classification("Safe", 0.91)), eq(NOW));
    assertThat(aggregate.getValue().avgPh()).isCloseTo(7.2, within(1e-9));
    assertThat(aggregate.getValue().readingCount()).isEqualTo(3);
    verify(readings).findWindow(Instant.parse("2024-01-01T00:00:00Z"),
        Instant.parse("2024-01-01T23:59:59.999999999Z"));
  }

  @Test
  void dayWithoutReadingsIsSkippedWithoutTouchingTheStore() {
    when(readings.findWindow(any(), any())).thenReturn(List.of());

    JobRun run = job.run(LocalDate.of(2024, 1, 2));

    assertThat(run.state()).isEqualTo(JobState.SKIPPED_NO_DATA);
    assertThat(run.prediction()).isNull();
    verifyNoInteractions(classifier, predictions);
  }

  @Test
  void unloadedArtifactFailsTheRunWithoutWriting() {
    when(readings.findWindow(any(), any())).thenReturn(threeReadings());
    when(classifier.classify(anyDouble(), anyDouble(), anyDouble(), anyDouble()))
        .thenThrow(new ArtifactNotLoadedException());

    JobRun run = job.run(DAY);

    assertThat(run.state()).isEqualTo(JobState.FAILED);
    assertThat(run.message()).contains("not loaded");
    verify(predictions, never()).upsert(any(), any(), any());
  }

  @Test
  void unexpectedClassifierErrorFailsTheRun() {
    when(readings.findWindow(any(), any())).thenReturn(threeReadings());
    when(classifier.classify(anyDouble(), anyDouble(), anyDouble(), anyDouble()))
        .thenThrow(new IllegalArgumentException("feature vector rejected"));

    JobRun run = job.run(DAY);

    assertThat(run.state()).isEqualTo(JobState.FAILED);
    assertThat(run.message()).contains("feature vector rejected");
    verify(predictions, never()).upsert(any(), any(), any());
  }

  @Test
  void storageFailureFailsTheRun() {
    when(readings.findWindow(any(), any())).thenReturn(threeReadings());
    when(classifier.classify(anyDouble(), anyDouble(), anyDouble(), anyDouble()))
        .thenReturn(new Classification("Safe", 0.9));
    when(predictions.upsert(any(), any(), any()))
        .thenThrow(new DataIntegrityViolationException("constraint violated"));

    JobRun run = job.run(DAY);

    assertThat(run.state()).isEqualTo(JobState.FAILED);
    assertThat(run.message()).startsWith("Prediction write failed");
    assertThat(job.lastRun()).contains(run);
  }

  @Test
  void readingQueryFailureFailsTheRun() {
    when(readings.findWindow(any(), any())).thenThrow(new QueryTimeoutException("timeout"));

    JobRun run = job.run(DAY);

    assertThat(run.state()).isEqualTo(JobState.FAILED);
    verifyNoInteractions(classifier, predictions);
  }

  @Test
  void secondTriggerForARunningDateIsRejected() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    when(readings.findWindow(any(), any())).thenAnswer(inv -> {
      entered.countDown();
      release.await(5, TimeUnit.SECONDS);
      return List.of();
    });

    Future<JobRun> first = executor.submit(() -> job.run(DAY));
    assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

    assertThat(job.runningDates()).containsExactly(DAY);
    assertThatThrownBy(() -> job.run(DAY))
        .isInstanceOf(ConcurrentRunRejectedException.class)
        .satisfies(ex -> assertThat(((ConcurrentRunRejectedException) ex).date()).isEqualTo(DAY));

    release.countDown();
    assertThat(first.get(5, TimeUnit.SECONDS).state()).isEqualTo(JobState.SKIPPED_NO_DATA);
    assertThat(job.runningDates()).isEmpty();
  }

  @Test
  void differentDatesRunIndependently() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    when(readings.findWindow(eq(Instant.parse("2024-01-01T00:00:00Z")), any())).thenAnswer(inv -> {
      entered.countDown();
      release.await(5, TimeUnit.SECONDS);
      return List.of();
    });
    when(readings.findWindow(eq(Instant.parse("2024-01-02T00:00:00Z")), any())).thenReturn(List.of());

    Future<JobRun> first = executor.submit(() -> job.run(DAY));
    assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

    assertThat(job.run(LocalDate.of(2024, 1, 2)).state()).isEqualTo(JobState.SKIPPED_NO_DATA);

    release.countDown();
    first.get(5, TimeUnit.SECONDS);
  }

  @Test
  void guardIsReleasedAfterAFailedRun() {
    when(readings.findWindow(any(), any())).thenThrow(new QueryTimeoutException("timeout"))
        .thenReturn(List.of());

    assertThat(job.run(DAY).state()).isEqualTo(JobState.FAILED);
    assertThat(job.run(DAY).state()).isEqualTo(JobState.SKIPPED_NO_DATA);
  }

  @Test
  void yesterdayIsComputedInUtc() {
    assertThat(job.yesterday()).isEqualTo(DAY);
  }

  private static List<SensorReading> threeReadings() {
    return List.of(
        new SensorReading(7.0, 300, 2, 20, Instant.parse("2024-01-01T02:00:00Z")),
        new SensorReading(7.2, 310, 2, 20, Instant.parse("2024-01-01T10:00:00Z")),
        new SensorReading(7.4, 320, 2, 20, Instant.parse("2024-01-01T18:00:00Z")));
  }

  private static DailyPrediction stored(DailyAggregate aggregate, Classification classification,
      Instant computedAt) {
    return new DailyPrediction(1L, aggregate.date(), aggregate.avgPh(), aggregate.avgTds(),
        aggregate.avgTurbidity(), aggregate.avgTemperature(), classification.label(),
        classification.confidence(), aggregate.readingCount(), computedAt);
  }
}
