package com.ospicorp.waterquality.it;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;

class SchemaMigrationIT extends PostgresIntegrationSupport {

  private static final String INSERT_PREDICTION = """
      INSERT INTO daily_predictions (prediction_date, avg_ph, avg_tds, avg_turbidity,
                                     avg_temperature, label, confidence, reading_count, computed_at)
      VALUES (?, 7, 300, 2, 20, 'Safe', ?, ?, ?)
      """;

  @Autowired
  private JdbcTemplate jdbcTemplate;

  @BeforeEach
  void setUp() {
    jdbcTemplate.update("DELETE FROM daily_predictions");
    jdbcTemplate.update("DELETE FROM sensor_readings");
  }

  @Test
  void flywayCreatesBothTables() {
    List<String> tables = jdbcTemplate.queryForList(
        """
        SELECT table_name FROM information_schema.tables
        WHERE table_schema = 'public'
          AND table_name IN ('sensor_readings', 'daily_predictions')
        ORDER BY table_name
        """,
        String.class);

    assertThat(tables).containsExactly("daily_predictions", "sensor_readings");
  }

  @Test
  void recordedAtIndexExists() {
    String index = jdbcTemplate.queryForObject(
        "SELECT to_regclass('public.sensor_readings_recorded_at_idx')", String.class);

    assertThat(index).isEqualTo("sensor_readings_recorded_at_idx");
  }

  @Test
  void secondRowForTheSameDateViolatesTheUniqueConstraint() {
    insertPrediction(LocalDate.of(2024, 1, 1), 0.5, 1);

    assertThatThrownBy(() -> insertPrediction(LocalDate.of(2024, 1, 1), 0.6, 2))
        .isInstanceOf(DataIntegrityViolationException.class)
        .hasMessageContaining("daily_predictions_date_uk");
  }

  @Test
  void confidenceOutsideTheUnitIntervalIsRejected() {
    assertThatThrownBy(() -> insertPrediction(LocalDate.of(2024, 1, 1), 1.5, 1))
        .isInstanceOf(DataIntegrityViolationException.class)
        .hasMessageContaining("daily_predictions_confidence_ck");
  }

  @Test
  void predictionNeedsAtLeastOneReading() {
    assertThatThrownBy(() -> insertPrediction(LocalDate.of(2024, 1, 1), 0.5, 0))
        .isInstanceOf(DataIntegrityViolationException.class)
        .hasMessageContaining("daily_predictions_count_ck");
  }

  @Test
  void nullConfidenceIsAllowed() {
    insertPrediction(LocalDate.of(2024, 1, 1), null, 1);

    assertThat(jdbcTemplate.queryForObject(
        "SELECT COUNT(*) FROM daily_predictions WHERE confidence IS NULL", Integer.class))
        .isEqualTo(1);
  }

  private void insertPrediction(LocalDate date, Double confidence, int count) {
    jdbcTemplate.update(INSERT_PREDICTION, Date.valueOf(date), confidence, count,
        Timestamp.from(Instant.parse("2024-01-02T00:00:00Z")));
  }
}
