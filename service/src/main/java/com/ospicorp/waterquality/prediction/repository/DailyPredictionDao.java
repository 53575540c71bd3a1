package com.ospicorp.waterquality.prediction.repository;

import com.ospicorp.waterquality.classifier.Classification;
import com.ospicorp.waterquality.prediction.model.DailyAggregate;
import com.ospicorp.waterquality.prediction.model.DailyPrediction;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.SqlParameterValue;
import org.springframework.stereotype.Repository;

@Repository
public class DailyPredictionDao {
  private static final String COLUMNS = """
      id, prediction_date, avg_ph, avg_tds, avg_turbidity, avg_temperature,
      label, confidence, reading_count, computed_at
      """;

  private static final RowMapper<DailyPrediction> ROW_MAPPER = DailyPredictionDao::mapRow;

  private final JdbcTemplate jdbc;

  public DailyPredictionDao(JdbcTemplate jdbc) { this.jdbc = jdbc; }

  /**
   * Inserts the prediction for {@code aggregate.date()} or overwrites the existing row in place.
   * One statement against the unique date constraint, so concurrent callers converge on a single
   * row (last commit wins) and a failed call leaves the previous row untouched.
   */
  public DailyPrediction upsert(DailyAggregate aggregate, Classification classification,
      Instant computedAt) {
    String sql = """
      INSERT INTO daily_predictions (prediction_date, avg_ph, avg_tds, avg_turbidity,
                                     avg_temperature, label, confidence, reading_count, computed_at)
      VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
      ON CONFLICT ON CONSTRAINT daily_predictions_date_uk DO UPDATE SET
        avg_ph = EXCLUDED.avg_ph,
        avg_tds = EXCLUDED.avg_tds,
        avg_turbidity = EXCLUDED.avg_turbidity,
        avg_temperature = EXCLUDED.avg_temperature,
        label = EXCLUDED.label,
        confidence = EXCLUDED.confidence,
        reading_count = EXCLUDED.reading_count,
        computed_at = EXCLUDED.computed_at
      RETURNING
    """ + COLUMNS;
    return jdbc.queryForObject(sql, ROW_MAPPER,
        Date.valueOf(aggregate.date()),
        aggregate.avgPh(),
        aggregate.avgTds(),
        aggregate.avgTurbidity(),
        aggregate.avgTemperature(),
        classification.label(),
        new SqlParameterValue(Types.DOUBLE, classification.confidence()),
        aggregate.readingCount(),
        Timestamp.from(computedAt));
  }

  public Optional<DailyPrediction> findLatest() {
    String sql = "SELECT " + COLUMNS + " FROM daily_predictions ORDER BY prediction_date DESC LIMIT 1";
    return jdbc.query(sql, ROW_MAPPER).stream().findFirst();
  }

  public Optional<DailyPrediction> findByDate(LocalDate date) {
    String sql = "SELECT " + COLUMNS + " FROM daily_predictions WHERE prediction_date = ?";
    return jdbc.query(sql, ROW_MAPPER, Date.valueOf(date)).stream().findFirst();
  }

  public List<DailyPrediction> findRange(LocalDate start, LocalDate end) {
    String sql = "SELECT " + COLUMNS + """
       FROM daily_predictions
      WHERE prediction_date BETWEEN ? AND ?
      ORDER BY prediction_date
    """;
    return jdbc.query(sql, ROW_MAPPER, Date.valueOf(start), Date.valueOf(end));
  }

  public long count() {
    Long count = jdbc.queryForObject("SELECT COUNT(*) FROM daily_predictions", Long.class);
    return count == null ? 0L : count;
  }

  private static DailyPrediction mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new DailyPrediction(
        rs.getLong("id"),
        rs.getDate("prediction_date").toLocalDate(),
        rs.getDouble("avg_ph"),
        rs.getDouble("avg_tds"),
        rs.getDouble("avg_turbidity"),
        rs.getDouble("avg_temperature"),
        rs.getString("label"),
        (Double) rs.getObject("confidence"),
        rs.getInt("reading_count"),
        rs.getTimestamp("computed_at").toInstant());
  }
}
