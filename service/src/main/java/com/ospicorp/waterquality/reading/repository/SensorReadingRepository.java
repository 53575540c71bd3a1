package com.ospicorp.waterquality.reading.repository;

import com.ospicorp.waterquality.reading.model.SensorReading;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface SensorReadingRepository extends JpaRepository<SensorReading, Long> {

  Optional<SensorReading> findFirstByOrderByRecordedAtDescIdDesc();

  // Both bounds inclusive.
  @Query("""
      SELECT r FROM SensorReading r
      WHERE r.recordedAt >= :start AND r.recordedAt <= :end
      ORDER BY r.recordedAt, r.id
      """)
  List<SensorReading> findWindow(@Param("start") Instant start, @Param("end") Instant end);
}
