package com.ospicorp.waterquality.reading.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/**
 * One observation from the field probe. Rows are append-only: there are no setters and the
 * repository never updates or deletes them.
 */
@Entity
@Table(name = "sensor_readings")
public class SensorReading {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false, updatable = false)
  private double ph;

  @Column(nullable = false, updatable = false)
  private double tds;

  @Column(nullable = false, updatable = false)
  private double turbidity;

  @Column(nullable = false, updatable = false)
  private double temperature;

  @Column(name = "recorded_at", nullable = false, updatable = false)
  private Instant recordedAt;

  protected SensorReading() {
    // JPA default constructor
  }

  public SensorReading(double ph, double tds, double turbidity, double temperature,
      Instant recordedAt) {
    this.ph = ph;
    this.tds = tds;
    this.turbidity = turbidity;
    this.temperature = temperature;
    this.recordedAt = recordedAt;
  }

  public Long getId() {
    return id;
  }

  public double getPh() {
    return ph;
  }

  public double getTds() {
    return tds;
  }

  public double getTurbidity() {
    return turbidity;
  }

  public double getTemperature() {
    return temperature;
  }

  public Instant getRecordedAt() {
    return recordedAt;
  }

  @Override
  public String toString() {
    return "SensorReading{id=" + id + ", recordedAt=" + recordedAt + '}';
  }
}
