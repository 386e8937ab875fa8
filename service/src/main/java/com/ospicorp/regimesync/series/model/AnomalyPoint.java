package com.ospicorp.regimesync.series.model;

import java.time.LocalDate;

/**
 * One observation joined with its regime. {@code anomaly} is exactly
 * {@code value - regimeMean}; {@code regimeMin} and {@code regimeMax} are null when those
 * statistics were not computed.
 */
public record AnomalyPoint(
    LocalDate date,
    double value,
    double regimeMean,
    Double regimeMin,
    Double regimeMax,
    double anomaly
) {

  public Double column(SourceColumn column) {
    return switch (column) {
      case VALUE -> value;
      case REGIME_MEAN -> regimeMean;
      case REGIME_MIN -> regimeMin;
      case REGIME_MAX -> regimeMax;
      case ANOMALY -> anomaly;
    };
  }
}
