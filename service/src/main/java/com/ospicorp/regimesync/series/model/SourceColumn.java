package com.ospicorp.regimesync.series.model;

/** Column of an {@link AnomalySeries} that can be published. */
public enum SourceColumn {
  VALUE,
  REGIME_MEAN,
  REGIME_MIN,
  REGIME_MAX,
  ANOMALY
}
