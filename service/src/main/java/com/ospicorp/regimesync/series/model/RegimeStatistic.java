package com.ospicorp.regimesync.series.model;

import java.util.Locale;

public enum RegimeStatistic {
  MEAN,
  MIN,
  MAX;

  /** Column name used in chart data and publish target configuration, e.g. {@code regime_mean}. */
  public String columnName() {
    return "regime_" + name().toLowerCase(Locale.ROOT);
  }
}
