package com.ospicorp.regimesync.series.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** Statistics of one day number; statistics that were not requested are absent. */
public record RegimeStats(int dayNumber, Map<RegimeStatistic, Double> values) {

  public RegimeStats {
    if (dayNumber < 1 || dayNumber > 366) {
      throw new IllegalArgumentException("day number out of range: " + dayNumber);
    }
    Map<RegimeStatistic, Double> copy = new EnumMap<>(RegimeStatistic.class);
    copy.putAll(values);
    values = Collections.unmodifiableMap(copy);
  }

  public Double get(RegimeStatistic statistic) {
    return values.get(statistic);
  }

  public Double mean() {
    return values.get(RegimeStatistic.MEAN);
  }

  public Double min() {
    return values.get(RegimeStatistic.MIN);
  }

  public Double max() {
    return values.get(RegimeStatistic.MAX);
  }
}
