package com.ospicorp.regimesync.series.service;

import com.ospicorp.regimesync.series.model.DailySeries;
import com.ospicorp.regimesync.series.model.DataPoint;
import com.ospicorp.regimesync.series.model.ReferencePeriod;
import com.ospicorp.regimesync.series.model.RegimeRecord;
import com.ospicorp.regimesync.series.model.RegimeStatistic;
import com.ospicorp.regimesync.series.model.RegimeStats;
import java.util.ArrayList;
import java.util.Collection;
import java.util.DoubleSummaryStatistics;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Day-of-year climatology over a reference period. Days are grouped by their ordinal position
 * in the calendar year, so in leap years every day after February 28 carries a number one
 * higher than the same calendar day in other years.
 */
public final class RegimeCalculator {
  private RegimeCalculator() {
  }

  public static RegimeRecord compute(DailySeries series, ReferencePeriod period,
      Collection<RegimeStatistic> statistics) {
    if (statistics == null || statistics.isEmpty()) {
      throw new IllegalArgumentException("at least one statistic must be requested");
    }
    Map<Integer, DoubleSummaryStatistics> groups = new TreeMap<>();
    for (DataPoint p : series.within(period).points()) {
      groups.computeIfAbsent(p.date().getDayOfYear(), d -> new DoubleSummaryStatistics())
          .accept(p.value());
    }
    List<RegimeStats> entries = new ArrayList<>(groups.size());
    for (var e : groups.entrySet()) {
      Map<RegimeStatistic, Double> values = new EnumMap<>(RegimeStatistic.class);
      for (RegimeStatistic statistic : statistics) {
        values.put(statistic, statistic(e.getValue(), statistic));
      }
      entries.add(new RegimeStats(e.getKey(), values));
    }
    return new RegimeRecord(period, entries);
  }

  private static double statistic(DoubleSummaryStatistics group, RegimeStatistic statistic) {
    return switch (statistic) {
      case MEAN -> group.getAverage();
      case MIN -> group.getMin();
      case MAX -> group.getMax();
    };
  }
}
