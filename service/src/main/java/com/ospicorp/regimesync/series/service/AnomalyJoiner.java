package com.ospicorp.regimesync.series.service;

import com.ospicorp.regimesync.series.model.AnomalyPoint;
import com.ospicorp.regimesync.series.model.AnomalySeries;
import com.ospicorp.regimesync.series.model.DailySeries;
import com.ospicorp.regimesync.series.model.DataPoint;
import com.ospicorp.regimesync.series.model.RegimeRecord;
import com.ospicorp.regimesync.series.model.RegimeStats;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class AnomalyJoiner {
  private AnomalyJoiner() {
  }

  /**
   * Joins every date of the full series with the regime entry of its day number. Dates whose
   * day number has no entry are dropped.
   */
  public static AnomalySeries join(DailySeries series, RegimeRecord regime) {
    List<AnomalyPoint> out = new ArrayList<>(series.size());
    for (DataPoint p : series.points()) {
      Optional<RegimeStats> match = regime.forDayNumber(p.date().getDayOfYear());
      if (match.isEmpty()) {
        continue;
      }
      RegimeStats stats = match.get();
      Double mean = stats.mean();
      if (mean == null) {
        throw new IllegalArgumentException("regime has no mean for day " + stats.dayNumber());
      }
      double value = p.value();
      out.add(new AnomalyPoint(p.date(), value, mean, stats.min(), stats.max(), value - mean));
    }
    return new AnomalySeries(out);
  }
}
