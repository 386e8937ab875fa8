package com.ospicorp.regimesync.series.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class AnomalySeries {
  private final List<AnomalyPoint> points;

  public AnomalySeries(List<AnomalyPoint> points) {
    for (int i = 1; i < points.size(); i++) {
      if (!points.get(i).date().isAfter(points.get(i - 1).date())) {
        throw new IllegalArgumentException("Dates must be strictly ascending at " + points.get(i).date());
      }
    }
    this.points = Collections.unmodifiableList(new ArrayList<>(points));
  }

  public List<AnomalyPoint> points() {
    return points;
  }

  public int size() {
    return points.size();
  }

  public boolean isEmpty() {
    return points.isEmpty();
  }

  /** The selected column in date order, dropping entries without a value. */
  public List<DataPoint> column(SourceColumn column) {
    List<DataPoint> out = new ArrayList<>(points.size());
    for (AnomalyPoint point : points) {
      Double value = point.column(column);
      if (value != null && !value.isNaN()) {
        out.add(new DataPoint(point.date(), value));
      }
    }
    return out;
  }
}
