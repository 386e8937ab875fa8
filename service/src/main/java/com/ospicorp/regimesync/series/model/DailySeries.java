package com.ospicorp.regimesync.series.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Daily values sorted ascending by date, at most one value per date. Missing dates are simply
 * absent.
 */
public final class DailySeries {
  private static final DailySeries EMPTY = new DailySeries(List.of());

  private final List<DataPoint> points;

  private DailySeries(List<DataPoint> points) {
    this.points = points;
  }

  public static DailySeries empty() {
    return EMPTY;
  }

  public static DailySeries of(List<DataPoint> points) {
    List<DataPoint> copy = new ArrayList<>(points.size());
    LocalDate previous = null;
    for (DataPoint point : points) {
      Objects.requireNonNull(point.date(), "date");
      Objects.requireNonNull(point.value(), "value");
      if (previous != null && !point.date().isAfter(previous)) {
        throw new IllegalArgumentException(
            "Dates must be strictly ascending, got " + point.date() + " after " + previous);
      }
      previous = point.date();
      copy.add(point);
    }
    return copy.isEmpty() ? EMPTY : new DailySeries(Collections.unmodifiableList(copy));
  }

  public List<DataPoint> points() {
    return points;
  }

  public int size() {
    return points.size();
  }

  public boolean isEmpty() {
    return points.isEmpty();
  }

  public LocalDate firstDate() {
    return points.isEmpty() ? null : points.get(0).date();
  }

  public LocalDate lastDate() {
    return points.isEmpty() ? null : points.get(points.size() - 1).date();
  }

  /** Points whose date lies within the period, bounds inclusive. */
  public DailySeries within(ReferencePeriod period) {
    List<DataPoint> kept = new ArrayList<>();
    for (DataPoint point : points) {
      if (period.contains(point.date())) {
        kept.add(point);
      }
    }
    return kept.size() == points.size() ? this : of(kept);
  }

  public List<DataPoint> inYear(int year) {
    return points.stream().filter(p -> p.date().getYear() == year).toList();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof DailySeries other && points.equals(other.points);
  }

  @Override
  public int hashCode() {
    return points.hashCode();
  }

  @Override
  public String toString() {
    return "DailySeries[" + firstDate() + ".." + lastDate() + ", " + points.size() + " values]";
  }
}
