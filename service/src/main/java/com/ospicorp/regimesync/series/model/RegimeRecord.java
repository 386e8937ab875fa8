package com.ospicorp.regimesync.series.model;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Climatological regime keyed by day number (1-366). Immutable once built.
 */
public final class RegimeRecord {
  private final ReferencePeriod period;
  private final Map<Integer, RegimeStats> byDayNumber;

  public RegimeRecord(ReferencePeriod period, Collection<RegimeStats> stats) {
    this.period = period;
    Map<Integer, RegimeStats> sorted = new TreeMap<>();
    for (RegimeStats entry : stats) {
      if (sorted.put(entry.dayNumber(), entry) != null) {
        throw new IllegalArgumentException("duplicate day number " + entry.dayNumber());
      }
    }
    this.byDayNumber = Collections.unmodifiableMap(sorted);
  }

  public ReferencePeriod period() {
    return period;
  }

  public Optional<RegimeStats> forDayNumber(int dayNumber) {
    return Optional.ofNullable(byDayNumber.get(dayNumber));
  }

  /** Entries in ascending day-number order. */
  public Collection<RegimeStats> entries() {
    return byDayNumber.values();
  }

  public int size() {
    return byDayNumber.size();
  }

  public boolean isEmpty() {
    return byDayNumber.isEmpty();
  }
}
