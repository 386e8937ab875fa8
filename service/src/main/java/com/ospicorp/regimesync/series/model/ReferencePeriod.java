package com.ospicorp.regimesync.series.model;

import java.time.LocalDate;
import java.util.Objects;

/** Window over which the regime is computed, both bounds inclusive. */
public record ReferencePeriod(LocalDate start, LocalDate end) {

  public ReferencePeriod {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (start.isAfter(end)) {
      throw new IllegalArgumentException("start must be before or equal to end");
    }
  }

  public boolean contains(LocalDate date) {
    return !date.isBefore(start) && !date.isAfter(end);
  }

  @Override
  public String toString() {
    return start + "/" + end;
  }
}
