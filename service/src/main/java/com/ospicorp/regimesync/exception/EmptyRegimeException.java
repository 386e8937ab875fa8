package com.ospicorp.regimesync.exception;

import com.ospicorp.regimesync.series.model.ReferencePeriod;

public class EmptyRegimeException extends RegimeSyncException {
  private final ReferencePeriod period;

  public EmptyRegimeException(ReferencePeriod period) {
    super("No observations within reference period " + period);
    this.period = period;
  }

  public ReferencePeriod period() {
    return period;
  }
}
