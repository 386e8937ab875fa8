package com.ospicorp.regimesync.pipeline;

/** Per-pair result, ordered by increasing severity. */
public enum OutcomeStatus {
  SUCCESS,
  SKIPPED,
  FAILED,
  /** A publication may have left its target without values. */
  INCONSISTENT
}
