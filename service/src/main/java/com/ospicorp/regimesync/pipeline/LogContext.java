package com.ospicorp.regimesync.pipeline;

import org.slf4j.MDC;

/**
 * MDC tags for a run or a pair, removed again on close so pooled threads never carry tags of
 * a previous task.
 */
final class LogContext implements AutoCloseable {
  static final String RUN_ID = "runId";
  static final String LOCATION = "location";
  static final String TIMESERIES = "timeseries";

  private final String[] keys;

  private LogContext(String... keys) {
    this.keys = keys;
  }

  static LogContext forRun(String runId) {
    MDC.put(RUN_ID, runId);
    return new LogContext(RUN_ID);
  }

  static LogContext forLocation(String runId, String location) {
    MDC.put(RUN_ID, runId);
    MDC.put(LOCATION, location);
    return new LogContext(RUN_ID, LOCATION);
  }

  static LogContext forPair(String runId, String location, String timeseries) {
    MDC.put(RUN_ID, runId);
    MDC.put(LOCATION, location);
    MDC.put(TIMESERIES, timeseries);
    return new LogContext(RUN_ID, LOCATION, TIMESERIES);
  }

  @Override
  public void close() {
    for (String key : keys) {
      MDC.remove(key);
    }
  }
}
