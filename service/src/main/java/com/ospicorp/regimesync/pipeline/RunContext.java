package com.ospicorp.regimesync.pipeline;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/** State shared by the tasks of one run. */
final class RunContext {
  private final String runId;
  private final Instant startedAt;
  private final AtomicBoolean cancelled = new AtomicBoolean();

  RunContext(String runId, Instant startedAt) {
    this.runId = runId;
    this.startedAt = startedAt;
  }

  static RunContext start(Instant now) {
    return new RunContext(UUID.randomUUID().toString().substring(0, 8), now);
  }

  String runId() {
    return runId;
  }

  Instant startedAt() {
    return startedAt;
  }

  boolean isCancelled() {
    return cancelled.get();
  }

  boolean cancel() {
    return cancelled.compareAndSet(false, true);
  }

  /** Called before every request so a cancelled run stops issuing new ones. */
  void checkNotCancelled() {
    if (cancelled.get() || Thread.currentThread().isInterrupted()) {
      throw new CancellationException("run " + runId + " cancelled");
    }
  }
}
