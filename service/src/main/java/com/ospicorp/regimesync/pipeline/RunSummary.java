package com.ospicorp.regimesync.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one pipeline run. {@code failure} is set when the run could not get past location
 * discovery.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunSummary(
    @JsonProperty("run_id") String runId,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("finished_at") Instant finishedAt,
    boolean cancelled,
    String failure,
    Map<OutcomeStatus, Long> counts,
    @JsonProperty("exit_code") int exitCode,
    List<PairOutcome> outcomes
) {
  public static final int EXIT_OK = 0;
  public static final int EXIT_FAILED = 1;
  public static final int EXIT_INCONSISTENT = 2;

  static RunSummary of(RunContext context, Instant finishedAt, String failure,
      List<PairOutcome> outcomes) {
    Map<OutcomeStatus, Long> counts = new EnumMap<>(OutcomeStatus.class);
    for (OutcomeStatus status : OutcomeStatus.values()) {
      counts.put(status, 0L);
    }
    for (PairOutcome outcome : outcomes) {
      counts.merge(outcome.status(), 1L, Long::sum);
    }
    int exitCode;
    if (counts.get(OutcomeStatus.INCONSISTENT) > 0) {
      exitCode = EXIT_INCONSISTENT;
    } else if (failure != null || counts.get(OutcomeStatus.FAILED) > 0) {
      exitCode = EXIT_FAILED;
    } else {
      exitCode = EXIT_OK;
    }
    return new RunSummary(context.runId(), context.startedAt(), finishedAt,
        context.isCancelled(), failure, counts, exitCode, List.copyOf(outcomes));
  }

  public long count(OutcomeStatus status) {
    return counts.getOrDefault(status, 0L);
  }
}
