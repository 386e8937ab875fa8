package com.ospicorp.regimesync.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.regimesync.pipeline.RegimePipeline;
import com.ospicorp.regimesync.pipeline.RunSummary;
import io.swagger.v3.oas.annotations.Operation;
import java.util.Map;
import java.util.Optional;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RootController {
  private final RegimePipeline pipeline;

  public RootController(RegimePipeline pipeline) {
    this.pipeline = pipeline;
  }

  @GetMapping("/")
  @Operation(summary = "Service state",
      description = "Reports whether a run is active and how the latest finished run ended.")
  public ServiceState root() {
    Optional<String> active = pipeline.activeRunId();
    Optional<RunSummary> latest = pipeline.latest();
    return new ServiceState("regime-sync",
        active.isPresent() ? "running" : "idle",
        active.orElse(null),
        latest.map(RunSummary::runId).orElse(null),
        latest.map(RunSummary::exitCode).orElse(null));
  }

  @GetMapping("/v1/ping")
  public ResponseEntity<Map<String, Object>> ping() {
    return ResponseEntity.ok(Map.of("pong", true));
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ServiceState(
      String service,
      String status,
      @JsonProperty("active_run_id") String activeRunId,
      @JsonProperty("latest_run_id") String latestRunId,
      @JsonProperty("latest_exit_code") Integer latestExitCode
  ) {}
}
