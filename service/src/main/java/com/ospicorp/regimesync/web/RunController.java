package com.ospicorp.regimesync.web;

import com.ospicorp.regimesync.pipeline.RegimePipeline;
import com.ospicorp.regimesync.pipeline.RunSummary;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Map;
import java.util.NoSuchElementException;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Runs")
public class RunController {
  private final RegimePipeline pipeline;

  public RunController(RegimePipeline pipeline) {
    this.pipeline = pipeline;
  }

  @PostMapping("/admin/runs")
  @PreAuthorize("@adminAuthorization.isAllowed(authentication)")
  @Operation(summary = "Run the pipeline",
      description = "Processes every location and raw series synchronously and returns the run summary.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Run summary",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = RunSummary.class))),
      @ApiResponse(responseCode = "409", description = "A run is already in progress",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public RunSummary startRun() {
    return pipeline.run();
  }

  @DeleteMapping("/admin/runs/current")
  @PreAuthorize("@adminAuthorization.isAllowed(authentication)")
  @Operation(summary = "Cancel the active run",
      description = "Requests cancellation; values already published stay in place.")
  @ApiResponses({
      @ApiResponse(responseCode = "202", description = "Cancellation requested"),
      @ApiResponse(responseCode = "404", description = "No active run",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<Map<String, String>> cancelRun() {
    String runId = pipeline.activeRunId()
        .orElseThrow(() -> new NoSuchElementException("No run in progress"));
    pipeline.cancel();
    return ResponseEntity.accepted().body(Map.of("run_id", runId, "status", "cancellation requested"));
  }

  @GetMapping("/v1/runs/latest")
  @Operation(summary = "Get the latest run summary")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Latest run summary",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = RunSummary.class))),
      @ApiResponse(responseCode = "404", description = "No run has finished yet",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public RunSummary latestRun() {
    return pipeline.latest()
        .orElseThrow(() -> new NoSuchElementException("No run has finished yet"));
  }
}
