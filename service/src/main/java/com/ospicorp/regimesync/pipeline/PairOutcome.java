package com.ospicorp.regimesync.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.regimesync.sync.PublishResult;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PairOutcome(
    @JsonProperty("location_id") String locationId,
    @JsonProperty("location_name") String locationName,
    @JsonProperty("timeseries_id") String timeseriesId,
    OutcomeStatus status,
    String reason,
    @JsonProperty("value_count") int valueCount,
    @JsonProperty("anomaly_count") int anomalyCount,
    List<PublishResult> publications
) {

  public PairOutcome {
    publications = publications == null ? List.of() : List.copyOf(publications);
  }

  static PairOutcome skipped(PairKey key, String reason) {
    return new PairOutcome(key.locationId(), key.locationName(), key.timeseriesId(),
        OutcomeStatus.SKIPPED, reason, 0, 0, List.of());
  }

  static PairOutcome failed(PairKey key, String reason) {
    return new PairOutcome(key.locationId(), key.locationName(), key.timeseriesId(),
        OutcomeStatus.FAILED, reason, 0, 0, List.of());
  }

  record PairKey(String locationId, String locationName, String timeseriesId) {}
}
