package com.ospicorp.regimesync.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.regimesync.series.model.RawObservation;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AggregateRecord(
    @JsonProperty("first_timestamp") String firstTimestamp,
    Double avg
) {

  public RawObservation toObservation() {
    return new RawObservation(firstTimestamp, avg);
  }
}
