package com.ospicorp.regimesync.series.model;

/**
 * Aggregate value as delivered by the monitoring API. The timestamp is kept raw so that parse
 * failures can name the offending value; a null value marks a gap.
 */
public record RawObservation(String timestamp, Double value) {}
