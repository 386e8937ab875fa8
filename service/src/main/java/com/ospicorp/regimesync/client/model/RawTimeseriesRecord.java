package com.ospicorp.regimesync.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Raw measured series; {@code start} and {@code end} are raw ISO-8601 strings or null. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawTimeseriesRecord(String uuid, String name, String start, String end) {}
