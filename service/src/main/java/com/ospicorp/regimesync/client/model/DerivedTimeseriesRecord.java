package com.ospicorp.regimesync.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DerivedTimeseriesRecord(String uuid, String name, String code) {}
