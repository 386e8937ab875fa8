package com.ospicorp.regimesync.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LocationRecord(String uuid, String name, String code) {}
