package com.ospicorp.regimesync.client.model;

/** One recorded value; {@code time} is an ISO-8601 UTC string such as 2020-01-01T00:00:00Z. */
public record EventRecord(String time, double value) {}
