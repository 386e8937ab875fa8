package com.ospicorp.regimesync.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/** One page of a list endpoint; {@code next} is the absolute URL of the following page. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PageResponse<T>(
    Integer count,
    String next,
    String previous,
    List<T> results
) {}
