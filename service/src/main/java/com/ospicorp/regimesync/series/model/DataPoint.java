package com.ospicorp.regimesync.series.model;

import java.time.LocalDate;

// Value object for one daily value (timezone-naive calendar date)
public record DataPoint(LocalDate date, Double value) {}
