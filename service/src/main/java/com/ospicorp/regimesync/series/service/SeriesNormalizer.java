package com.ospicorp.regimesync.series.service;

import com.ospicorp.regimesync.exception.PayloadParseException;
import com.ospicorp.regimesync.series.model.DailySeries;
import com.ospicorp.regimesync.series.model.DataPoint;
import com.ospicorp.regimesync.series.model.RawObservation;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.DoubleSummaryStatistics;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns raw aggregate records into a timezone-naive daily mean series.
 */
public final class SeriesNormalizer {
  private static final DateTimeFormatter TIMESTAMP = new DateTimeFormatterBuilder()
      .parseCaseInsensitive()
      .append(DateTimeFormatter.ISO_LOCAL_DATE)
      .optionalStart()
      .appendLiteral('T')
      .append(DateTimeFormatter.ISO_LOCAL_TIME)
      .optionalStart()
      .appendOffsetId()
      .optionalEnd()
      .optionalEnd()
      .toFormatter(Locale.ROOT);

  private SeriesNormalizer() {
  }

  /**
   * Same-day observations are reduced to their arithmetic mean. Records without a value are
   * gaps and do not produce an entry.
   *
   * @throws PayloadParseException if a timestamp cannot be parsed
   */
  public static DailySeries normalize(List<RawObservation> in) {
    if (in == null || in.isEmpty()) {
      return DailySeries.empty();
    }
    Map<LocalDate, DoubleSummaryStatistics> days = new TreeMap<>();
    for (RawObservation observation : in) {
      LocalDateTime wallClock = parseTimestamp(observation.timestamp());
      Double value = observation.value();
      if (value == null || value.isNaN()) {
        continue;
      }
      days.computeIfAbsent(wallClock.toLocalDate(), d -> new DoubleSummaryStatistics())
          .accept(value);
    }
    List<DataPoint> out = new ArrayList<>(days.size());
    for (var e : days.entrySet()) {
      out.add(new DataPoint(e.getKey(), e.getValue().getAverage()));
    }
    return DailySeries.of(out);
  }

  /**
   * Parses an ISO-8601 timestamp and drops any offset, keeping the wall-clock reading.
   */
  public static LocalDateTime parseTimestamp(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new PayloadParseException("Missing timestamp", raw);
    }
    try {
      TemporalAccessor parsed = TIMESTAMP.parseBest(raw.trim(),
          OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
      if (parsed instanceof OffsetDateTime offsetDateTime) {
        return offsetDateTime.toLocalDateTime();
      }
      if (parsed instanceof LocalDateTime localDateTime) {
        return localDateTime;
      }
      return ((LocalDate) parsed).atStartOfDay();
    } catch (DateTimeParseException ex) {
      throw new PayloadParseException("Malformed timestamp", raw, ex);
    }
  }
}
