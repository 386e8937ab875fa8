package com.ospicorp.regimesync.series.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.regimesync.exception.PayloadParseException;
import com.ospicorp.regimesync.series.model.DailySeries;
import com.ospicorp.regimesync.series.model.DataPoint;
import com.ospicorp.regimesync.series.model.RawObservation;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class SeriesNormalizerTest {

  @Test
  void sameDayObservationsAreAveraged() {
    var out = SeriesNormalizer.normalize(List.of(
        new RawObservation("2020-03-01T00:00:00Z", 1.0),
        new RawObservation("2020-03-01T12:00:00Z", 2.0),
        new RawObservation("2020-03-01T23:59:59Z", 6.0)));

    assertEquals(1, out.size());
    assertEquals(new DataPoint(LocalDate.of(2020, 3, 1), 3.0), out.points().get(0));
  }

  @Test
  void disjointDaysAreKeptInDateOrder() {
    var out = SeriesNormalizer.normalize(List.of(
        new RawObservation("2020-03-03T00:00:00Z", 3.0),
        new RawObservation("2020-03-01T00:00:00Z", 1.0),
        new RawObservation("2020-03-02T00:00:00Z", 2.0)));

    assertEquals(List.of(
        new DataPoint(LocalDate.of(2020, 3, 1), 1.0),
        new DataPoint(LocalDate.of(2020, 3, 2), 2.0),
        new DataPoint(LocalDate.of(2020, 3, 3), 3.0)), out.points());
  }

  @Test
  void offsetIsDroppedKeepingWallClockDate() {
    var out = SeriesNormalizer.normalize(List.of(
        new RawObservation("2020-06-30T23:30:00-02:00", 4.0)));

    assertEquals(LocalDate.of(2020, 6, 30), out.firstDate());
  }

  @Test
  void missingValuesAreGaps() {
    var out = SeriesNormalizer.normalize(List.of(
        new RawObservation("2020-01-01T00:00:00Z", null),
        new RawObservation("2020-01-02T00:00:00Z", Double.NaN),
        new RawObservation("2020-01-03T00:00:00Z", 5.0)));

    assertEquals(1, out.size());
    assertEquals(LocalDate.of(2020, 1, 3), out.firstDate());
  }

  @Test
  void emptyInputGivesEmptySeries() {
    assertSame(DailySeries.empty(), SeriesNormalizer.normalize(List.of()));
    assertTrue(SeriesNormalizer.normalize(null).isEmpty());
  }

  @Test
  void malformedTimestampNamesRawValue() {
    var ex = assertThrows(PayloadParseException.class, () -> SeriesNormalizer.normalize(List.of(
        new RawObservation("01/02/2020", 1.0))));

    assertEquals("01/02/2020", ex.rawValue());
    assertTrue(ex.getMessage().contains("01/02/2020"));
  }

  @Test
  void parsesDateOnlyAndLocalTimestamps() {
    assertEquals(LocalDateTime.of(2021, 5, 4, 0, 0), SeriesNormalizer.parseTimestamp("2021-05-04"));
    assertEquals(LocalDateTime.of(2021, 5, 4, 13, 15, 2),
        SeriesNormalizer.parseTimestamp("2021-05-04T13:15:02"));
    assertEquals(LocalDateTime.of(2021, 5, 4, 13, 15, 2),
        SeriesNormalizer.parseTimestamp("2021-05-04T13:15:02.123Z").withNano(0));
  }
}
