package com.ospicorp.regimesync.plot;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ospicorp.regimesync.config.RegimeProperties;
import com.ospicorp.regimesync.series.model.DailySeries;
import com.ospicorp.regimesync.series.model.DataPoint;
import com.ospicorp.regimesync.series.model.RegimeRecord;
import com.ospicorp.regimesync.series.model.RegimeStatistic;
import com.ospicorp.regimesync.series.model.RegimeStats;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Writes the inputs of the regime chart (the regime band and the daily traces of the plotted
 * years, aligned on day number) as CSV, one file per location and series.
 */
@Component
public class RegimePlotExporter {
  private static final Logger log = LoggerFactory.getLogger(RegimePlotExporter.class);
  private static final DateTimeFormatter DAY_DIRECTORY = DateTimeFormatter.BASIC_ISO_DATE;
  static final String DAY_NUMBER = "daynumber";

  private final CsvMapper mapper = new CsvMapper();
  private final Path baseDirectory;
  private final List<Integer> years;
  private final List<RegimeStatistic> statistics;
  private final Clock clock;

  @Autowired
  public RegimePlotExporter(RegimeProperties properties, Clock clock) {
    this(Path.of(properties.plot().directory()), properties.plot().years(),
        properties.statistics(), clock);
  }

  RegimePlotExporter(Path baseDirectory, List<Integer> years, List<RegimeStatistic> statistics,
      Clock clock) {
    this.baseDirectory = baseDirectory;
    this.years = years.stream().distinct().toList();
    this.statistics = List.copyOf(new TreeSet<>(statistics));
    this.clock = clock;
  }

  public Path export(String locationName, String timeseriesId, DailySeries series,
      RegimeRecord regime) {
    LocalDate today = LocalDate.now(clock);
    List<Integer> plotYears = years.isEmpty()
        ? List.of(today.getYear() - 1, today.getYear())
        : years;
    Path directory = baseDirectory.resolve(DAY_DIRECTORY.format(today));
    Path file = directory.resolve("regime_" + sanitize(locationName) + "_"
        + sanitize(timeseriesId) + ".csv");

    CsvSchema.Builder schema = CsvSchema.builder().addColumn(DAY_NUMBER);
    statistics.forEach(s -> schema.addColumn(s.columnName()));
    plotYears.forEach(y -> schema.addColumn(String.valueOf(y)));

    try {
      Files.createDirectories(directory);
      try (SequenceWriter writer = mapper.writer(schema.setUseHeader(true).build())
          .writeValues(file.toFile())) {
        for (Map<String, Object> row : rows(series, regime, plotYears)) {
          writer.write(row);
        }
      }
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to write chart data " + file, ex);
    }
    log.info("Plot data \"{}\"", file);
    return file;
  }

  private List<Map<String, Object>> rows(DailySeries series, RegimeRecord regime,
      List<Integer> plotYears) {
    Map<Integer, Map<Integer, Double>> traces = new TreeMap<>();
    SortedSet<Integer> dayNumbers = new TreeSet<>();
    for (RegimeStats stats : regime.entries()) {
      dayNumbers.add(stats.dayNumber());
    }
    for (Integer year : plotYears) {
      Map<Integer, Double> trace = new TreeMap<>();
      for (DataPoint p : series.inYear(year)) {
        trace.put(p.date().getDayOfYear(), p.value());
        dayNumbers.add(p.date().getDayOfYear());
      }
      traces.put(year, trace);
    }

    List<Map<String, Object>> rows = new ArrayList<>(dayNumbers.size());
    for (Integer dayNumber : dayNumbers) {
      Map<String, Object> row = new LinkedHashMap<>();
      row.put(DAY_NUMBER, dayNumber);
      RegimeStats stats = regime.forDayNumber(dayNumber).orElse(null);
      for (RegimeStatistic statistic : statistics) {
        row.put(statistic.columnName(), stats == null ? null : stats.get(statistic));
      }
      for (Integer year : plotYears) {
        row.put(String.valueOf(year), traces.get(year).get(dayNumber));
      }
      rows.add(row);
    }
    return rows;
  }

  private static String sanitize(String value) {
    return value == null ? "unnamed" : value.replaceAll("[^A-Za-z0-9._-]", "_");
  }
}
