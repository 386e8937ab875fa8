package com.ospicorp.regimesync.pipeline;

import com.ospicorp.regimesync.client.MonitoringApi;
import com.ospicorp.regimesync.client.model.LocationRecord;
import com.ospicorp.regimesync.client.model.RawTimeseriesRecord;
import com.ospicorp.regimesync.config.RegimeProperties;
import com.ospicorp.regimesync.exception.EmptyRegimeException;
import com.ospicorp.regimesync.exception.PublishConsistencyException;
import com.ospicorp.regimesync.exception.RegimeSyncException;
import com.ospicorp.regimesync.exception.RunInProgressException;
import com.ospicorp.regimesync.pipeline.PairOutcome.PairKey;
import com.ospicorp.regimesync.plot.RegimePlotExporter;
import com.ospicorp.regimesync.series.model.AnomalySeries;
import com.ospicorp.regimesync.series.model.DailySeries;
import com.ospicorp.regimesync.series.model.RawObservation;
import com.ospicorp.regimesync.series.model.ReferencePeriod;
import com.ospicorp.regimesync.series.model.RegimeRecord;
import com.ospicorp.regimesync.series.service.AnomalyJoiner;
import com.ospicorp.regimesync.series.service.RegimeCalculator;
import com.ospicorp.regimesync.series.service.SeriesNormalizer;
import com.ospicorp.regimesync.sync.PublishResult;
import com.ospicorp.regimesync.sync.PublishResult.PublishStatus;
import com.ospicorp.regimesync.sync.PublishTarget;
import com.ospicorp.regimesync.sync.SyncPublisher;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Drives discovery, fetch, normalisation, regime, anomaly, plot and publication for every
 * (location, raw timeseries) pair. Pairs are processed independently on a bounded pool; a
 * failing pair is recorded and never stops the others.
 */
@Service
public class RegimePipeline {
  private static final Logger log = LoggerFactory.getLogger(RegimePipeline.class);

  private final MonitoringApi api;
  private final SyncPublisher publisher;
  private final RegimePlotExporter plotExporter;
  private final RegimeProperties properties;
  private final AsyncTaskExecutor executor;
  private final Clock clock;

  private final AtomicReference<RunContext> active = new AtomicReference<>();
  private volatile RunSummary latest;

  public RegimePipeline(MonitoringApi api, SyncPublisher publisher,
      RegimePlotExporter plotExporter, RegimeProperties properties,
      AsyncTaskExecutor regimeExecutor, Clock clock) {
    this.api = api;
    this.publisher = publisher;
    this.plotExporter = plotExporter;
    this.properties = properties;
    this.executor = regimeExecutor;
    this.clock = clock;
  }

  /**
   * Runs the pipeline to completion on the calling thread, fanning pairs out to the pool.
   *
   * @throws RunInProgressException if another run is active
   */
  public RunSummary run() {
    RunContext context = RunContext.start(clock.instant());
    if (!active.compareAndSet(null, context)) {
      RunContext current = active.get();
      throw new RunInProgressException(current == null ? null : current.runId());
    }
    try (LogContext ignored = LogContext.forRun(context.runId())) {
      RunSummary summary = execute(context);
      latest = summary;
      logSummary(summary);
      return summary;
    } finally {
      active.set(null);
    }
  }

  /**
   * Requests cancellation of the active run. Tasks stop before their next request and queued
   * ones finish as skipped; values already published stay in place.
   *
   * @return false if no run is active
   */
  public boolean cancel() {
    RunContext context = active.get();
    if (context == null) {
      return false;
    }
    if (context.cancel()) {
      log.warn("Cancellation requested for run {}", context.runId());
    }
    return true;
  }

  public Optional<RunSummary> latest() {
    return Optional.ofNullable(latest);
  }

  public Optional<String> activeRunId() {
    return Optional.ofNullable(active.get()).map(RunContext::runId);
  }

  private RunSummary execute(RunContext context) {
    ReferencePeriod period = properties.reference();
    log.info("Run {} started; reference period {}", context.runId(), period);

    List<LocationRecord> locations;
    try {
      context.checkNotCancelled();
      locations = api.listLocations(properties.organisationId(),
          properties.locationCountLimit());
    } catch (CancellationException ex) {
      return RunSummary.of(context, clock.instant(), null, List.of());
    } catch (RegimeSyncException ex) {
      log.error("Get locations failed: {}", ex.getMessage(), ex);
      return RunSummary.of(context, clock.instant(), ex.getMessage(), List.of());
    }
    log.info("Locations: {} results", locations.size());

    List<Future<Discovery>> discoveries = new ArrayList<>(locations.size());
    for (LocationRecord location : locations) {
      discoveries.add(executor.submit(() -> discover(context, location)));
    }

    List<PairOutcome> outcomes = new ArrayList<>();
    List<Future<PairOutcome>> pairs = new ArrayList<>();
    for (int i = 0; i < discoveries.size(); i++) {
      LocationRecord location = locations.get(i);
      Discovery discovery = await(discoveries.get(i));
      if (discovery.failure() != null) {
        outcomes.add(discovery.failure());
        continue;
      }
      for (RawTimeseriesRecord timeseries : discovery.timeseries()) {
        pairs.add(executor.submit(() -> processPair(context, location, timeseries, period)));
      }
    }

    for (Future<PairOutcome> pair : pairs) {
      outcomes.add(await(pair));
    }
    return RunSummary.of(context, clock.instant(), null, outcomes);
  }

  private Discovery discover(RunContext context, LocationRecord location) {
    PairKey key = new PairKey(location.uuid(), location.name(), null);
    try (LogContext ignored = LogContext.forLocation(context.runId(), location.name())) {
      log.info("Location \"{}\"", location.name());
      context.checkNotCancelled();
      List<RawTimeseriesRecord> timeseries =
          api.listRawTimeseries(location.uuid(), properties.seriesName());
      log.info("Timeseries: {} results", timeseries.size());
      return new Discovery(timeseries, null);
    } catch (CancellationException ex) {
      return new Discovery(List.of(), PairOutcome.skipped(key, "cancelled"));
    } catch (RegimeSyncException ex) {
      log.warn("Get timeseries for location \"{}\" ({}) failed: {}",
          location.name(), location.uuid(), ex.getMessage());
      return new Discovery(List.of(), PairOutcome.failed(key, ex.getMessage()));
    }
  }

  /** Reason to skip a raw series that has no values in the current year, or null. */
  private String staleReason(RawTimeseriesRecord timeseries, LocalDate today) {
    if (!properties.skipStaleSeries()) {
      return null;
    }
    if (timeseries.end() == null) {
      return "no end value";
    }
    if (SeriesNormalizer.parseTimestamp(timeseries.end()).getYear() < today.getYear()) {
      return "no values in this year";
    }
    return null;
  }

  PairOutcome processPair(RunContext context, LocationRecord location,
      RawTimeseriesRecord timeseries, ReferencePeriod period) {
    PairKey key = new PairKey(location.uuid(), location.name(), timeseries.uuid());
    try (LogContext ignored =
        LogContext.forPair(context.runId(), location.name(), timeseries.uuid())) {
      context.checkNotCancelled();
      String staleReason = staleReason(timeseries, LocalDate.now(clock));
      if (staleReason != null) {
        log.warn("Skipping timeseries \"{}\": {}", timeseries.uuid(), staleReason);
        return PairOutcome.skipped(key, staleReason);
      }

      Instant start = period.start().atStartOfDay(ZoneOffset.UTC).toInstant();
      List<RawObservation> raw = api.fetchDailyAggregates(timeseries.uuid(), start,
          clock.instant());
      DailySeries series = SeriesNormalizer.normalize(raw);
      if (series.isEmpty()) {
        log.warn("Series is empty");
      } else {
        log.info("Series start: {}", series.firstDate());
        log.info("Series end: {}", series.lastDate());
        log.info("Series length: {} values", series.size());
      }

      RegimeRecord regime = RegimeCalculator.compute(series, period, properties.statistics());
      if (regime.isEmpty()) {
        throw new EmptyRegimeException(period);
      }
      AnomalySeries anomalies = AnomalyJoiner.join(series, regime);

      if (properties.plot().enabled()) {
        plotExporter.export(location.name(), timeseries.uuid(), series, regime);
      }

      List<PublishResult> publications = properties.publish().enabled()
          ? publishAll(context, location, anomalies)
          : List.of();
      return new PairOutcome(key.locationId(), key.locationName(), key.timeseriesId(),
          worst(publications), reasonOf(publications), series.size(), anomalies.size(),
          publications);
    } catch (EmptyRegimeException ex) {
      log.warn("Skipping timeseries \"{}\" at \"{}\": {}", timeseries.uuid(), location.name(),
          ex.getMessage());
      return PairOutcome.skipped(key, "empty regime: " + ex.getMessage());
    } catch (CancellationException ex) {
      return PairOutcome.skipped(key, "cancelled");
    } catch (RegimeSyncException ex) {
      log.warn("Timeseries \"{}\" at \"{}\" ({}) failed: {}", timeseries.uuid(),
          location.name(), location.uuid(), ex.getMessage());
      return PairOutcome.failed(key, ex.getMessage());
    } catch (RuntimeException ex) {
      log.error("Timeseries \"{}\" at \"{}\" ({}) failed unexpectedly", timeseries.uuid(),
          location.name(), location.uuid(), ex);
      return PairOutcome.failed(key, ex.toString());
    }
  }

  private List<PublishResult> publishAll(RunContext context, LocationRecord location,
      AnomalySeries anomalies) {
    List<PublishResult> results = new ArrayList<>();
    for (RegimeProperties.Target configured : properties.publish().targets()) {
      PublishTarget target = configured.toPublishTarget();
      if (context.isCancelled()) {
        results.add(PublishResult.skipped(target.label(), "cancelled"));
        continue;
      }
      log.info("Regime series \"{}\"", target.label());
      try {
        results.add(publisher.publish(location, anomalies, target));
      } catch (PublishConsistencyException ex) {
        log.error("INCONSISTENT publication of \"{}\" at location \"{}\" ({}), resource {}: {}",
            target.label(), location.name(), location.uuid(), ex.resourceId(), ex.getMessage(),
            ex);
        results.add(PublishResult.inconsistent(target.label(), ex.resourceId(),
            ex.getMessage() + ": " + ex.getCause().getMessage()));
      } catch (RegimeSyncException ex) {
        log.warn("Publication of \"{}\" at location \"{}\" ({}) failed: {}", target.label(),
            location.name(), location.uuid(), ex.getMessage());
        results.add(PublishResult.failed(target.label(), null, ex.getMessage()));
      }
    }
    return results;
  }

  private static OutcomeStatus worst(List<PublishResult> publications) {
    OutcomeStatus status = OutcomeStatus.SUCCESS;
    for (PublishResult result : publications) {
      if (result.status() == PublishStatus.INCONSISTENT) {
        return OutcomeStatus.INCONSISTENT;
      }
      if (result.status() == PublishStatus.FAILED) {
        status = OutcomeStatus.FAILED;
      } else if (result.status() == PublishStatus.SKIPPED && status == OutcomeStatus.SUCCESS) {
        status = OutcomeStatus.SKIPPED;
      }
    }
    return status;
  }

  private static String reasonOf(List<PublishResult> publications) {
    List<String> failures = publications.stream()
        .filter(p -> p.status() == PublishStatus.FAILED || p.status() == PublishStatus.INCONSISTENT)
        .map(p -> p.label() + ": " + p.message())
        .toList();
    if (!failures.isEmpty()) {
      return String.join("; ", failures);
    }
    // a target left unpublished means the column is not fully synced
    List<String> skipped = publications.stream()
        .filter(p -> p.status() == PublishStatus.SKIPPED)
        .map(PublishResult::label)
        .toList();
    return skipped.isEmpty() ? null : "cancelled: " + String.join(", ", skipped);
  }

  private <T> T await(Future<T> future) {
    try {
      return future.get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      cancel();
      throw new IllegalStateException("Interrupted while waiting for pipeline task", ex);
    } catch (ExecutionException ex) {
      // tasks record their own failures, so only errors end up here
      throw new IllegalStateException("Pipeline task failed", ex.getCause());
    }
  }

  private void logSummary(RunSummary summary) {
    String message = "Run {} finished: {} succeeded, {} skipped, {} failed, {} inconsistent";
    Object[] args = {summary.runId(), summary.count(OutcomeStatus.SUCCESS),
        summary.count(OutcomeStatus.SKIPPED), summary.count(OutcomeStatus.FAILED),
        summary.count(OutcomeStatus.INCONSISTENT)};
    if (summary.exitCode() == RunSummary.EXIT_OK) {
      log.info(message, args);
    } else {
      log.error(message, args);
    }
  }

  private record Discovery(List<RawTimeseriesRecord> timeseries, PairOutcome failure) {}

}
