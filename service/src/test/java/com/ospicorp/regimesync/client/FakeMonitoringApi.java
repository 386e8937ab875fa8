package com.ospicorp.regimesync.client;

import com.ospicorp.regimesync.client.model.DerivedTimeseriesRecord;
import com.ospicorp.regimesync.client.model.EventRecord;
import com.ospicorp.regimesync.client.model.LocationRecord;
import com.ospicorp.regimesync.client.model.NewTimeseriesRequest;
import com.ospicorp.regimesync.client.model.RawTimeseriesRecord;
import com.ospicorp.regimesync.series.model.RawObservation;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory monitoring store. Submitted events are appended, as the real store does, so only a
 * preceding delete keeps a target free of stale values.
 */
public class FakeMonitoringApi implements MonitoringApi {
  private final List<LocationRecord> locations = new ArrayList<>();
  private final Map<String, List<RawTimeseriesRecord>> rawTimeseries = new HashMap<>();
  private final Map<String, List<RawObservation>> aggregates = new HashMap<>();
  private final Map<String, Derived> derived = new LinkedHashMap<>();
  private final Map<String, List<EventRecord>> events = new HashMap<>();
  private final Map<String, RuntimeException> failures = new HashMap<>();
  private final List<String> calls = new ArrayList<>();
  private final Map<String, Runnable> hooks = new HashMap<>();
  private Runnable afterListLocations = () -> {};
  private int nextId = 1;

  public synchronized FakeMonitoringApi location(String uuid, String name) {
    locations.add(new LocationRecord(uuid, name, null));
    return this;
  }

  public synchronized FakeMonitoringApi rawTimeseries(String locationId, String uuid,
      String end) {
    rawTimeseries.computeIfAbsent(locationId, k -> new ArrayList<>())
        .add(new RawTimeseriesRecord(uuid, "WNS9040", "2000-01-01T00:00:00Z", end));
    return this;
  }

  public synchronized FakeMonitoringApi aggregate(String timeseriesId, String timestamp,
      Double value) {
    aggregates.computeIfAbsent(timeseriesId, k -> new ArrayList<>())
        .add(new RawObservation(timestamp, value));
    return this;
  }

  public synchronized FakeMonitoringApi derived(String uuid, String locationId,
      int observationTypeId) {
    derived.put(uuid, new Derived(locationId, observationTypeId, null));
    return this;
  }

  /** Makes {@code operation} fail with {@code ex} whenever its first argument equals {@code key}. */
  public synchronized FakeMonitoringApi failOn(String operation, String key, RuntimeException ex) {
    failures.put(operation + ":" + key, ex);
    return this;
  }

  public synchronized FakeMonitoringApi afterListLocations(Runnable hook) {
    this.afterListLocations = hook;
    return this;
  }

  /**
   * Runs {@code hook} each time {@code call} (for example {@code "deleteEvents:derived-1"})
   * completes. Hooks run outside the store's monitor, so a blocking hook stalls only its caller.
   */
  public synchronized FakeMonitoringApi onCall(String call, Runnable hook) {
    hooks.put(call, hook);
    return this;
  }

  public synchronized List<String> calls() {
    return List.copyOf(calls);
  }

  public synchronized List<EventRecord> events(String timeseriesId) {
    return List.copyOf(events.getOrDefault(timeseriesId, List.of()));
  }

  public synchronized Map<String, NewTimeseriesRequest> createdTimeseries() {
    Map<String, NewTimeseriesRequest> created = new LinkedHashMap<>();
    derived.forEach((uuid, d) -> {
      if (d.request() != null) {
        created.put(uuid, d.request());
      }
    });
    return created;
  }

  public synchronized int derivedCount() {
    return derived.size();
  }

  @Override
  public List<LocationRecord> listLocations(String organisationId, int limit) {
    List<LocationRecord> result;
    synchronized (this) {
      record("listLocations", organisationId);
      result = locations.stream().limit(limit).toList();
    }
    afterListLocations.run();
    return result;
  }

  @Override
  public synchronized List<RawTimeseriesRecord> listRawTimeseries(String locationId,
      String seriesName) {
    record("listRawTimeseries", locationId);
    return rawTimeseries.getOrDefault(locationId, List.of()).stream()
        .filter(ts -> ts.name().equals(seriesName))
        .toList();
  }

  @Override
  public synchronized List<RawObservation> fetchDailyAggregates(String timeseriesId,
      Instant start, Instant end) {
    record("fetchDailyAggregates", timeseriesId);
    return List.copyOf(aggregates.getOrDefault(timeseriesId, List.of()));
  }

  @Override
  public synchronized List<DerivedTimeseriesRecord> findDerivedTimeseries(String locationId,
      int observationTypeId) {
    record("findDerivedTimeseries", locationId + ":" + observationTypeId);
    List<DerivedTimeseriesRecord> matches = new ArrayList<>();
    derived.forEach((uuid, d) -> {
      if (d.locationId().equals(locationId) && d.observationTypeId() == observationTypeId) {
        matches.add(new DerivedTimeseriesRecord(uuid, null, null));
      }
    });
    return matches;
  }

  @Override
  public synchronized String createTimeseries(NewTimeseriesRequest request) {
    record("createTimeseries", request.name());
    String uuid = "derived-" + nextId++;
    derived.put(uuid, new Derived(request.location(), request.observationType(), request));
    return uuid;
  }

  @Override
  public void deleteEvents(String timeseriesId) {
    synchronized (this) {
      record("deleteEvents", timeseriesId);
      events.remove(timeseriesId);
    }
    runHook("deleteEvents:" + timeseriesId);
  }

  @Override
  public void submitEvents(String timeseriesId, List<EventRecord> records) {
    synchronized (this) {
      record("submitEvents", timeseriesId);
      events.computeIfAbsent(timeseriesId, k -> new ArrayList<>()).addAll(records);
    }
    runHook("submitEvents:" + timeseriesId);
  }

  private void runHook(String call) {
    Runnable hook;
    synchronized (this) {
      hook = hooks.get(call);
    }
    if (hook != null) {
      hook.run();
    }
  }

  private void record(String operation, String key) {
    String call = operation + ":" + key;
    calls.add(call);
    RuntimeException failure = failures.get(call);
    if (failure != null) {
      throw failure;
    }
  }

  private record Derived(String locationId, int observationTypeId, NewTimeseriesRequest request) {}
}
