package com.ospicorp.regimesync.sync;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.regimesync.client.FakeMonitoringApi;
import com.ospicorp.regimesync.client.model.EventRecord;
import com.ospicorp.regimesync.client.model.LocationRecord;
import com.ospicorp.regimesync.client.model.NewTimeseriesRequest;
import com.ospicorp.regimesync.exception.NetworkException;
import com.ospicorp.regimesync.exception.PublishConsistencyException;
import com.ospicorp.regimesync.series.model.AnomalyPoint;
import com.ospicorp.regimesync.series.model.AnomalySeries;
import com.ospicorp.regimesync.series.model.SourceColumn;
import com.ospicorp.regimesync.sync.PublishResult.PublishStatus;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class SyncPublisherTest {
  private static final LocationRecord WELL = new LocationRecord("loc-1", "Well 1", "W1");
  private static final PublishTarget ANOMALY =
      new PublishTarget("Anomaly", 1328, "WNS9040.anomaly", SourceColumn.ANOMALY);

  private final FakeMonitoringApi api = new FakeMonitoringApi();
  private final SyncPublisher publisher = new SyncPublisher(api, "regime-user");

  private static AnomalySeries series() {
    return new AnomalySeries(List.of(
        new AnomalyPoint(LocalDate.of(2019, 1, 1), 1.0, 2.0, 1.0, 3.0, -1.0),
        new AnomalyPoint(LocalDate.of(2020, 1, 1), 3.0, 2.0, null, 3.0, 1.0),
        new AnomalyPoint(LocalDate.of(2021, 1, 1), 5.0, 2.0, 1.0, 3.0, 3.0)));
  }

  @Test
  void createsTargetBeforeReplacingValuesWhenNoneExists() {
    var result = publisher.publish(WELL, series(), ANOMALY);

    assertEquals(List.of(
        "findDerivedTimeseries:loc-1:1328",
        "createTimeseries:Well 1, Anomaly",
        "deleteEvents:derived-1",
        "submitEvents:derived-1"), api.calls());
    assertEquals(PublishStatus.PUBLISHED, result.status());
    assertTrue(result.created());
    assertEquals("derived-1", result.resourceId());
    assertEquals(3, result.eventCount());

    NewTimeseriesRequest request = api.createdTimeseries().get("derived-1");
    assertEquals("WNS9040.anomaly", request.code());
    assertEquals("regime-user", request.supplier());
    assertEquals("loc-1", request.location());
    assertEquals(1328, request.observationType());
    assertEquals(NewTimeseriesRequest.ACCESS_PUBLIC, request.accessModifier());
    assertEquals(NewTimeseriesRequest.VALUE_TYPE_FLOAT, request.valueType());
    assertNull(request.supplierCode());
  }

  @Test
  void reusesExistingTarget() {
    api.derived("existing-1", "loc-1", 1328);

    var result = publisher.publish(WELL, series(), ANOMALY);

    assertEquals(List.of(
        "findDerivedTimeseries:loc-1:1328",
        "deleteEvents:existing-1",
        "submitEvents:existing-1"), api.calls());
    assertFalse(result.created());
    assertEquals("existing-1", result.resourceId());
  }

  @Test
  void duplicateMatchesReuseFirstAndLeaveOthers() {
    api.derived("existing-1", "loc-1", 1328).derived("existing-2", "loc-1", 1328);

    var result = publisher.publish(WELL, series(), ANOMALY);

    assertEquals("existing-1", result.resourceId());
    assertEquals(2, api.derivedCount());
    assertFalse(api.calls().contains("deleteEvents:existing-2"));
  }

  @Test
  void publishingTwiceLeavesSingleCopyOfValues() {
    publisher.publish(WELL, series(), ANOMALY);
    publisher.publish(WELL, series(), ANOMALY);

    assertEquals(1, api.derivedCount());
    assertEquals(List.of(
        new EventRecord("2019-01-01T00:00:00Z", -1.0),
        new EventRecord("2020-01-01T00:00:00Z", 1.0),
        new EventRecord("2021-01-01T00:00:00Z", 3.0)), api.events("derived-1"));
  }

  @Test
  void missingValuesAreNotSubmitted() {
    var minimum = new PublishTarget("Regime min", 1326, "WNS9040.regime.min",
        SourceColumn.REGIME_MIN);

    var result = publisher.publish(WELL, series(), minimum);

    assertEquals(2, result.eventCount());
    assertEquals(List.of(
        new EventRecord("2019-01-01T00:00:00Z", 1.0),
        new EventRecord("2021-01-01T00:00:00Z", 1.0)), api.events(result.resourceId()));
  }

  @Test
  void emptyColumnClearsTargetWithoutSubmitting() {
    api.derived("existing-1", "loc-1", 1328);

    var result = publisher.publish(WELL, new AnomalySeries(List.of()), ANOMALY);

    assertEquals(0, result.eventCount());
    assertTrue(api.calls().contains("deleteEvents:existing-1"));
    assertFalse(api.calls().contains("submitEvents:existing-1"));
  }

  @Test
  void deleteFailureAbortsBeforeSubmitting() {
    api.derived("existing-1", "loc-1", 1328)
        .failOn("deleteEvents", "existing-1",
            new NetworkException("delete events", 503, "Service Unavailable", null));

    var ex = assertThrows(PublishConsistencyException.class,
        () -> publisher.publish(WELL, series(), ANOMALY));

    assertEquals("loc-1", ex.locationId());
    assertEquals("Anomaly", ex.targetLabel());
    assertEquals("existing-1", ex.resourceId());
    assertFalse(ex.targetCleared());
    assertInstanceOf(NetworkException.class, ex.getCause());
    assertFalse(api.calls().contains("submitEvents:existing-1"));
  }

  @Test
  void submitFailureReportsClearedTarget() {
    api.derived("existing-1", "loc-1", 1328)
        .failOn("submitEvents", "existing-1",
            new NetworkException("post events", null, "Read timed out", null));

    var ex = assertThrows(PublishConsistencyException.class,
        () -> publisher.publish(WELL, series(), ANOMALY));

    assertTrue(ex.targetCleared());
    assertTrue(api.events("existing-1").isEmpty());
  }

  @Test
  void lookupFailureLeavesStoreUntouched() {
    api.failOn("findDerivedTimeseries", "loc-1:1328",
        new NetworkException("get existing derived timeseries", 500, "Server Error", null));

    assertThrows(NetworkException.class, () -> publisher.publish(WELL, series(), ANOMALY));

    assertEquals(List.of("findDerivedTimeseries:loc-1:1328"), api.calls());
  }

  @Test
  void concurrentPublicationsToSameTargetRunOneAfterAnother() throws Exception {
    CountDownLatch firstDeleted = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    AtomicBoolean blocked = new AtomicBoolean();
    api.onCall("deleteEvents:derived-1", () -> {
      if (blocked.compareAndSet(false, true)) {
        firstDeleted.countDown();
        try {
          release.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException(ex);
        }
      }
    });

    ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      Future<PublishResult> first = pool.submit(() -> publisher.publish(WELL, series(), ANOMALY));
      assertTrue(firstDeleted.await(5, TimeUnit.SECONDS));
      Future<PublishResult> second =
          pool.submit(() -> publisher.publish(WELL, series(), ANOMALY));

      // the second publication waits while the first holds the target
      assertThrows(TimeoutException.class, () -> second.get(200, TimeUnit.MILLISECONDS));
      assertEquals(List.of(
          "findDerivedTimeseries:loc-1:1328",
          "createTimeseries:Well 1, Anomaly",
          "deleteEvents:derived-1"), api.calls());

      release.countDown();
      assertTrue(first.get(5, TimeUnit.SECONDS).created());
      assertFalse(second.get(5, TimeUnit.SECONDS).created());
    } finally {
      release.countDown();
      pool.shutdownNow();
    }

    assertEquals(List.of(
        "findDerivedTimeseries:loc-1:1328",
        "createTimeseries:Well 1, Anomaly",
        "deleteEvents:derived-1",
        "submitEvents:derived-1",
        "findDerivedTimeseries:loc-1:1328",
        "deleteEvents:derived-1",
        "submitEvents:derived-1"), api.calls());
    assertEquals(1, api.createdTimeseries().size());
    assertEquals(3, api.events("derived-1").size());
    assertEquals(0, publisher.lockCount());
  }

  @Test
  void keyLocksAreDroppedOnceReleased() {
    var regimeMean = new PublishTarget("Regime mean", 1325, "WNS9040.regime.mean",
        SourceColumn.REGIME_MEAN);
    api.failOn("findDerivedTimeseries", "loc-2:1328",
        new NetworkException("get existing derived timeseries", 500, "Server Error", null));

    publisher.publish(WELL, series(), ANOMALY);
    publisher.publish(WELL, series(), regimeMean);
    assertThrows(NetworkException.class, () ->
        publisher.publish(new LocationRecord("loc-2", "Well 2", "W2"), series(), ANOMALY));

    assertEquals(0, publisher.lockCount());
  }
}
