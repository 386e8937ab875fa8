package com.ospicorp.regimesync.sync;

import com.ospicorp.regimesync.client.MonitoringApi;
import com.ospicorp.regimesync.client.model.DerivedTimeseriesRecord;
import com.ospicorp.regimesync.client.model.EventRecord;
import com.ospicorp.regimesync.client.model.LocationRecord;
import com.ospicorp.regimesync.client.model.NewTimeseriesRequest;
import com.ospicorp.regimesync.exception.NetworkException;
import com.ospicorp.regimesync.exception.PublishConsistencyException;
import com.ospicorp.regimesync.series.model.AnomalySeries;
import com.ospicorp.regimesync.series.model.DataPoint;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Replaces the values of a derived timeseries with a freshly computed column.
 *
 * <p>The store has no upsert, so a publication resolves the target (reusing the first resource
 * that matches location and observation type, creating one when none exists), wipes its values
 * and submits the complete column. Publications to the same location and observation type are
 * serialised.
 */
@Service
public class SyncPublisher {
  private static final Logger log = LoggerFactory.getLogger(SyncPublisher.class);
  static final DateTimeFormatter EVENT_TIME =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'", Locale.ROOT);

  private final MonitoringApi api;
  private final String supplier;
  private final ConcurrentMap<String, KeyLock> locks = new ConcurrentHashMap<>();

  public SyncPublisher(MonitoringApi api,
      @Value("${regime.credentials.username}") String supplier) {
    this.api = api;
    this.supplier = supplier;
  }

  /**
   * @throws NetworkException if the target could not be looked up or created; the store is
   *     unchanged in that case
   * @throws PublishConsistencyException if clearing or submitting values failed
   */
  public PublishResult publish(LocationRecord location, AnomalySeries series,
      PublishTarget target) {
    List<EventRecord> events = toEvents(series.column(target.sourceColumn()));
    String key = location.uuid() + '|' + target.observationTypeId();
    KeyLock lock = acquire(key);
    try {
      Resolution resolution = resolve(location, target);
      String resourceId = resolution.resourceId();

      log.info("Delete existing data at \"{}\"", resourceId);
      try {
        api.deleteEvents(resourceId);
      } catch (RuntimeException ex) {
        throw new PublishConsistencyException(location.uuid(), target.label(), resourceId,
            false, ex);
      }

      log.info("Post {} values at \"{}\"", events.size(), resourceId);
      try {
        if (!events.isEmpty()) {
          api.submitEvents(resourceId, events);
        }
      } catch (RuntimeException ex) {
        throw new PublishConsistencyException(location.uuid(), target.label(), resourceId,
            true, ex);
      }
      return PublishResult.published(target.label(), resourceId, resolution.created(),
          events.size());
    } finally {
      release(key, lock);
    }
  }

  private KeyLock acquire(String key) {
    KeyLock lock = locks.compute(key, (k, held) -> {
      KeyLock next = held == null ? new KeyLock() : held;
      next.users++;
      return next;
    });
    lock.mutex.lock();
    return lock;
  }

  // entries live only while some thread holds or waits for them
  private void release(String key, KeyLock lock) {
    lock.mutex.unlock();
    locks.computeIfPresent(key, (k, held) -> --held.users == 0 ? null : held);
  }

  int lockCount() {
    return locks.size();
  }

  private Resolution resolve(LocationRecord location, PublishTarget target) {
    List<DerivedTimeseriesRecord> existing =
        api.findDerivedTimeseries(location.uuid(), target.observationTypeId());
    if (!existing.isEmpty()) {
      if (existing.size() > 1) {
        log.warn("{} timeseries match observation type {} at \"{}\"; reusing \"{}\"",
            existing.size(), target.observationTypeId(), location.name(), existing.get(0).uuid());
      }
      return new Resolution(existing.get(0).uuid(), false);
    }
    log.info("New timeseries for \"{}\", \"{}\"", location.name(), target.label());
    String resourceId = api.createTimeseries(NewTimeseriesRequest.floatSeries(
        location.name() + ", " + target.label(), target.code(), supplier, location.uuid(),
        target.observationTypeId()));
    return new Resolution(resourceId, true);
  }

  static List<EventRecord> toEvents(List<DataPoint> column) {
    List<EventRecord> events = new ArrayList<>(column.size());
    for (DataPoint point : column) {
      events.add(new EventRecord(EVENT_TIME.format(point.date().atStartOfDay()), point.value()));
    }
    return events;
  }

  private record Resolution(String resourceId, boolean created) {}

  private static final class KeyLock {
    private final ReentrantLock mutex = new ReentrantLock();
    private int users;
  }
}
