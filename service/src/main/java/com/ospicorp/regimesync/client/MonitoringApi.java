package com.ospicorp.regimesync.client;

import com.ospicorp.regimesync.client.model.DerivedTimeseriesRecord;
import com.ospicorp.regimesync.client.model.EventRecord;
import com.ospicorp.regimesync.client.model.LocationRecord;
import com.ospicorp.regimesync.client.model.NewTimeseriesRequest;
import com.ospicorp.regimesync.client.model.RawTimeseriesRecord;
import com.ospicorp.regimesync.series.model.RawObservation;
import java.time.Instant;
import java.util.List;

/**
 * Remote monitoring-data store (locations, timeseries and their events).
 *
 * <p>Every method is a blocking call bounded by the configured timeouts. Failures surface as
 * {@link com.ospicorp.regimesync.exception.NetworkException} or
 * {@link com.ospicorp.regimesync.exception.PayloadParseException}.
 */
public interface MonitoringApi {

  /** Locations of an organisation, at most {@code limit} of them. */
  List<LocationRecord> listLocations(String organisationId, int limit);

  /** Raw timeseries at a location carrying the given series name tag. */
  List<RawTimeseriesRecord> listRawTimeseries(String locationId, String seriesName);

  /** Daily aggregates of a raw timeseries over {@code [start, end]}. */
  List<RawObservation> fetchDailyAggregates(String timeseriesId, Instant start, Instant end);

  /** Derived timeseries at a location with the given observation type. */
  List<DerivedTimeseriesRecord> findDerivedTimeseries(String locationId, int observationTypeId);

  /** Creates a timeseries resource and returns its identifier. */
  String createTimeseries(NewTimeseriesRequest request);

  /** Removes every recorded value of a timeseries. */
  void deleteEvents(String timeseriesId);

  /** Adds the given records to a timeseries. */
  void submitEvents(String timeseriesId, List<EventRecord> events);
}
