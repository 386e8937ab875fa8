package com.ospicorp.regimesync.client;

import com.ospicorp.regimesync.client.model.AggregateRecord;
import com.ospicorp.regimesync.client.model.DerivedTimeseriesRecord;
import com.ospicorp.regimesync.client.model.EventRecord;
import com.ospicorp.regimesync.client.model.LocationRecord;
import com.ospicorp.regimesync.client.model.NewTimeseriesRequest;
import com.ospicorp.regimesync.client.model.PageResponse;
import com.ospicorp.regimesync.client.model.RawTimeseriesRecord;
import com.ospicorp.regimesync.exception.NetworkException;
import com.ospicorp.regimesync.exception.PayloadParseException;
import com.ospicorp.regimesync.series.model.RawObservation;
import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * {@link MonitoringApi} over {@link RestTemplate}. Credentials and timeouts are configured on
 * the template itself.
 */
public class MonitoringApiClient implements MonitoringApi {
  private static final Logger log = LoggerFactory.getLogger(MonitoringApiClient.class);

  private static final ParameterizedTypeReference<PageResponse<LocationRecord>> LOCATION_PAGE =
      new ParameterizedTypeReference<>() {};
  private static final ParameterizedTypeReference<PageResponse<RawTimeseriesRecord>> TIMESERIES_PAGE =
      new ParameterizedTypeReference<>() {};
  private static final ParameterizedTypeReference<PageResponse<AggregateRecord>> AGGREGATE_PAGE =
      new ParameterizedTypeReference<>() {};
  private static final ParameterizedTypeReference<PageResponse<DerivedTimeseriesRecord>> DERIVED_PAGE =
      new ParameterizedTypeReference<>() {};

  private final RestTemplate restTemplate;
  private final String baseUrl;
  private final int pageSize;

  public MonitoringApiClient(RestTemplate restTemplate, String baseUrl, int pageSize) {
    if (!StringUtils.hasText(baseUrl)) {
      throw new IllegalArgumentException("baseUrl must be provided");
    }
    if (pageSize < 1) {
      throw new IllegalArgumentException("pageSize must be positive");
    }
    this.restTemplate = restTemplate;
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.pageSize = pageSize;
  }

  @Override
  public List<LocationRecord> listLocations(String organisationId, int limit) {
    if (limit < 1) {
      return List.of();
    }
    URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
        .path("/locations")
        .queryParam("page_size", Math.min(limit, pageSize))
        .queryParam("organisation__uuid", organisationId)
        .encode()
        .build()
        .toUri();
    List<LocationRecord> locations = fetchAllPages("list locations", uri, LOCATION_PAGE, limit);
    for (LocationRecord location : locations) {
      requireText(location.uuid(), "location without uuid", location.name());
    }
    return locations;
  }

  @Override
  public List<RawTimeseriesRecord> listRawTimeseries(String locationId, String seriesName) {
    URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
        .path("/timeseries")
        .queryParam("page_size", pageSize)
        .queryParam("name", seriesName)
        .queryParam("location__uuid", locationId)
        .encode()
        .build()
        .toUri();
    List<RawTimeseriesRecord> series =
        fetchAllPages("list timeseries", uri, TIMESERIES_PAGE, Integer.MAX_VALUE);
    for (RawTimeseriesRecord record : series) {
      requireText(record.uuid(), "timeseries without uuid", record.name());
    }
    return series;
  }

  @Override
  public List<RawObservation> fetchDailyAggregates(String timeseriesId, Instant start, Instant end) {
    URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
        .path("/timeseries/{uuid}/aggregates")
        .queryParam("page_size", pageSize)
        .queryParam("window", "day")
        .queryParam("fields", "first_timestamp,avg")
        .queryParam("start", start.toString())
        .queryParam("end", end.toString())
        .encode()
        .buildAndExpand(timeseriesId)
        .toUri();
    List<AggregateRecord> records =
        fetchAllPages("get aggregates", uri, AGGREGATE_PAGE, Integer.MAX_VALUE);
    List<RawObservation> observations = new ArrayList<>(records.size());
    for (AggregateRecord record : records) {
      observations.add(record.toObservation());
    }
    return observations;
  }

  @Override
  public List<DerivedTimeseriesRecord> findDerivedTimeseries(String locationId,
      int observationTypeId) {
    URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
        .path("/timeseries")
        .queryParam("page_size", pageSize)
        .queryParam("location__uuid", locationId)
        .queryParam("observation_type__id", observationTypeId)
        .encode()
        .build()
        .toUri();
    List<DerivedTimeseriesRecord> matches =
        fetchAllPages("get existing derived timeseries", uri, DERIVED_PAGE, Integer.MAX_VALUE);
    for (DerivedTimeseriesRecord record : matches) {
      requireText(record.uuid(), "derived timeseries without uuid", record.name());
    }
    return matches;
  }

  @Override
  public String createTimeseries(NewTimeseriesRequest request) {
    URI uri = URI.create(baseUrl + "/timeseries/");
    ResponseEntity<DerivedTimeseriesRecord> response = call("create timeseries",
        () -> restTemplate.exchange(uri, HttpMethod.POST, jsonEntity(request),
            DerivedTimeseriesRecord.class));
    DerivedTimeseriesRecord created = response.getBody();
    if (created == null) {
      throw new PayloadParseException("Empty create timeseries response", request.name());
    }
    requireText(created.uuid(), "created timeseries without uuid", request.name());
    return created.uuid();
  }

  @Override
  public void deleteEvents(String timeseriesId) {
    URI uri = eventsUri(timeseriesId, false);
    call("delete events", () -> restTemplate.exchange(uri, HttpMethod.DELETE, null, Void.class));
  }

  @Override
  public void submitEvents(String timeseriesId, List<EventRecord> events) {
    URI uri = eventsUri(timeseriesId, true);
    call("post events", () -> restTemplate.exchange(uri, HttpMethod.POST, jsonEntity(events),
        Void.class));
  }

  private URI eventsUri(String timeseriesId, boolean trailingSlash) {
    return UriComponentsBuilder.fromHttpUrl(baseUrl)
        .path(trailingSlash ? "/timeseries/{uuid}/events/" : "/timeseries/{uuid}/events")
        .encode()
        .buildAndExpand(timeseriesId)
        .toUri();
  }

  private <T> List<T> fetchAllPages(String operation, URI first,
      ParameterizedTypeReference<PageResponse<T>> type, int limit) {
    List<T> results = new ArrayList<>();
    URI next = first;
    int page = 0;
    while (next != null && results.size() < limit) {
      URI uri = next;
      ResponseEntity<PageResponse<T>> response =
          call(operation, () -> restTemplate.exchange(uri, HttpMethod.GET, null, type));
      PageResponse<T> body = response.getBody();
      if (body == null || body.results() == null) {
        throw new PayloadParseException("Response of " + operation + " has no results", uri.toString());
      }
      page++;
      for (T item : body.results()) {
        if (results.size() >= limit) {
          break;
        }
        results.add(item);
      }
      next = StringUtils.hasText(body.next()) ? URI.create(body.next()) : null;
    }
    log.debug("{}: {} results from {} page(s)", operation, results.size(), page);
    return results;
  }

  private static HttpEntity<Object> jsonEntity(Object body) {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    return new HttpEntity<>(body, headers);
  }

  private static <T> T call(String operation, Supplier<T> request) {
    try {
      return request.get();
    } catch (RestClientResponseException ex) {
      throw new NetworkException(operation, ex.getStatusCode().value(), ex.getStatusText(), ex);
    } catch (ResourceAccessException ex) {
      throw new NetworkException(operation, null, ex.getMessage(), ex);
    } catch (RestClientException ex) {
      if (ex.getCause() instanceof HttpMessageNotReadableException) {
        throw new PayloadParseException("Unexpected payload for " + operation, null, ex);
      }
      throw new NetworkException(operation, null, ex.getMessage(), ex);
    }
  }

  private static void requireText(String value, String message, String context) {
    if (!StringUtils.hasText(value)) {
      throw new PayloadParseException(message, context);
    }
  }
}
