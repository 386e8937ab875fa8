package com.ospicorp.regimesync.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.ospicorp.regimesync.client.MonitoringApi;
import com.ospicorp.regimesync.client.model.LocationRecord;
import com.ospicorp.regimesync.exception.NetworkException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class RunControllerTest {

  @Autowired
  private TestRestTemplate rest;

  @MockBean
  private MonitoringApi api;

  @Test
  void runIsTriggeredAndKeptAsLatest() {
    ResponseEntity<Map<String, Object>> before = get("/v1/runs/latest");
    assertThat(before.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);

    when(api.listLocations(anyString(), anyInt()))
        .thenReturn(List.of(new LocationRecord("loc-1", "Well 1", null)));
    when(api.listRawTimeseries("loc-1", "WNS9040"))
        .thenThrow(new NetworkException("list timeseries", 500, "Server Error", null));

    ResponseEntity<Map<String, Object>> run = rest.exchange("/admin/runs", HttpMethod.POST, null,
        new ParameterizedTypeReference<Map<String, Object>>() {});
    assertThat(run.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(run.getBody()).containsEntry("exit_code", 1);
    assertThat(run.getBody()).containsKeys("run_id", "started_at", "finished_at", "counts",
        "outcomes");

    ResponseEntity<Map<String, Object>> latest = get("/v1/runs/latest");
    assertThat(latest.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(latest.getBody()).containsEntry("run_id", run.getBody().get("run_id"));
  }

  @Test
  void cancelWithoutActiveRunIsProblemDetail() {
    ResponseEntity<Map<String, Object>> response = rest.exchange("/admin/runs/current",
        HttpMethod.DELETE, null, new ParameterizedTypeReference<Map<String, Object>>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    MediaType contentType = Objects.requireNonNull(response.getHeaders().getContentType());
    assertThat(contentType.toString()).contains("application/problem+json");
    assertThat(response.getBody()).containsKeys("type", "title", "status", "detail", "instance");
    assertThat(response.getBody()).containsEntry("path", "/admin/runs/current");
  }

  private ResponseEntity<Map<String, Object>> get(String path) {
    return rest.exchange(path, HttpMethod.GET, null,
        new ParameterizedTypeReference<Map<String, Object>>() {});
  }
}
