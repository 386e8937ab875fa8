package com.ospicorp.regimesync.config;

import com.ospicorp.regimesync.client.MonitoringApi;
import com.ospicorp.regimesync.client.MonitoringApiClient;
import java.time.Clock;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

@Configuration
public class ClientConfig {
  static final String USERNAME_HEADER = "username";
  static final String PASSWORD_HEADER = "password";

  @Bean
  RestTemplate monitoringRestTemplate(RestTemplateBuilder builder, RegimeProperties properties) {
    RegimeProperties.Api api = properties.api();
    return builder
        .setConnectTimeout(api.connectTimeout())
        .setReadTimeout(api.readTimeout())
        .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
        .defaultHeader(USERNAME_HEADER, properties.credentials().username())
        .defaultHeader(PASSWORD_HEADER, properties.credentials().password())
        .build();
  }

  @Bean
  MonitoringApi monitoringApi(RestTemplate monitoringRestTemplate, RegimeProperties properties) {
    return new MonitoringApiClient(monitoringRestTemplate, properties.api().baseUrl(),
        properties.api().pageSize());
  }

  @Bean
  Clock clock() {
    return Clock.systemDefaultZone();
  }
}
