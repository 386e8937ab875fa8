package com.ospicorp.regimesync.web;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  @Bean
  OpenAPI apiInfo() {
    return new OpenAPI()
        .info(new Info()
            .title("Regime Sync API")
            .version("v1")
            .description("Triggers and inspects groundwater regime and anomaly runs")
            .contact(new Contact().name("Monitoring Data Team").email("regime-sync@example.com")))
        .servers(List.of(new Server().url("/")));
  }
}
