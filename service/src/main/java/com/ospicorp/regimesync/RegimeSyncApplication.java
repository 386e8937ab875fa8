package com.ospicorp.regimesync;

import com.ospicorp.regimesync.config.RegimeProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RegimeSyncApplication {

  public static void main(String[] args) {
    ConfigurableApplicationContext context = SpringApplication.run(RegimeSyncApplication.class, args);
    if (context.getBean(RegimeProperties.class).exitAfterRun()) {
      System.exit(SpringApplication.exit(context));
    }
  }
}
