package com.ospicorp.regimesync.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ExecutorConfig {

  /** Worker pool for pipeline tasks; its size is the concurrency cap towards the API. */
  @Bean
  ThreadPoolTaskExecutor regimeExecutor(RegimeProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.concurrency());
    executor.setMaxPoolSize(properties.concurrency());
    executor.setThreadNamePrefix("regime-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    return executor;
  }
}
