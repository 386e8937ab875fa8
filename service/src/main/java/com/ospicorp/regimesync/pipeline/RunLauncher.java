package com.ospicorp.regimesync.pipeline;

import com.ospicorp.regimesync.config.RegimeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Starts a run during startup when {@code regime.run-on-startup} is set, and reports its exit
 * code when the application context is closed through {@code SpringApplication.exit}.
 */
@Component
public class RunLauncher implements CommandLineRunner, ExitCodeGenerator {
  private static final Logger log = LoggerFactory.getLogger(RunLauncher.class);

  private final RegimePipeline pipeline;
  private final RegimeProperties properties;
  private volatile int exitCode = RunSummary.EXIT_OK;

  public RunLauncher(RegimePipeline pipeline, RegimeProperties properties) {
    this.pipeline = pipeline;
    this.properties = properties;
  }

  @Override
  public void run(String... args) {
    if (!properties.runOnStartup()) {
      return;
    }
    try {
      exitCode = pipeline.run().exitCode();
    } catch (RuntimeException ex) {
      log.error("Run on startup failed: {}", ex.getMessage(), ex);
      exitCode = RunSummary.EXIT_FAILED;
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
