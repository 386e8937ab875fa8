package com.ospicorp.regimesync.config;

import com.ospicorp.regimesync.series.model.ReferencePeriod;
import com.ospicorp.regimesync.series.model.RegimeStatistic;
import com.ospicorp.regimesync.series.model.SourceColumn;
import com.ospicorp.regimesync.sync.PublishTarget;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.validation.annotation.Validated;

/**
 * Settings of the regime pipeline, bound from the {@code regime} prefix.
 */
@Validated
@ConfigurationProperties(prefix = "regime")
public record RegimeProperties(
    @Valid @NotNull Api api,
    @Valid @NotNull Credentials credentials,
    @NotBlank String organisationId,
    @DefaultValue("WNS9040") @NotBlank String seriesName,
    @Valid @NotNull Period referencePeriod,
    @DefaultValue("1") @Min(1) int locationCountLimit,
    @DefaultValue({"mean", "min", "max"}) @NotEmpty List<RegimeStatistic> statistics,
    @DefaultValue("4") @Min(1) int concurrency,
    @DefaultValue("true") boolean skipStaleSeries,
    @Valid @DefaultValue Plot plot,
    @Valid @DefaultValue Publish publish,
    @DefaultValue("false") boolean runOnStartup,
    @DefaultValue("false") boolean exitAfterRun
) {

  @AssertTrue(message = "statistics must include mean")
  public boolean isMeanRequested() {
    return statistics == null || statistics.contains(RegimeStatistic.MEAN);
  }

  public ReferencePeriod reference() {
    return new ReferencePeriod(referencePeriod.start(), referencePeriod.end());
  }

  public record Api(
      @NotBlank String baseUrl,
      @DefaultValue("10s") Duration connectTimeout,
      @DefaultValue("60s") Duration readTimeout,
      @DefaultValue("1000") @Min(1) int pageSize
  ) {}

  public record Credentials(
      @NotBlank String username,
      @NotBlank String password
  ) {
    @Override
    public String toString() {
      return "Credentials[username=" + username + ", password=****]";
    }
  }

  public record Period(
      @NotNull @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
      @NotNull @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end
  ) {

    @AssertTrue(message = "reference period start must be before or equal to end")
    public boolean isOrdered() {
      return start == null || end == null || !start.isAfter(end);
    }
  }

  public record Plot(
      @DefaultValue("false") boolean enabled,
      @DefaultValue("plot") String directory,
      List<Integer> years
  ) {
    public Plot {
      years = years == null ? List.of() : List.copyOf(years);
    }
  }

  public record Publish(
      @DefaultValue("false") boolean enabled,
      @Valid List<Target> targets
  ) {
    public Publish {
      targets = targets == null ? List.of() : List.copyOf(targets);
    }
  }

  public record Target(
      @Min(1) int observationTypeId,
      @NotBlank String label,
      @NotBlank String code,
      @NotNull SourceColumn sourceColumn
  ) {

    public PublishTarget toPublishTarget() {
      return new PublishTarget(label, observationTypeId, code, sourceColumn);
    }
  }
}
