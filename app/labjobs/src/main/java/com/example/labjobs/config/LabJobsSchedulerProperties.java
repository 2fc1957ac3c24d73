/*
 * Where: Lab jobs configuration binding
 * What: Tick cadence, local zone and the daily materialization cutoff
 * Why: Operational parameters are passed to the engine explicitly instead of living in global state
 */
package com.example.labjobs.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "labjobs.scheduler")
@Validated
public record LabJobsSchedulerProperties(
    boolean enabled,
    @NotNull Duration pollInterval,
    @NotNull ZoneId zone,
    @Min(0) @Max(23) int materializeAfterHour) {

  @AssertTrue(message = "labjobs.scheduler.poll-interval must be positive")
  public boolean isPollIntervalPositive() {
    // null is reported by @NotNull
    return pollInterval == null || (!pollInterval.isZero() && !pollInterval.isNegative());
  }
}
