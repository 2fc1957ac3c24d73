/*
 * Where: Lab jobs service layer
 * What: Records materialization, reminder, finalization and tick metrics
 * Why: Reminder delivery failures and stuck ticks must be visible from Prometheus
 */
package com.example.labjobs.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class LabJobMetrics {

  private static final String METRIC_MATERIALIZED_TOTAL = "labjobs.instances.materialized.total";
  private static final String METRIC_REMINDER_TOTAL = "labjobs.reminders.total";
  private static final String METRIC_FINALIZE_TOTAL = "labjobs.finalize.edits.total";
  private static final String METRIC_CONFIGURATION_ERRORS = "labjobs.configuration.errors.total";
  private static final String METRIC_TICK_FAILURES = "labjobs.tick.failures.total";
  private static final String METRIC_TICK_DURATION = "labjobs.tick.duration";
  private static final String METRIC_OPEN_INSTANCES = "labjobs.instances.open.current";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger openInstances = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> reminderCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> finalizeCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> configurationErrorCounters = new ConcurrentHashMap<>();
  private final Counter materializedCounter;
  private final Counter tickFailureCounter;
  private final Timer tickTimer;

  public LabJobMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_OPEN_INSTANCES, openInstances, AtomicInteger::get)
        .description("Open job instances with an assignee, as of the last tick")
        .register(meterRegistry);
    this.materializedCounter =
        Counter.builder(METRIC_MATERIALIZED_TOTAL)
            .description("Job instances created from templates")
            .register(meterRegistry);
    this.tickFailureCounter =
        Counter.builder(METRIC_TICK_FAILURES)
            .description("Ticks aborted by an unhandled error")
            .register(meterRegistry);
    this.tickTimer =
        Timer.builder(METRIC_TICK_DURATION)
            .description("Wall time of one materialize + remind tick")
            .register(meterRegistry);
  }

  public void recordMaterialized() {
    materializedCounter.increment();
  }

  /** result: sent, failed, late_finalized */
  public void recordReminder(String result) {
    counter(reminderCounters, METRIC_REMINDER_TOTAL, "Reminder send outcomes", result).increment();
  }

  /** result: edited, failed */
  public void recordFinalizeEdit(String result) {
    counter(finalizeCounters, METRIC_FINALIZE_TOTAL, "Completion message edit outcomes", result)
        .increment();
  }

  /** source: recurrence, reminder_schedule */
  public void recordConfigurationError(String source) {
    configurationErrors(source).increment();
  }

  public void recordTickFailure() {
    tickFailureCounter.increment();
  }

  public void recordTickDuration(Duration duration) {
    tickTimer.record(duration);
  }

  public void updateOpenInstances(int count) {
    openInstances.set(Math.max(count, 0));
  }

  private Counter configurationErrors(String source) {
    return configurationErrorCounters.computeIfAbsent(
        source,
        ignored ->
            Counter.builder(METRIC_CONFIGURATION_ERRORS)
                .description("Configuration errors met while running ticks")
                .tags(Tags.of("source", source))
                .register(meterRegistry));
  }

  private Counter counter(
      ConcurrentMap<String, Counter> cache, String name, String description, String result) {
    return cache.computeIfAbsent(
        result,
        ignored ->
            Counter.builder(name)
                .description(description)
                .tags(Tags.of("result", result))
                .register(meterRegistry));
  }
}
