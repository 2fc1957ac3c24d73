package com.example.labjobs.model;

import java.time.Duration;
import java.util.Objects;

/** One escalation step: once more than {@code threshold} has elapsed past due, remind every {@code interval}. */
public record ReminderStep(Duration threshold, Duration interval) {

  public ReminderStep {
    Objects.requireNonNull(threshold, "threshold");
    Objects.requireNonNull(interval, "interval");
    if (threshold.isNegative()) {
      throw new IllegalArgumentException("threshold must not be negative: " + threshold);
    }
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive: " + interval);
    }
  }
}
