package com.example.labjobs.service;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/** What the host scheduler should do after a tick: run again after a delay, or stop. */
public final class TickOutcome {

  private static final TickOutcome STOP = new TickOutcome(null);

  private final Duration delay;

  private TickOutcome(Duration delay) {
    this.delay = delay;
  }

  public static TickOutcome runAgainAfter(Duration delay) {
    Objects.requireNonNull(delay, "delay");
    if (delay.isNegative()) {
      throw new IllegalArgumentException("delay must not be negative: " + delay);
    }
    return new TickOutcome(delay);
  }

  public static TickOutcome stop() {
    return STOP;
  }

  public boolean isStop() {
    return delay == null;
  }

  /** Empty for {@link #stop()}. */
  public Optional<Duration> delay() {
    return Optional.ofNullable(delay);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof TickOutcome)) {
      return false;
    }
    return Objects.equals(delay, ((TickOutcome) other).delay);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(delay);
  }

  @Override
  public String toString() {
    return isStop() ? "TickOutcome[stop]" : "TickOutcome[runAgainAfter=" + delay + "]";
  }
}
