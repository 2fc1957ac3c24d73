/*
 * Where: Lab jobs service layer
 * What: The escalation lookup for one reminder schedule
 * Why: Required reminder interval = minimum interval among steps whose threshold has been passed
 */
package com.example.labjobs.service;

import com.example.labjobs.model.ReminderStep;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps "time elapsed past due" to "required interval between reminders".
 *
 * <p>The step set always contains an implicit (0, {@link #IMPLICIT_INTERVAL}) pair. A step is
 * eligible when its threshold is strictly less than the elapsed time, and the required interval
 * is the minimum over eligible steps. Adding eligible steps can only lower the minimum, so the
 * result never grows as elapsed time increases. When nothing is eligible (elapsed of zero or
 * less) the implicit interval applies.
 */
public final class ReminderCadence {

  /** Effectively "never": one hundred years. */
  public static final Duration IMPLICIT_INTERVAL = Duration.ofDays(100L * 365);

  private static final ReminderStep IMPLICIT_STEP = new ReminderStep(Duration.ZERO, IMPLICIT_INTERVAL);

  /** Cadence for instances without a reminder schedule: never escalates past the implicit pair. */
  public static final ReminderCadence NONE = new ReminderCadence(List.of());

  private final List<ReminderStep> steps;

  private ReminderCadence(List<ReminderStep> configured) {
    final List<ReminderStep> all = new ArrayList<>(configured.size() + 1);
    all.addAll(configured);
    all.add(IMPLICIT_STEP);
    this.steps = List.copyOf(all);
  }

  public static ReminderCadence of(List<ReminderStep> steps) {
    return steps.isEmpty() ? NONE : new ReminderCadence(steps);
  }

  public Duration requiredInterval(Duration elapsedSinceDue) {
    Duration required = null;
    for (ReminderStep step : steps) {
      if (step.threshold().compareTo(elapsedSinceDue) < 0
          && (required == null || step.interval().compareTo(required) < 0)) {
        required = step.interval();
      }
    }
    return required == null ? IMPLICIT_INTERVAL : required;
  }

  public boolean shouldRemind(Duration sinceLastReminder, Duration elapsedSinceDue) {
    return sinceLastReminder.compareTo(requiredInterval(elapsedSinceDue)) > 0;
  }
}
