/*
 * Where: Lab jobs domain model
 * What: A reminder schedule with its escalation steps
 * Why: The cadence engine and the configuration API read schedules as data
 */
package com.example.labjobs.model;

import java.util.List;

public record ReminderScheduleRecord(long scheduleId, String name, List<ReminderStep> steps) {

  public ReminderScheduleRecord {
    steps = List.copyOf(steps);
  }
}
