/*
 * Where: Lab jobs domain model
 * What: Snapshot of a job_instances row
 * Why: Name, schedule and assignee are copies so history stays stable when a template changes
 */
package com.example.labjobs.model;

import java.time.Instant;

public record JobInstanceRecord(
    long instanceId,
    Long templateId,
    String name,
    boolean done,
    Instant dueAt,
    Instant lastReminderAt,
    Long reminderScheduleId,
    String assignee,
    Instant completedAt) {

  public boolean hasAssignee() {
    return assignee != null && !assignee.isBlank();
  }
}
