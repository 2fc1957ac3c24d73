/*
 * Where: Lab jobs API response DTO
 * What: One job instance as returned by the instance endpoints
 * Why: Instants are rendered as ISO-8601 strings
 */
package com.example.labjobs.api.response;

import com.example.labjobs.model.JobInstanceRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobInstanceResponse(
    long instanceId,
    Long templateId,
    String name,
    boolean done,
    String dueAt,
    String lastReminderAt,
    Long reminderScheduleId,
    String assignee,
    String completedAt) {

  public static JobInstanceResponse from(JobInstanceRecord record) {
    return new JobInstanceResponse(
        record.instanceId(),
        record.templateId(),
        record.name(),
        record.done(),
        toIsoOrNull(record.dueAt()),
        toIsoOrNull(record.lastReminderAt()),
        record.reminderScheduleId(),
        record.assignee(),
        toIsoOrNull(record.completedAt()));
  }

  private static String toIsoOrNull(Instant value) {
    return value == null ? null : value.toString();
  }
}
