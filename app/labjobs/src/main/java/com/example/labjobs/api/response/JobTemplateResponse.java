package com.example.labjobs.api.response;

import com.example.labjobs.model.JobTemplateRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobTemplateResponse(
    long templateId,
    int sortPriority,
    String name,
    String lastGeneratedOn,
    Long reminderScheduleId,
    String recurrence,
    String assignee) {

  public static JobTemplateResponse from(JobTemplateRecord record) {
    return new JobTemplateResponse(
        record.templateId(),
        record.sortPriority(),
        record.name(),
        record.lastGeneratedOn() == null ? null : record.lastGeneratedOn().toString(),
        record.reminderScheduleId(),
        record.recurrence(),
        record.assignee());
  }
}
