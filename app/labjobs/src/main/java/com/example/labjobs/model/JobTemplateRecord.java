/*
 * Where: Lab jobs domain model
 * What: Snapshot of a job_templates row
 * Why: Materializer and configuration API share one shape for recurring duty definitions
 */
package com.example.labjobs.model;

import java.time.LocalDate;

/**
 * A recurring duty definition.
 *
 * @param lastGeneratedOn watermark: the local date through which instances were generated
 * @param assignee null makes the template inert
 */
public record JobTemplateRecord(
    long templateId,
    int sortPriority,
    String name,
    LocalDate lastGeneratedOn,
    Long reminderScheduleId,
    String recurrence,
    String assignee) {

  public boolean hasAssignee() {
    return assignee != null && !assignee.isBlank();
  }
}
