/*
 * Where: Lab jobs API
 * What: Unknown reminder schedule id
 * Why: Mapped to a 404 response by ApiExceptionHandler
 */
package com.example.labjobs.api;

public class ReminderScheduleNotFoundException extends RuntimeException {
  public ReminderScheduleNotFoundException(long scheduleId) {
    super("reminder schedule not found: " + scheduleId);
  }
}
