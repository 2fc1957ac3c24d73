/*
 * Where: Lab jobs API response DTO
 * What: A reminder schedule with its steps rendered back into edit notation
 * Why: The editor round-trips the same text it submitted
 */
package com.example.labjobs.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReminderScheduleResponse(long scheduleId, String name, String reminders) {}
