package com.example.labjobs.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** {@code reminders} uses the "threshold=interval; ..." notation, e.g. "0s=1d; 2d=12h". */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UpdateReminderScheduleRequest(String name, String reminders) {}
