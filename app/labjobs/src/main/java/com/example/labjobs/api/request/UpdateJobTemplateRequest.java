/*
 * Where: Lab jobs API request DTO
 * What: Full replacement of a job template's editable fields
 * Why: The recurrence rule is validated by the service before anything is stored
 */
package com.example.labjobs.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UpdateJobTemplateRequest(
    String name,
    @NotNull Integer sortPriority,
    String assignee,
    Long reminderScheduleId,
    @NotBlank String recurrence) {}
