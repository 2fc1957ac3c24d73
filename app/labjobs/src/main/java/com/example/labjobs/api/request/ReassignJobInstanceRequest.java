/*
 * Where: Lab jobs API request DTO
 * What: Body of the one-off instance reassignment
 * Why: An open instance must always go to someone, so the assignee is required
 */
package com.example.labjobs.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReassignJobInstanceRequest(@NotBlank String assignee) {}
