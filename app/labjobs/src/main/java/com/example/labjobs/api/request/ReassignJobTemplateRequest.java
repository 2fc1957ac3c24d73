package com.example.labjobs.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** A null or blank assignee leaves the template without anyone, which stops new instances. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReassignJobTemplateRequest(String assignee) {}
