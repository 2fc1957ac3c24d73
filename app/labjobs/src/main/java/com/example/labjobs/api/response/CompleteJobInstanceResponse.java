package com.example.labjobs.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CompleteJobInstanceResponse(
    long instanceId, boolean alreadyDone, int messagesEdited, int messagesFailed) {}
