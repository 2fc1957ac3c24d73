package com.example.labjobs.model;

import java.time.Instant;

public record ReassignmentRecord(
    long reassignmentId,
    long instanceId,
    String previousAssignee,
    String newAssignee,
    Instant reassignedAt) {}
