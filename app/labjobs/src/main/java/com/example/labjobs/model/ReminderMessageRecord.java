/*
 * Where: Lab jobs domain model
 * What: Snapshot of a reminder_messages row
 * Why: Completion rewrites every message sent for an instance through its stored handle
 */
package com.example.labjobs.model;

import java.time.Instant;

public record ReminderMessageRecord(
    long messageRecordId,
    long instanceId,
    String channel,
    String messageId,
    Instant sentAt,
    Instant finalizedAt) {

  public boolean finalized() {
    return finalizedAt != null;
  }
}
