/*
 * Where: Lab jobs domain model
 * What: Notification lifecycle of a job instance
 * Why: Completion must finalize messages exactly once; the state makes that visible
 */
package com.example.labjobs.model;

public enum NotificationState {
  /** No reminder has been sent yet. */
  SILENT,
  /** At least one reminder exists and the instance is still open. */
  REMINDING,
  /** The instance is done; its messages have been rewritten to the completed form. */
  FINALIZED
}
