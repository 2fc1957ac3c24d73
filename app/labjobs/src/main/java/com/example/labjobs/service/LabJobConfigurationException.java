/*
 * Where: Lab jobs service layer
 * What: Base type for configuration errors (bad recurrence rules, malformed reminder schedules)
 * Why: These never resolve by retrying; they are surfaced to whoever edits the configuration
 */
package com.example.labjobs.service;

public class LabJobConfigurationException extends RuntimeException {

  public LabJobConfigurationException(String message) {
    super(message);
  }

  public LabJobConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
