package com.example.labjobs.service;

public class ReminderScheduleFormatException extends LabJobConfigurationException {

  public ReminderScheduleFormatException(String message) {
    super(message);
  }

  public ReminderScheduleFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
