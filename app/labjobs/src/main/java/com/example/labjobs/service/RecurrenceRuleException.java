package com.example.labjobs.service;

public class RecurrenceRuleException extends LabJobConfigurationException {

  public RecurrenceRuleException(String rule, Throwable cause) {
    super("invalid recurrence rule: " + rule, cause);
  }

  public RecurrenceRuleException(String rule, String reason) {
    super("invalid recurrence rule: " + rule + " (" + reason + ")");
  }
}
