/*
 * Where: Lab jobs service layer
 * What: Create, update, delete and list job templates and reminder schedules
 * Why: Bad recurrence rules and reminder notation are rejected at edit time instead of during a tick
 */
package com.example.labjobs.service;

import com.example.labjobs.api.JobTemplateNotFoundException;
import com.example.labjobs.api.ReminderScheduleNotFoundException;
import com.example.labjobs.model.JobInstanceRecord;
import com.example.labjobs.model.JobTemplateRecord;
import com.example.labjobs.model.ReminderScheduleRecord;
import com.example.labjobs.model.ReminderStep;
import com.example.labjobs.repository.JobInstanceRepository;
import com.example.labjobs.repository.JobTemplateRepository;
import com.example.labjobs.repository.ReminderScheduleRepository;
import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class LabJobConfigurationService {

  private static final Logger logger = LoggerFactory.getLogger(LabJobConfigurationService.class);

  static final String DEFAULT_NAME = "Unnamed";
  static final String DEFAULT_RECURRENCE = "FREQ=WEEKLY;INTERVAL=1;BYDAY=MO";
  static final LocalDate INITIAL_WATERMARK = LocalDate.of(1970, 1, 1);

  private final JobTemplateRepository templateRepository;
  private final JobInstanceRepository instanceRepository;
  private final ReminderScheduleRepository scheduleRepository;
  private final RecurrenceEvaluator recurrenceEvaluator;
  private final ReminderScheduleParser scheduleParser;
  private final LabJobMetrics metrics;

  /** New templates are inert until someone is assigned. */
  public JobTemplateRecord createTemplate() {
    final long templateId =
        templateRepository.insert(0, DEFAULT_NAME, INITIAL_WATERMARK, null, DEFAULT_RECURRENCE, null);
    logger.info("job template created templateId={}", templateId);
    return requireTemplate(templateId);
  }

  @Transactional
  public JobTemplateRecord updateTemplate(
      long templateId,
      String name,
      int sortPriority,
      String assignee,
      Long reminderScheduleId,
      String recurrence) {
    try {
      recurrenceEvaluator.validate(recurrence);
    } catch (LabJobConfigurationException ex) {
      metrics.recordConfigurationError("recurrence");
      throw ex;
    }
    if (reminderScheduleId != null && scheduleRepository.findById(reminderScheduleId).isEmpty()) {
      throw new ReminderScheduleNotFoundException(reminderScheduleId);
    }
    final String normalizedName = name == null || name.isBlank() ? DEFAULT_NAME : name.strip();
    final String normalizedAssignee = assignee == null || assignee.isBlank() ? null : assignee.strip();
    if (templateRepository.update(
            templateId,
            normalizedName,
            sortPriority,
            normalizedAssignee,
            reminderScheduleId,
            recurrence.strip())
        == 0) {
      throw new JobTemplateNotFoundException(templateId);
    }
    logger.info(
        "job template updated templateId={} assignee={} scheduleId={}",
        templateId,
        normalizedAssignee,
        reminderScheduleId);
    return requireTemplate(templateId);
  }

  /** Existing instances stay; their template reference becomes null. */
  public void deleteTemplate(long templateId) {
    if (templateRepository.delete(templateId) == 0) {
      throw new JobTemplateNotFoundException(templateId);
    }
    logger.info("job template deleted templateId={}", templateId);
  }

  public List<JobTemplateRecord> listTemplates() {
    return templateRepository.findAllOrdered();
  }

  public ReminderScheduleRecord createSchedule() {
    final long scheduleId = scheduleRepository.insert(DEFAULT_NAME);
    logger.info("reminder schedule created scheduleId={}", scheduleId);
    return requireSchedule(scheduleId);
  }

  /** Renames the schedule and replaces all of its steps in one transaction. */
  @Transactional
  public ReminderScheduleRecord updateSchedule(long scheduleId, String name, String remindersText) {
    final List<ReminderStep> steps;
    try {
      steps = scheduleParser.parse(remindersText);
    } catch (LabJobConfigurationException ex) {
      metrics.recordConfigurationError("reminder_schedule");
      throw ex;
    }
    final String normalizedName = name == null || name.isBlank() ? DEFAULT_NAME : name.strip();
    if (scheduleRepository.rename(scheduleId, normalizedName) == 0) {
      throw new ReminderScheduleNotFoundException(scheduleId);
    }
    scheduleRepository.replaceSteps(scheduleId, steps);
    logger.info(
        "reminder schedule updated scheduleId={} steps={}", scheduleId, scheduleParser.format(steps));
    return requireSchedule(scheduleId);
  }

  /** Templates and instances that used the schedule fall back to the implicit cadence. */
  public void deleteSchedule(long scheduleId) {
    if (scheduleRepository.delete(scheduleId) == 0) {
      throw new ReminderScheduleNotFoundException(scheduleId);
    }
    logger.info("reminder schedule deleted scheduleId={}", scheduleId);
  }

  public List<ReminderScheduleRecord> listSchedules() {
    return scheduleRepository.findAll();
  }

  public List<JobInstanceRecord> listOpenInstances() {
    return instanceRepository.findOpen();
  }

  private JobTemplateRecord requireTemplate(long templateId) {
    return templateRepository
        .findById(templateId)
        .orElseThrow(() -> new JobTemplateNotFoundException(templateId));
  }

  private ReminderScheduleRecord requireSchedule(long scheduleId) {
    return scheduleRepository
        .findById(scheduleId)
        .orElseThrow(() -> new ReminderScheduleNotFoundException(scheduleId));
  }
}
