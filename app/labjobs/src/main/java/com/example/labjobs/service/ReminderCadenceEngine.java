/*
 * Where: Lab jobs service layer
 * What: Picks the open job instances that must be reminded now
 * Why: Reminder frequency escalates with how long an instance has been overdue
 */
package com.example.labjobs.service;

import com.example.labjobs.model.JobInstanceRecord;
import com.example.labjobs.model.ReminderScheduleRecord;
import com.example.labjobs.repository.JobInstanceRepository;
import com.example.labjobs.repository.ReminderScheduleRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ReminderCadenceEngine {

  private static final Logger logger = LoggerFactory.getLogger(ReminderCadenceEngine.class);

  private final JobInstanceRepository instanceRepository;
  private final ReminderScheduleRepository scheduleRepository;
  private final LabJobMetrics metrics;

  /**
   * Returns the instances to remind this tick: {@code newInstanceIds} first (a fresh instance gets
   * its first message right away), then every open, assigned instance whose cadence has elapsed.
   */
  public List<Long> selectDue(Instant now, List<Long> newInstanceIds) {
    final Set<Long> due = new LinkedHashSet<>(newInstanceIds);
    final Map<Long, ReminderCadence> cadences = loadCadences();
    final List<JobInstanceRecord> open = instanceRepository.findOpenAssigned();
    metrics.updateOpenInstances(open.size());
    for (JobInstanceRecord instance : open) {
      try {
        if (isDue(instance, cadenceFor(instance, cadences), now)) {
          due.add(instance.instanceId());
        }
      } catch (RuntimeException ex) {
        logger.warn("reminder cadence evaluation failed instanceId={}", instance.instanceId(), ex);
      }
    }
    return new ArrayList<>(due);
  }

  static boolean isDue(JobInstanceRecord instance, ReminderCadence cadence, Instant now) {
    // findOpenAssigned already filters these rows; the check holds for any row passed in
    if (instance.done() || !instance.hasAssignee()) {
      return false;
    }
    final Duration elapsedSinceDue = Duration.between(instance.dueAt(), now);
    final Duration sinceLastReminder = Duration.between(instance.lastReminderAt(), now);
    return cadence.shouldRemind(sinceLastReminder, elapsedSinceDue);
  }

  private ReminderCadence cadenceFor(JobInstanceRecord instance, Map<Long, ReminderCadence> cadences) {
    if (instance.reminderScheduleId() == null) {
      return ReminderCadence.NONE;
    }
    // a schedule deleted mid-tick behaves like no schedule at all
    return cadences.getOrDefault(instance.reminderScheduleId(), ReminderCadence.NONE);
  }

  private Map<Long, ReminderCadence> loadCadences() {
    final Map<Long, ReminderCadence> cadences = new HashMap<>();
    for (ReminderScheduleRecord schedule : scheduleRepository.findAll()) {
      cadences.put(schedule.scheduleId(), ReminderCadence.of(schedule.steps()));
    }
    return cadences;
  }
}
