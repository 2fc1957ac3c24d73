/*
 * Where: Lab jobs service layer
 * What: Sends reminder messages, records their handles, and rewrites them when a job is completed
 * Why: Later state changes must edit the messages already sent instead of posting duplicates
 */
package com.example.labjobs.service;

import com.example.labjobs.chat.ChatClient;
import com.example.labjobs.chat.ChatDeliveryException;
import com.example.labjobs.chat.ChatMessageContent;
import com.example.labjobs.chat.ChatMessageHandle;
import com.example.labjobs.model.JobInstanceRecord;
import com.example.labjobs.model.NotificationState;
import com.example.labjobs.model.ReminderMessageRecord;
import com.example.labjobs.repository.JobInstanceRepository;
import com.example.labjobs.repository.ReminderMessageRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Notification lifecycle of a job instance.
 *
 * <pre>
 * SILENT --reminder--> REMINDING --reminder--> REMINDING
 *   |                      |
 *   +------complete--------+--> FINALIZED
 * </pre>
 *
 * Every reminder is a new message; completion edits all of them in place.
 */
@Service
@RequiredArgsConstructor
public class ReminderNotificationTracker {

  private static final Logger logger = LoggerFactory.getLogger(ReminderNotificationTracker.class);

  private final JobInstanceRepository instanceRepository;
  private final ReminderMessageRepository messageRepository;
  private final ChatClient chatClient;
  private final ReminderMessageFactory messageFactory;
  private final LabJobMetrics metrics;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  /**
   * Sends one reminder per id. Chat failures are logged per instance and do not stop the loop.
   *
   * @return number of reminders sent and recorded
   * @throws DataAccessException when a send succeeded but could not be recorded
   */
  public int sendReminders(List<Long> instanceIds, Instant now) {
    int sent = 0;
    for (Long instanceId : instanceIds) {
      if (sendReminder(instanceId, now)) {
        sent++;
      }
    }
    return sent;
  }

  boolean sendReminder(long instanceId, Instant now) {
    final Optional<JobInstanceRecord> found = instanceRepository.findById(instanceId);
    if (found.isEmpty()) {
      logger.warn("reminder skipped for unknown instance instanceId={}", instanceId);
      return false;
    }
    final JobInstanceRecord instance = found.get();
    if (instance.done() || !instance.hasAssignee()) {
      logger.debug("reminder skipped instanceId={} done={}", instanceId, instance.done());
      return false;
    }
    final ChatMessageHandle handle;
    try {
      handle = chatClient.send(instance.assignee(), messageFactory.reminder(instance));
    } catch (ChatDeliveryException ex) {
      // last_reminder_at stays put, so the next tick fires again
      metrics.recordReminder("failed");
      logger.warn(
          "reminder send failed instanceId={} assignee={}", instanceId, instance.assignee(), ex);
      return false;
    }
    final boolean stillOpen;
    try {
      stillOpen = recordSent(instanceId, handle, now);
    } catch (DataAccessException ex) {
      logger.error(
          "reminder sent but not recorded instanceId={} channel={} messageId={}",
          instanceId,
          handle.channel(),
          handle.messageId(),
          ex);
      throw ex;
    }
    metrics.recordReminder("sent");
    logger.info(
        "reminder sent instanceId={} channel={} messageId={}",
        instanceId,
        handle.channel(),
        handle.messageId());
    if (!stillOpen) {
      // completed between our read and our write; the finalizer did not see this message
      finalizeLateMessage(instanceId);
    }
    return true;
  }

  /**
   * Rewrites every recorded message of a completed instance. A message is claimed (marked
   * finalized) before it is edited, so concurrent finalizers never edit the same message twice;
   * a failed edit releases the claim and is logged.
   */
  public FinalizeOutcome finalizeInstance(JobInstanceRecord instance) {
    final ChatMessageContent content = messageFactory.completed(instance);
    int edited = 0;
    int failed = 0;
    for (ReminderMessageRecord message : messageRepository.findByInstanceId(instance.instanceId())) {
      if (message.finalized()
          || messageRepository.markFinalized(message.messageRecordId(), Instant.now(clock)) == 0) {
        continue;
      }
      try {
        chatClient.edit(new ChatMessageHandle(message.channel(), message.messageId()), content);
      } catch (ChatDeliveryException ex) {
        messageRepository.clearFinalized(message.messageRecordId());
        failed++;
        metrics.recordFinalizeEdit("failed");
        logger.warn(
            "completion edit failed instanceId={} channel={} messageId={}",
            instance.instanceId(),
            message.channel(),
            message.messageId(),
            ex);
        continue;
      }
      metrics.recordFinalizeEdit("edited");
      edited++;
    }
    return new FinalizeOutcome(edited, failed);
  }

  public Optional<NotificationState> stateOf(long instanceId) {
    return instanceRepository.findById(instanceId).map(this::stateOf);
  }

  public NotificationState stateOf(JobInstanceRecord instance) {
    if (instance.done()) {
      return NotificationState.FINALIZED;
    }
    return messageRepository.countByInstanceId(instance.instanceId()) == 0
        ? NotificationState.SILENT
        : NotificationState.REMINDING;
  }

  // Record and last_reminder_at advance commit together; false when the instance is already done
  private boolean recordSent(long instanceId, ChatMessageHandle handle, Instant now) {
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    final Boolean open =
        transactionTemplate.execute(
            status -> {
              messageRepository.insert(instanceId, handle.channel(), handle.messageId(), now);
              return instanceRepository.advanceLastReminder(instanceId, now) > 0;
            });
    return Boolean.TRUE.equals(open);
  }

  private void finalizeLateMessage(long instanceId) {
    metrics.recordReminder("late_finalized");
    instanceRepository.findById(instanceId).ifPresent(this::finalizeInstance);
  }

  public record FinalizeOutcome(int edited, int failed) {}
}
