/*
 * Where: Lab jobs service layer
 * What: User-initiated completion and reassignment
 * Why: Runs from HTTP requests concurrently with ticks, so every mutation is a guarded update
 */
package com.example.labjobs.service;

import com.example.labjobs.api.InvalidJobInstanceStateException;
import com.example.labjobs.api.JobInstanceNotFoundException;
import com.example.labjobs.api.JobTemplateNotFoundException;
import com.example.labjobs.model.JobInstanceRecord;
import com.example.labjobs.repository.JobInstanceRepository;
import com.example.labjobs.repository.JobTemplateRepository;
import com.example.labjobs.repository.ReassignmentRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class LabJobActionService {

  private static final Logger logger = LoggerFactory.getLogger(LabJobActionService.class);

  private final JobInstanceRepository instanceRepository;
  private final JobTemplateRepository templateRepository;
  private final ReassignmentRepository reassignmentRepository;
  private final ReminderNotificationTracker notificationTracker;
  private final PlatformTransactionManager transactionManager;
  private final Clock clock;

  /**
   * Marks the instance done and rewrites its reminder messages. Completing again re-runs the
   * rewrite: messages edited before stay claimed and are skipped, so only edits that failed earlier
   * are retried.
   */
  public CompletionResult complete(long instanceId) {
    instanceRepository
        .findById(instanceId)
        .orElseThrow(() -> new JobInstanceNotFoundException(instanceId));
    final Instant now = Instant.now(clock);
    final boolean alreadyDone = instanceRepository.markDone(instanceId, now) == 0;
    final JobInstanceRecord completed =
        instanceRepository
            .findById(instanceId)
            .orElseThrow(() -> new JobInstanceNotFoundException(instanceId));
    final ReminderNotificationTracker.FinalizeOutcome outcome =
        notificationTracker.finalizeInstance(completed);
    logger.info(
        "job instance completed instanceId={} alreadyDone={} edited={} failed={}",
        instanceId,
        alreadyDone,
        outcome.edited(),
        outcome.failed());
    return new CompletionResult(instanceId, alreadyDone, outcome.edited(), outcome.failed());
  }

  /** One-off reassignment of an open instance; the template keeps its assignee. */
  public JobInstanceRecord reassign(long instanceId, String assignee) {
    final String newAssignee = normalizeAssignee(assignee);
    final Instant now = Instant.now(clock);
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    final JobInstanceRecord updated =
        transactionTemplate.execute(
            status -> {
              final JobInstanceRecord current =
                  instanceRepository
                      .findByIdForUpdate(instanceId)
                      .orElseThrow(() -> new JobInstanceNotFoundException(instanceId));
              if (current.done() || instanceRepository.updateAssignee(instanceId, newAssignee) == 0) {
                throw new InvalidJobInstanceStateException(
                    "job instance already completed: " + instanceId);
              }
              reassignmentRepository.insert(instanceId, current.assignee(), newAssignee, now);
              return instanceRepository
                  .findById(instanceId)
                  .orElseThrow(() -> new JobInstanceNotFoundException(instanceId));
            });
    // messages already sent keep naming the previous assignee
    logger.info("job instance reassigned instanceId={} assignee={}", instanceId, newAssignee);
    return updated;
  }

  /** Changes who future instances go to. A blank assignee makes the template inert. */
  public void reassignTemplate(long templateId, String assignee) {
    final String newAssignee = normalizeAssignee(assignee);
    if (templateRepository.updateAssignee(templateId, newAssignee) == 0) {
      throw new JobTemplateNotFoundException(templateId);
    }
    logger.info("job template reassigned templateId={} assignee={}", templateId, newAssignee);
  }

  private static String normalizeAssignee(String assignee) {
    if (assignee == null || assignee.isBlank()) {
      return null;
    }
    return assignee.strip();
  }

  public record CompletionResult(long instanceId, boolean alreadyDone, int edited, int failed) {}
}
