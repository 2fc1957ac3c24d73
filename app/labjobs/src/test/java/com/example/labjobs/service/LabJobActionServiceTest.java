package com.example.labjobs.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.labjobs.api.InvalidJobInstanceStateException;
import com.example.labjobs.api.JobInstanceNotFoundException;
import com.example.labjobs.api.JobTemplateNotFoundException;
import com.example.labjobs.model.JobInstanceRecord;
import com.example.labjobs.repository.JobInstanceRepository;
import com.example.labjobs.repository.JobTemplateRepository;
import com.example.labjobs.repository.ReassignmentRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LabJobActionServiceTest {

  private static final Instant NOW = Instant.parse("2026-01-13T16:00:00Z");
  private static final Instant DUE = Instant.parse("2026-01-12T15:00:00Z");

  @Mock private JobInstanceRepository instanceRepository;
  @Mock private JobTemplateRepository templateRepository;
  @Mock private ReassignmentRepository reassignmentRepository;
  @Mock private ReminderNotificationTracker notificationTracker;

  private RecordingTransactionManager transactionManager;
  private LabJobActionService service;

  @BeforeEach
  void setUp() {
    transactionManager = new RecordingTransactionManager();
    service =
        new LabJobActionService(
            instanceRepository,
            templateRepository,
            reassignmentRepository,
            notificationTracker,
            transactionManager,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void completeMarksDoneAndFinalizesMessages() {
    final JobInstanceRecord completed = instance(true, "U123");
    when(instanceRepository.findById(10L))
        .thenReturn(Optional.of(instance(false, "U123")), Optional.of(completed));
    when(instanceRepository.markDone(10L, NOW)).thenReturn(1);
    when(notificationTracker.finalizeInstance(completed))
        .thenReturn(new ReminderNotificationTracker.FinalizeOutcome(2, 1));

    final LabJobActionService.CompletionResult result = service.complete(10L);

    assertThat(result).isEqualTo(new LabJobActionService.CompletionResult(10L, false, 2, 1));
  }

  @Test
  void completingTwiceEditsNothingTheSecondTime() {
    final JobInstanceRecord completed = instance(true, "U123");
    when(instanceRepository.findById(10L)).thenReturn(Optional.of(completed));
    when(instanceRepository.markDone(10L, NOW)).thenReturn(0);
    when(notificationTracker.finalizeInstance(completed))
        .thenReturn(new ReminderNotificationTracker.FinalizeOutcome(0, 0));

    final LabJobActionService.CompletionResult result = service.complete(10L);

    assertThat(result).isEqualTo(new LabJobActionService.CompletionResult(10L, true, 0, 0));
  }

  @Test
  void repeatedCompletionRetriesEditsThatFailedBefore() {
    final JobInstanceRecord completed = instance(true, "U123");
    when(instanceRepository.findById(10L))
        .thenReturn(Optional.of(instance(false, "U123")), Optional.of(completed));
    when(instanceRepository.markDone(10L, NOW)).thenReturn(1, 0);
    when(notificationTracker.finalizeInstance(completed))
        .thenReturn(
            new ReminderNotificationTracker.FinalizeOutcome(1, 1),
            new ReminderNotificationTracker.FinalizeOutcome(1, 0));

    final LabJobActionService.CompletionResult first = service.complete(10L);
    final LabJobActionService.CompletionResult second = service.complete(10L);

    assertThat(first).isEqualTo(new LabJobActionService.CompletionResult(10L, false, 1, 1));
    assertThat(second).isEqualTo(new LabJobActionService.CompletionResult(10L, true, 1, 0));
    verify(notificationTracker, times(2)).finalizeInstance(completed);
  }

  @Test
  void completeUnknownInstanceIsNotFound() {
    when(instanceRepository.findById(99L)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.complete(99L))
        .isInstanceOf(JobInstanceNotFoundException.class);
    verify(instanceRepository, never()).markDone(anyLong(), any());
  }

  @Test
  void reassignChangesAssigneeAndRecordsTheChange() {
    when(instanceRepository.findByIdForUpdate(10L))
        .thenReturn(Optional.of(instance(false, "U123")));
    when(instanceRepository.updateAssignee(10L, "U456")).thenReturn(1);
    when(instanceRepository.findById(10L)).thenReturn(Optional.of(instance(false, "U456")));

    final JobInstanceRecord updated = service.reassign(10L, " U456 ");

    assertThat(updated.assignee()).isEqualTo("U456");
    verify(reassignmentRepository).insert(10L, "U123", "U456", NOW);
    assertThat(transactionManager.commits).isEqualTo(1);
    verifyNoInteractions(notificationTracker);
  }

  @Test
  void reassigningCompletedInstanceIsRejected() {
    when(instanceRepository.findByIdForUpdate(10L)).thenReturn(Optional.of(instance(true, "U123")));

    assertThatThrownBy(() -> service.reassign(10L, "U456"))
        .isInstanceOf(InvalidJobInstanceStateException.class);
    verify(instanceRepository, never()).updateAssignee(anyLong(), any());
    verifyNoInteractions(reassignmentRepository);
    assertThat(transactionManager.rollbacks).isEqualTo(1);
  }

  @Test
  void reassignTemplateWithBlankAssigneeMakesItInert() {
    when(templateRepository.updateAssignee(5L, null)).thenReturn(1);

    service.reassignTemplate(5L, "  ");

    verify(templateRepository).updateAssignee(5L, null);
  }

  @Test
  void reassignUnknownTemplateIsNotFound() {
    when(templateRepository.updateAssignee(5L, "U1")).thenReturn(0);

    assertThatThrownBy(() -> service.reassignTemplate(5L, "U1"))
        .isInstanceOf(JobTemplateNotFoundException.class);
  }

  private static JobInstanceRecord instance(boolean done, String assignee) {
    return new JobInstanceRecord(
        10L, 1L, "Sweep floor", done, DUE, DUE, 3L, assignee, done ? NOW : null);
  }
}
