package com.example.labjobs.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.labjobs.chat.ChatClient;
import com.example.labjobs.chat.ChatDeliveryException;
import com.example.labjobs.chat.ChatMessageContent;
import com.example.labjobs.chat.ChatMessageHandle;
import com.example.labjobs.config.LabJobsSchedulerProperties;
import com.example.labjobs.model.JobInstanceRecord;
import com.example.labjobs.model.NotificationState;
import com.example.labjobs.model.ReminderMessageRecord;
import com.example.labjobs.repository.JobInstanceRepository;
import com.example.labjobs.repository.ReminderMessageRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class ReminderNotificationTrackerTest {

  private static final Instant NOW = Instant.parse("2026-01-12T15:00:00Z");
  private static final Instant DUE = Instant.parse("2026-01-12T14:00:00Z");
  private static final LabJobsSchedulerProperties PROPERTIES =
      new LabJobsSchedulerProperties(
          true, Duration.ofSeconds(30), ZoneId.of("America/New_York"), 9);

  @Mock private JobInstanceRepository instanceRepository;
  @Mock private ReminderMessageRepository messageRepository;
  @Mock private ChatClient chatClient;
  @Mock private LabJobMetrics metrics;

  private RecordingTransactionManager transactionManager;
  private ReminderNotificationTracker tracker;

  @BeforeEach
  void setUp() {
    transactionManager = new RecordingTransactionManager();
    tracker =
        new ReminderNotificationTracker(
            instanceRepository,
            messageRepository,
            chatClient,
            new ReminderMessageFactory(PROPERTIES),
            metrics,
            Clock.fixed(NOW, ZoneOffset.UTC),
            transactionManager);
  }

  @Test
  void sendPostsNewMessageAndRecordsItWithTheLastReminderAdvance() {
    when(instanceRepository.findById(10L)).thenReturn(Optional.of(open(10L)));
    when(chatClient.send(eq("U123"), any())).thenReturn(new ChatMessageHandle("D1", "m-1"));
    when(messageRepository.insert(10L, "D1", "m-1", NOW)).thenReturn(1L);
    when(instanceRepository.advanceLastReminder(10L, NOW)).thenReturn(1);

    assertThat(tracker.sendReminders(List.of(10L), NOW)).isEqualTo(1);

    assertThat(transactionManager.commits).isEqualTo(1);
    verify(metrics).recordReminder("sent");
    verify(chatClient, never()).edit(any(), any());
  }

  @Test
  void reminderTextNamesTheJobAndItsDueDay() {
    when(instanceRepository.findById(10L)).thenReturn(Optional.of(open(10L)));
    when(chatClient.send(eq("U123"), any())).thenReturn(new ChatMessageHandle("D1", "m-1"));
    when(instanceRepository.advanceLastReminder(10L, NOW)).thenReturn(1);

    tracker.sendReminders(List.of(10L), NOW);

    final ArgumentCaptor<ChatMessageContent> content =
        ArgumentCaptor.forClass(ChatMessageContent.class);
    verify(chatClient).send(eq("U123"), content.capture());
    assertThat(content.getValue().text())
        .startsWith("Lab job: Sweep floor\nDue Monday, January 12, 2026");
    assertThat(content.getValue().fallbackText()).isEqualTo("Reminder: Sweep floor");
  }

  @Test
  void sendFailureKeepsLastReminderSoTheNextTickFiresAgain() {
    when(instanceRepository.findById(10L)).thenReturn(Optional.of(open(10L)));
    when(instanceRepository.findById(11L)).thenReturn(Optional.of(open(11L)));
    when(chatClient.send(eq("U123"), any()))
        .thenThrow(new ChatDeliveryException("rate limited"))
        .thenReturn(new ChatMessageHandle("D1", "m-2"));
    when(instanceRepository.advanceLastReminder(11L, NOW)).thenReturn(1);

    assertThat(tracker.sendReminders(List.of(10L, 11L), NOW)).isEqualTo(1);

    verify(instanceRepository, never()).advanceLastReminder(10L, NOW);
    verify(messageRepository, never()).insert(eq(10L), any(), any(), any());
    verify(metrics).recordReminder("failed");
    verify(metrics).recordReminder("sent");
  }

  @Test
  void unknownDoneAndUnassignedInstancesAreSkipped() {
    when(instanceRepository.findById(1L)).thenReturn(Optional.empty());
    when(instanceRepository.findById(2L)).thenReturn(Optional.of(done(2L)));
    when(instanceRepository.findById(3L))
        .thenReturn(
            Optional.of(new JobInstanceRecord(3L, 1L, "Sweep floor", false, DUE, DUE, null, null, null)));

    assertThat(tracker.sendReminders(List.of(1L, 2L, 3L), NOW)).isZero();
    verify(chatClient, never()).send(any(), any());
  }

  @Test
  void storeFailureAfterSendPropagates() {
    when(instanceRepository.findById(10L)).thenReturn(Optional.of(open(10L)));
    when(chatClient.send(eq("U123"), any())).thenReturn(new ChatMessageHandle("D1", "m-1"));
    when(messageRepository.insert(10L, "D1", "m-1", NOW))
        .thenThrow(new DataAccessResourceFailureException("db down"));

    assertThatThrownBy(() -> tracker.sendReminders(List.of(10L), NOW))
        .isInstanceOf(DataAccessResourceFailureException.class);
    assertThat(transactionManager.rollbacks).isEqualTo(1);
  }

  @Test
  void messageSentWhileTheInstanceWasCompletedIsFinalizedImmediately() {
    when(instanceRepository.findById(10L))
        .thenReturn(Optional.of(open(10L)), Optional.of(done(10L)));
    when(chatClient.send(eq("U123"), any())).thenReturn(new ChatMessageHandle("D1", "m-1"));
    when(messageRepository.insert(10L, "D1", "m-1", NOW)).thenReturn(5L);
    when(instanceRepository.advanceLastReminder(10L, NOW)).thenReturn(0);
    when(messageRepository.findByInstanceId(10L)).thenReturn(List.of(message(5L, "m-1", null)));
    when(messageRepository.markFinalized(5L, NOW)).thenReturn(1);

    assertThat(tracker.sendReminders(List.of(10L), NOW)).isEqualTo(1);

    verify(chatClient).edit(eq(new ChatMessageHandle("D1", "m-1")), any());
    verify(metrics).recordReminder("late_finalized");
  }

  @Test
  void finalizeEditsEachRecordedMessageExactlyOnce() {
    when(messageRepository.findByInstanceId(10L))
        .thenReturn(
            List.of(message(1L, "m-1", null), message(2L, "m-2", null), message(3L, "m-3", null)));
    when(messageRepository.markFinalized(anyLong(), eq(NOW))).thenReturn(1);

    final ReminderNotificationTracker.FinalizeOutcome outcome = tracker.finalizeInstance(done(10L));

    assertThat(outcome).isEqualTo(new ReminderNotificationTracker.FinalizeOutcome(3, 0));
    final ArgumentCaptor<ChatMessageContent> content =
        ArgumentCaptor.forClass(ChatMessageContent.class);
    verify(chatClient, times(3)).edit(any(), content.capture());
    assertThat(content.getAllValues())
        .allSatisfy(value -> assertThat(value.text()).isEqualTo("Lab job: Sweep floor complete!"));
    verify(chatClient, never()).send(any(), any());
  }

  @Test
  void alreadyFinalizedOrClaimedMessagesAreNotEditedAgain() {
    when(messageRepository.findByInstanceId(10L))
        .thenReturn(List.of(message(1L, "m-1", NOW), message(2L, "m-2", null)));
    when(messageRepository.markFinalized(2L, NOW)).thenReturn(0);

    assertThat(tracker.finalizeInstance(done(10L)))
        .isEqualTo(new ReminderNotificationTracker.FinalizeOutcome(0, 0));
    verify(chatClient, never()).edit(any(), any());
  }

  @Test
  void failedEditReleasesItsClaimAndTheLoopContinues() {
    when(messageRepository.findByInstanceId(10L))
        .thenReturn(List.of(message(1L, "m-1", null), message(2L, "m-2", null)));
    when(messageRepository.markFinalized(anyLong(), eq(NOW))).thenReturn(1);
    doThrow(new ChatDeliveryException("message deleted"))
        .when(chatClient)
        .edit(eq(new ChatMessageHandle("D1", "m-1")), any());

    assertThat(tracker.finalizeInstance(done(10L)))
        .isEqualTo(new ReminderNotificationTracker.FinalizeOutcome(1, 1));
    verify(messageRepository).clearFinalized(1L);
    verify(messageRepository, never()).clearFinalized(2L);
    verify(metrics).recordFinalizeEdit("failed");
    verify(metrics).recordFinalizeEdit("edited");
  }

  @Test
  void secondFinalizeEditsOnlyTheMessageWhoseEditFailedBefore() {
    final ChatMessageHandle first = new ChatMessageHandle("D1", "m-1");
    final ChatMessageHandle second = new ChatMessageHandle("D1", "m-2");
    when(messageRepository.findByInstanceId(10L))
        .thenReturn(
            List.of(message(1L, "m-1", null), message(2L, "m-2", null)),
            List.of(message(1L, "m-1", null), message(2L, "m-2", NOW)));
    when(messageRepository.markFinalized(anyLong(), eq(NOW))).thenReturn(1);
    doThrow(new ChatDeliveryException("chat unavailable"))
        .doNothing()
        .when(chatClient)
        .edit(eq(first), any());

    assertThat(tracker.finalizeInstance(done(10L)))
        .isEqualTo(new ReminderNotificationTracker.FinalizeOutcome(1, 1));
    assertThat(tracker.finalizeInstance(done(10L)))
        .isEqualTo(new ReminderNotificationTracker.FinalizeOutcome(1, 0));

    verify(chatClient, times(2)).edit(eq(first), any());
    verify(chatClient, times(1)).edit(eq(second), any());
    verify(messageRepository, times(2)).markFinalized(1L, NOW);
    verify(messageRepository, times(1)).markFinalized(2L, NOW);
    verify(messageRepository).clearFinalized(1L);
  }

  @Test
  void stateFollowsRecordsAndDoneFlag() {
    when(messageRepository.countByInstanceId(10L)).thenReturn(0, 2);

    assertThat(tracker.stateOf(open(10L))).isEqualTo(NotificationState.SILENT);
    assertThat(tracker.stateOf(open(10L))).isEqualTo(NotificationState.REMINDING);
    assertThat(tracker.stateOf(done(10L))).isEqualTo(NotificationState.FINALIZED);
  }

  private static JobInstanceRecord open(long id) {
    return new JobInstanceRecord(id, 1L, "Sweep floor", false, DUE, DUE, 3L, "U123", null);
  }

  private static JobInstanceRecord done(long id) {
    return new JobInstanceRecord(id, 1L, "Sweep floor", true, DUE, DUE, 3L, "U123", NOW);
  }

  private static ReminderMessageRecord message(long id, String messageId, Instant finalizedAt) {
    return new ReminderMessageRecord(id, 10L, "D1", messageId, DUE, finalizedAt);
  }
}
