package com.example.labjobs.service;

import com.example.labjobs.chat.ChatMessageContent;
import com.example.labjobs.config.LabJobsSchedulerProperties;
import com.example.labjobs.model.JobInstanceRecord;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Plain-text bodies for reminder and completion messages. */
@Component
@RequiredArgsConstructor
public class ReminderMessageFactory {

  private static final DateTimeFormatter DUE_FORMAT =
      DateTimeFormatter.ofPattern("EEEE, MMMM d, yyyy", Locale.US);

  private final LabJobsSchedulerProperties properties;

  public ChatMessageContent reminder(JobInstanceRecord instance) {
    final String text =
        "Lab job: "
            + instance.name()
            + "\nDue "
            + DUE_FORMAT.format(instance.dueAt().atZone(properties.zone()))
            + "\nIf you are unable to do your job this time, reassign it to someone who can after"
            + " confirming with them";
    return new ChatMessageContent(text, "Reminder: " + instance.name());
  }

  public ChatMessageContent completed(JobInstanceRecord instance) {
    return new ChatMessageContent(
        "Lab job: " + instance.name() + " complete!", "Lab job " + instance.name() + " complete!");
  }
}
