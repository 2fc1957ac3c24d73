package com.example.labjobs.api;

import com.example.labjobs.api.request.UpdateReminderScheduleRequest;
import com.example.labjobs.api.response.ReminderScheduleResponse;
import com.example.labjobs.model.ReminderScheduleRecord;
import com.example.labjobs.service.LabJobConfigurationService;
import com.example.labjobs.service.ReminderScheduleParser;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/labjobs/reminder-schedules")
@RequiredArgsConstructor
public class ReminderScheduleController {

  private final LabJobConfigurationService configurationService;
  private final ReminderScheduleParser scheduleParser;

  @GetMapping
  public ResponseEntity<List<ReminderScheduleResponse>> listSchedules() {
    return ResponseEntity.ok(
        configurationService.listSchedules().stream().map(this::toResponse).toList());
  }

  @PostMapping
  public ResponseEntity<ReminderScheduleResponse> createSchedule() {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(toResponse(configurationService.createSchedule()));
  }

  @PutMapping("/{scheduleId}")
  public ResponseEntity<ReminderScheduleResponse> updateSchedule(
      @PathVariable("scheduleId") long scheduleId,
      @RequestBody UpdateReminderScheduleRequest request) {
    return ResponseEntity.ok(
        toResponse(
            configurationService.updateSchedule(scheduleId, request.name(), request.reminders())));
  }

  @DeleteMapping("/{scheduleId}")
  public ResponseEntity<Void> deleteSchedule(@PathVariable("scheduleId") long scheduleId) {
    configurationService.deleteSchedule(scheduleId);
    return ResponseEntity.noContent().build();
  }

  private ReminderScheduleResponse toResponse(ReminderScheduleRecord record) {
    return new ReminderScheduleResponse(
        record.scheduleId(), record.name(), scheduleParser.format(record.steps()));
  }
}
