package com.example.labjobs.api;

import com.example.labjobs.api.request.ReassignJobTemplateRequest;
import com.example.labjobs.api.request.UpdateJobTemplateRequest;
import com.example.labjobs.api.response.JobTemplateResponse;
import com.example.labjobs.service.LabJobActionService;
import com.example.labjobs.service.LabJobConfigurationService;
import jakarta.validation.Valid;
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
@RequestMapping("/v1/labjobs/templates")
@RequiredArgsConstructor
public class LabJobTemplateController {

  private final LabJobConfigurationService configurationService;
  private final LabJobActionService actionService;

  @GetMapping
  public ResponseEntity<List<JobTemplateResponse>> listTemplates() {
    return ResponseEntity.ok(
        configurationService.listTemplates().stream().map(JobTemplateResponse::from).toList());
  }

  @PostMapping
  public ResponseEntity<JobTemplateResponse> createTemplate() {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(JobTemplateResponse.from(configurationService.createTemplate()));
  }

  @PutMapping("/{templateId}")
  public ResponseEntity<JobTemplateResponse> updateTemplate(
      @PathVariable("templateId") long templateId,
      @Valid @RequestBody UpdateJobTemplateRequest request) {
    return ResponseEntity.ok(
        JobTemplateResponse.from(
            configurationService.updateTemplate(
                templateId,
                request.name(),
                request.sortPriority(),
                request.assignee(),
                request.reminderScheduleId(),
                request.recurrence())));
  }

  @DeleteMapping("/{templateId}")
  public ResponseEntity<Void> deleteTemplate(@PathVariable("templateId") long templateId) {
    configurationService.deleteTemplate(templateId);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{templateId}/reassign")
  public ResponseEntity<Void> reassignTemplate(
      @PathVariable("templateId") long templateId,
      @RequestBody ReassignJobTemplateRequest request) {
    actionService.reassignTemplate(templateId, request.assignee());
    return ResponseEntity.noContent().build();
  }
}
