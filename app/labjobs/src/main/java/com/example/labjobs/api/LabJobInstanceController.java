/*
 * Where: Lab jobs API
 * What: Complete, reassign and list job instances
 * Why: The buttons in chat messages and the home view call these endpoints
 */
package com.example.labjobs.api;

import com.example.labjobs.api.request.ReassignJobInstanceRequest;
import com.example.labjobs.api.response.CompleteJobInstanceResponse;
import com.example.labjobs.api.response.JobInstanceResponse;
import com.example.labjobs.service.LabJobActionService;
import com.example.labjobs.service.LabJobConfigurationService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/labjobs/instances")
@RequiredArgsConstructor
public class LabJobInstanceController {

  private final LabJobActionService actionService;
  private final LabJobConfigurationService configurationService;

  @GetMapping
  public ResponseEntity<List<JobInstanceResponse>> listOpenInstances() {
    return ResponseEntity.ok(
        configurationService.listOpenInstances().stream().map(JobInstanceResponse::from).toList());
  }

  @PostMapping("/{instanceId}/complete")
  public ResponseEntity<CompleteJobInstanceResponse> complete(
      @PathVariable("instanceId") long instanceId) {
    final LabJobActionService.CompletionResult result = actionService.complete(instanceId);
    return ResponseEntity.ok(
        new CompleteJobInstanceResponse(
            result.instanceId(), result.alreadyDone(), result.edited(), result.failed()));
  }

  @PostMapping("/{instanceId}/reassign")
  public ResponseEntity<JobInstanceResponse> reassign(
      @PathVariable("instanceId") long instanceId,
      @Valid @RequestBody ReassignJobInstanceRequest request) {
    return ResponseEntity.ok(
        JobInstanceResponse.from(actionService.reassign(instanceId, request.assignee())));
  }
}
