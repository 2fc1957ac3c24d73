package com.example.labjobs.api;

import com.example.labjobs.service.LabJobConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(LabJobConfigurationException.class)
  public ResponseEntity<ApiErrorResponse> handleConfiguration(LabJobConfigurationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("LABJOBS_INVALID_CONFIGURATION", ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("LABJOBS_VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler(JobInstanceNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleInstanceNotFound(JobInstanceNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("LABJOBS_INSTANCE_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(JobTemplateNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleTemplateNotFound(JobTemplateNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("LABJOBS_TEMPLATE_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(ReminderScheduleNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleScheduleNotFound(
      ReminderScheduleNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("LABJOBS_SCHEDULE_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(InvalidJobInstanceStateException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidState(InvalidJobInstanceStateException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse("LABJOBS_INVALID_INSTANCE_STATE", ex.getMessage()));
  }

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<ApiErrorResponse> handleDataAccess(DataAccessException ex) {
    logger.error("labjobs request failed on data access", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("LABJOBS_STORE_UNAVAILABLE", "job store unavailable"));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("labjobs request failed", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("LABJOBS_INTERNAL_ERROR", ex.getMessage()));
  }
}
