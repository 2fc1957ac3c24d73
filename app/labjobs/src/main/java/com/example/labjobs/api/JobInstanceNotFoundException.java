/*
 * Where: Lab jobs API
 * What: Unknown job instance id
 * Why: Mapped to a 404 response by ApiExceptionHandler
 */
package com.example.labjobs.api;

public class JobInstanceNotFoundException extends RuntimeException {
  public JobInstanceNotFoundException(long instanceId) {
    super("job instance not found: " + instanceId);
  }
}
