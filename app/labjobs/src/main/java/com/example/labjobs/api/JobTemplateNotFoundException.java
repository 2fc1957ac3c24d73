/*
 * Where: Lab jobs API
 * What: Unknown job template id
 * Why: Mapped to a 404 response by ApiExceptionHandler
 */
package com.example.labjobs.api;

public class JobTemplateNotFoundException extends RuntimeException {
  public JobTemplateNotFoundException(long templateId) {
    super("job template not found: " + templateId);
  }
}
