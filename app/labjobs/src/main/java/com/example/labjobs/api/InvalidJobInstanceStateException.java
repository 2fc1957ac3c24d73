/*
 * Where: Lab jobs API
 * What: Action not allowed in the instance's current state
 * Why: Reassigning a completed instance is answered with 409
 */
package com.example.labjobs.api;

public class InvalidJobInstanceStateException extends RuntimeException {
  public InvalidJobInstanceStateException(String message) {
    super(message);
  }
}
