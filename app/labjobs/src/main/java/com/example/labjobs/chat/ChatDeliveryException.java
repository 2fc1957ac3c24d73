/*
 * Where: Lab jobs chat integration
 * What: Transient failure of a send or edit call
 * Why: Callers log and move on; the next tick retries because no state was advanced
 */
package com.example.labjobs.chat;

public class ChatDeliveryException extends RuntimeException {

  public ChatDeliveryException(String message) {
    super(message);
  }

  public ChatDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
