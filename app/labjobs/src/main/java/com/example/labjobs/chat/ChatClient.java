/*
 * Where: Lab jobs chat integration
 * What: The two calls the engine needs from a chat platform
 * Why: Keep the platform binding swappable and mockable in tests
 */
package com.example.labjobs.chat;

public interface ChatClient {

  /**
   * Posts a new message.
   *
   * @return handle usable to edit the message later
   * @throws ChatDeliveryException when the platform rejects or times out
   */
  ChatMessageHandle send(String destination, ChatMessageContent content);

  /** Rewrites an existing message in place. */
  void edit(ChatMessageHandle handle, ChatMessageContent content);
}
