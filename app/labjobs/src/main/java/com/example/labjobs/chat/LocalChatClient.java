/*
 * Where: Lab jobs chat integration
 * What: ChatClient that only logs
 * Why: Run the engine end to end without a real chat platform
 */
package com.example.labjobs.chat;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LocalChatClient implements ChatClient {

  private static final Logger logger = LoggerFactory.getLogger(LocalChatClient.class);

  @Override
  public ChatMessageHandle send(String destination, ChatMessageContent content) {
    final ChatMessageHandle handle = new ChatMessageHandle(destination, UUID.randomUUID().toString());
    logger.info(
        "chat message simulated send channel={} messageId={} text={}",
        handle.channel(),
        handle.messageId(),
        content.fallbackText());
    return handle;
  }

  @Override
  public void edit(ChatMessageHandle handle, ChatMessageContent content) {
    logger.info(
        "chat message simulated edit channel={} messageId={} text={}",
        handle.channel(),
        handle.messageId(),
        content.fallbackText());
  }
}
