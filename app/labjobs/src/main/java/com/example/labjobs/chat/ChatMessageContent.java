package com.example.labjobs.chat;

/**
 * Message body. {@code fallbackText} is what clients without rich rendering (and notifications) show.
 */
public record ChatMessageContent(String text, String fallbackText) {}
