package com.example.labjobs.chat;

/** Identifies a posted message: the channel it landed in and the platform's message id. */
public record ChatMessageHandle(String channel, String messageId) {}
