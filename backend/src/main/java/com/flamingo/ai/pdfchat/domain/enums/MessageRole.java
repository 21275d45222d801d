package com.flamingo.ai.pdfchat.domain.enums;

/** Defines the role of a chat message sender. */
public enum MessageRole {
  /** Message from the user. */
  USER,

  /** Message from the AI assistant. */
  ASSISTANT
}
