package com.flamingo.ai.pdfchat.service.rag.model;

import com.flamingo.ai.pdfchat.domain.enums.MessageRole;

/** One prior message of the conversation, passed along with a question. */
public record ChatTurn(MessageRole role, String content) {

  public static ChatTurn user(String content) {
    return new ChatTurn(MessageRole.USER, content);
  }

  public static ChatTurn assistant(String content) {
    return new ChatTurn(MessageRole.ASSISTANT, content);
  }
}
