package com.flamingo.ai.pdfchat.service.rag.generation;

import com.flamingo.ai.pdfchat.domain.enums.MessageRole;
import com.flamingo.ai.pdfchat.exception.LlmServiceException;
import com.flamingo.ai.pdfchat.service.rag.model.ChatTurn;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Chat-completion backend over a LangChain4j {@link ChatModel}: system instruction, prior turns,
 * then the context and question as the final user message.
 */
@Slf4j
public class ChatModelGenerationBackend implements GenerationBackend {

  public static final String OPENAI = "openai";
  public static final String ANTHROPIC = "anthropic";
  public static final String OLLAMA = "ollama";

  private final String name;
  private final ChatModel chatModel;

  public ChatModelGenerationBackend(String name, ChatModel chatModel) {
    this.name = name;
    this.chatModel = chatModel;
  }

  /** A registered backend without a model, which the generator always skips. */
  public static ChatModelGenerationBackend unavailable(String name) {
    return new ChatModelGenerationBackend(name, null);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public boolean isAvailable() {
    return chatModel != null;
  }

  @Override
  public String generate(GenerationRequest request) {
    if (chatModel == null) {
      throw new LlmServiceException(name, "Backend " + name + " is not configured");
    }

    ChatRequest chatRequest =
        ChatRequest.builder()
            .messages(buildMessages(request))
            .temperature(request.temperature())
            .maxOutputTokens(request.maxTokens())
            .build();

    ChatResponse response;
    try {
      response = chatModel.chat(chatRequest);
    } catch (RuntimeException e) {
      throw new LlmServiceException(name, name + " call failed: " + e.getMessage(), e);
    }

    if (response == null || response.aiMessage() == null || response.aiMessage().text() == null) {
      throw new LlmServiceException(name, name + " returned an empty response");
    }
    return response.aiMessage().text().strip();
  }

  static List<ChatMessage> buildMessages(GenerationRequest request) {
    List<ChatMessage> messages = new ArrayList<>();
    messages.add(SystemMessage.from(PromptTemplates.SYSTEM_INSTRUCTION));
    for (ChatTurn turn : request.history()) {
      if (turn.role() == MessageRole.USER) {
        messages.add(UserMessage.from(turn.content()));
      } else if (turn.role() == MessageRole.ASSISTANT) {
        messages.add(AiMessage.from(turn.content()));
      }
    }
    messages.add(
        UserMessage.from(PromptTemplates.userMessage(request.context(), request.question())));
    return messages;
  }
}
