package com.flamingo.ai.pdfchat.service.rag.generation;

import com.flamingo.ai.pdfchat.domain.enums.MessageRole;
import com.flamingo.ai.pdfchat.exception.LlmServiceException;
import com.flamingo.ai.pdfchat.service.rag.generation.CohereClient.CohereChatTurn;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Single-message backend over Cohere chat. Retrieved knowledge goes in the preamble and the
 * question is the message.
 */
@Component
@RequiredArgsConstructor
public class CohereChatBackend implements GenerationBackend {

  public static final String NAME = "cohere-chat";

  private final CohereClient cohereClient;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean isAvailable() {
    return cohereClient.isConfigured();
  }

  @Override
  public String generate(GenerationRequest request) {
    List<CohereChatTurn> history =
        request.history().stream()
            .map(
                turn ->
                    new CohereChatTurn(
                        turn.role() == MessageRole.USER ? "USER" : "CHATBOT", turn.content()))
            .toList();

    String text;
    try {
      text =
          cohereClient.chat(
              request.question(),
              PromptTemplates.knowledgePreamble(request.context()),
              history,
              request.temperature(),
              request.maxTokens());
    } catch (RuntimeException e) {
      throw new LlmServiceException(NAME, "Cohere chat call failed: " + e.getMessage(), e);
    }
    if (text == null || text.isBlank()) {
      throw new LlmServiceException(NAME, "Cohere chat returned an empty response");
    }
    return text.strip();
  }
}
