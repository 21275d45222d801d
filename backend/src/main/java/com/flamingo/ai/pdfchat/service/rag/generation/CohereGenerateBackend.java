package com.flamingo.ai.pdfchat.service.rag.generation;

import com.flamingo.ai.pdfchat.exception.LlmServiceException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Prompt-completion backend over Cohere's generate endpoint. Opt-in via the provider list. */
@Component
@RequiredArgsConstructor
public class CohereGenerateBackend implements GenerationBackend {

  public static final String NAME = "cohere-generate";

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
    String prompt =
        PromptTemplates.completionPrompt(request.context(), request.question(), request.history());
    String text;
    try {
      text = cohereClient.generate(prompt, request.temperature(), request.maxTokens());
    } catch (RuntimeException e) {
      throw new LlmServiceException(NAME, "Cohere generate call failed: " + e.getMessage(), e);
    }
    if (text == null || text.isBlank()) {
      throw new LlmServiceException(NAME, "Cohere generate returned no generations");
    }
    return text.strip();
  }
}
