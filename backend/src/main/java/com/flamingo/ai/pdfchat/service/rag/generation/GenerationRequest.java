package com.flamingo.ai.pdfchat.service.rag.generation;

import com.flamingo.ai.pdfchat.service.rag.model.ChatTurn;
import java.util.List;

/**
 * Everything a backend needs to produce one answer.
 *
 * @param question the user question
 * @param context formatted retrieval context, see {@link ContextFormatter}
 * @param history prior turns, already cut to the history window
 * @param temperature sampling temperature
 * @param maxTokens output token limit
 */
public record GenerationRequest(
    String question, String context, List<ChatTurn> history, double temperature, int maxTokens) {

  public GenerationRequest {
    history = history == null ? List.of() : List.copyOf(history);
  }
}
