package com.flamingo.ai.pdfchat.service.rag.generation;

import com.flamingo.ai.pdfchat.domain.enums.MessageRole;
import com.flamingo.ai.pdfchat.service.rag.model.ChatTurn;
import java.util.List;

/** Prompt texts shared by the generation backends. */
public final class PromptTemplates {

  public static final String SYSTEM_INSTRUCTION =
      "You are a helpful assistant that answers questions based on provided context. "
          + "Use only the information from the context to answer questions. "
          + "If the context does not contain the information needed, say that you don't have "
          + "enough information to answer.";

  private static final String KNOWLEDGE_PREAMBLE =
      String.join(
          "\n\n",
          "You are a chatbot who has some specific set of knowledge and you will be asked "
              + "questions on that given the knowledge.",
          "Don't make up information and don't answer until and unless you have knowledge to "
              + "back it. If the knowledge is insufficient, say so.",
          "Knowledge you have:",
          "%s");

  private PromptTemplates() {}

  /** User message for chat-completion backends. */
  public static String userMessage(String context, String question) {
    return "Context:\n" + context + "\n\nQuestion: " + question + "\n\nAnswer:";
  }

  /** Single prompt for prompt-completion backends; prior turns are rendered inline. */
  public static String completionPrompt(
      String context, String question, List<ChatTurn> history) {
    StringBuilder prompt = new StringBuilder();
    prompt.append(SYSTEM_INSTRUCTION).append("\n\n");
    prompt.append(
        "Based on the following context, please answer the question accurately and concisely.");
    prompt.append("\n\nContext:\n").append(context);
    if (!history.isEmpty()) {
      prompt.append("\n\nConversation so far:\n");
      for (ChatTurn turn : history) {
        prompt
            .append(turn.role() == MessageRole.USER ? "User: " : "Assistant: ")
            .append(turn.content())
            .append('\n');
      }
    }
    prompt.append("\n\nQuestion: ").append(question).append("\n\nAnswer:");
    return prompt.toString();
  }

  /** Preamble carrying the retrieved knowledge for single-message backends. */
  public static String knowledgePreamble(String context) {
    return String.format(KNOWLEDGE_PREAMBLE, context);
  }
}
