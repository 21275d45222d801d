package com.flamingo.ai.pdfchat.service.pipeline.dto;

import com.flamingo.ai.pdfchat.service.rag.model.ChatTurn;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A question about the indexed documents. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AskRequest {

  public static final double DEFAULT_TEMPERATURE = 0.7;
  public static final int DEFAULT_MAX_TOKENS = 500;

  private String message;

  /** Restricts retrieval to one document. If null, all documents are searched. */
  private String documentId;

  /** Prior turns, oldest first. */
  @Builder.Default private List<ChatTurn> history = new ArrayList<>();

  @Builder.Default private double temperature = DEFAULT_TEMPERATURE;

  @Builder.Default private int maxTokens = DEFAULT_MAX_TOKENS;
}
