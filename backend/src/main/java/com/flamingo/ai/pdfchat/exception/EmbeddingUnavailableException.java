package com.flamingo.ai.pdfchat.exception;

/** Exception thrown when the embedding model cannot produce usable vectors. */
public class EmbeddingUnavailableException extends PipelineException {

  private static final String USER_MESSAGE =
      "Embedding service is unavailable. Please try again later.";

  public EmbeddingUnavailableException(String message) {
    super(ErrorCode.EMBEDDING_UNAVAILABLE, message, USER_MESSAGE);
  }

  public EmbeddingUnavailableException(String message, Throwable cause) {
    super(ErrorCode.EMBEDDING_UNAVAILABLE, message, USER_MESSAGE, cause);
  }
}
