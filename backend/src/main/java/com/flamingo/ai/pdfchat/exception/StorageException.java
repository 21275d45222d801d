package com.flamingo.ai.pdfchat.exception;

/** Exception thrown when the vector index cannot be read or written. */
public class StorageException extends PipelineException {

  private static final String USER_MESSAGE = "Failed to store document embeddings";

  public StorageException(String message) {
    super(ErrorCode.STORAGE_FAILURE, message, USER_MESSAGE);
  }

  public StorageException(String message, Throwable cause) {
    super(ErrorCode.STORAGE_FAILURE, message, USER_MESSAGE, cause);
  }
}
