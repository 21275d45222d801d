package com.flamingo.ai.pdfchat.exception;

/** Exception thrown when a single generation backend call fails. */
public class LlmServiceException extends RuntimeException {

  private final String backend;

  public LlmServiceException(String backend, String message) {
    super(message);
    this.backend = backend;
  }

  public LlmServiceException(String backend, String message, Throwable cause) {
    super(message, cause);
    this.backend = backend;
  }

  public String getBackend() {
    return backend;
  }
}
