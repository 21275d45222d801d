package com.flamingo.ai.pdfchat.exception;

import java.util.List;

/** Raised when no configured generation backend produced an answer. */
public class GenerationExhaustedException extends RuntimeException {

  private final List<String> attemptedBackends;

  public GenerationExhaustedException(List<String> attemptedBackends) {
    super(
        attemptedBackends.isEmpty()
            ? "No generation backend configured"
            : "All generation backends failed: " + attemptedBackends);
    this.attemptedBackends = List.copyOf(attemptedBackends);
  }

  public List<String> getAttemptedBackends() {
    return attemptedBackends;
  }
}
