package com.flamingo.ai.pdfchat.service.rag.generation;

/**
 * A text generation provider the {@link AnswerGenerationService} can fall back across.
 *
 * <p>Implementations make exactly one attempt per {@link #generate} call; timeouts and retries are
 * applied by the caller.
 */
public interface GenerationBackend {

  /** Provider name as listed in {@code rag.generation.providers}. */
  String name();

  /** Whether credentials or an enabled flag are present. Unavailable backends are skipped. */
  boolean isAvailable();

  /**
   * Produces raw answer text.
   *
   * @param request question, context and sampling parameters
   * @return the backend's text, before cleanup
   * @throws com.flamingo.ai.pdfchat.exception.LlmServiceException on any backend failure
   */
  String generate(GenerationRequest request);
}
