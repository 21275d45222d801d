package com.flamingo.ai.pdfchat.service.rag.generation;

import com.flamingo.ai.pdfchat.config.RagConfig;
import com.flamingo.ai.pdfchat.exception.GenerationExhaustedException;
import com.flamingo.ai.pdfchat.exception.LlmServiceException;
import com.flamingo.ai.pdfchat.service.rag.BackendCallExecutor;
import com.flamingo.ai.pdfchat.service.rag.model.ChatTurn;
import com.flamingo.ai.pdfchat.service.rag.model.RetrievedChunk;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Produces an answer from retrieved chunks by trying the configured backends in order.
 *
 * <p>Each backend gets the configured timeout and retry policy. A failed, timed-out or too-short
 * answer moves on to the next backend. When every backend fails, or none is available, the
 * {@link ExtractiveAnswerResponder} answers from the chunks directly, so this service never
 * throws for backend problems.
 */
@Service
@Slf4j
public class AnswerGenerationService {

  private final Map<String, GenerationBackend> backends;
  private final BackendCallExecutor backendCallExecutor;
  private final ResponseCleaner responseCleaner;
  private final ExtractiveAnswerResponder extractiveAnswerResponder;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  public AnswerGenerationService(
      List<GenerationBackend> backends,
      BackendCallExecutor backendCallExecutor,
      ResponseCleaner responseCleaner,
      ExtractiveAnswerResponder extractiveAnswerResponder,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    this.backends = new LinkedHashMap<>();
    for (GenerationBackend backend : backends) {
      this.backends.put(backend.name(), backend);
    }
    this.backendCallExecutor = backendCallExecutor;
    this.responseCleaner = responseCleaner;
    this.extractiveAnswerResponder = extractiveAnswerResponder;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Generates an answer.
   *
   * @param question the user question
   * @param chunks retrieved chunks in rank order
   * @param history prior turns, oldest first; only the most recent window is used
   * @param temperature sampling temperature
   * @param maxTokens output token limit
   * @return cleaned backend text, or an extractive answer when all backends fail
   */
  @Timed(value = "generation.generate", description = "Time to generate an answer")
  public String generate(
      String question,
      List<RetrievedChunk> chunks,
      List<ChatTurn> history,
      double temperature,
      int maxTokens) {
    GenerationRequest request =
        new GenerationRequest(
            question,
            ContextFormatter.format(chunks),
            recentHistory(history),
            temperature,
            maxTokens);

    List<String> attempted = new ArrayList<>();
    for (String name : ragConfig.getGeneration().getProviders()) {
      GenerationBackend backend = backends.get(name);
      if (backend == null) {
        log.warn("Unknown generation provider '{}' in rag.generation.providers, skipping", name);
        continue;
      }
      if (!backend.isAvailable()) {
        log.debug("Generation backend {} not configured, skipping", name);
        continue;
      }

      attempted.add(name);
      try {
        String answer = callBackend(backend, request);
        meterRegistry.counter("generation.backend.success", "backend", name).increment();
        log.info("Answer generated by {} ({} chars)", name, answer.length());
        return answer;
      } catch (InterruptedException e) {
        log.warn("Generation interrupted while calling {}", name);
        break;
      } catch (TimeoutException e) {
        recordFailure(name, "timed out after " + ragConfig.getGeneration().getTimeout());
      } catch (Exception e) {
        recordFailure(name, e.getMessage());
      }
    }

    GenerationExhaustedException exhausted = new GenerationExhaustedException(attempted);
    log.warn("{}; answering extractively", exhausted.getMessage());
    meterRegistry.counter("generation.fallback.extractive").increment();
    return extractiveAnswerResponder.respond(question, chunks);
  }

  /** Names of the configured providers that are currently available, in fallback order. */
  public List<String> availableBackends() {
    return ragConfig.getGeneration().getProviders().stream()
        .filter(name -> backends.containsKey(name) && backends.get(name).isAvailable())
        .toList();
  }

  private String callBackend(GenerationBackend backend, GenerationRequest request)
      throws Exception {
    return backendCallExecutor.call(
        "generation-" + backend.name(),
        ragConfig.getGeneration().getTimeout(),
        ragConfig.getGeneration().getRetry(),
        () -> {
          String cleaned = responseCleaner.clean(backend.generate(request));
          if (!responseCleaner.isUsable(cleaned)) {
            throw new LlmServiceException(
                backend.name(), "Response too short (" + cleaned.length() + " chars)");
          }
          return cleaned;
        });
  }

  private void recordFailure(String backend, String reason) {
    log.warn("Generation backend {} failed: {}", backend, reason);
    meterRegistry.counter("generation.backend.failure", "backend", backend).increment();
  }

  private List<ChatTurn> recentHistory(List<ChatTurn> history) {
    if (history == null || history.isEmpty()) {
      return List.of();
    }
    int window = Math.max(0, ragConfig.getGeneration().getHistoryWindow());
    return history.subList(Math.max(0, history.size() - window), history.size());
  }
}
