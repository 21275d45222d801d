package com.flamingo.ai.pdfchat.service.rag.embedding;

import com.flamingo.ai.pdfchat.config.RagConfig;
import com.flamingo.ai.pdfchat.exception.EmbeddingUnavailableException;
import com.flamingo.ai.pdfchat.exception.ValidationException;
import com.flamingo.ai.pdfchat.service.rag.BackendCallExecutor;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Service for turning chunks and queries into fixed-dimension vectors.
 *
 * <p>Failures are never masked: an unreachable model, a timeout, a short result list or a vector of
 * the wrong size all raise {@link EmbeddingUnavailableException}, so an ingest fails as a whole and
 * a query reports a clear error instead of empty results.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  private final EmbeddingModel embeddingModel;
  private final BackendCallExecutor backendCallExecutor;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a single text (typically a query).
   *
   * @param text non-blank text
   * @return embedding vector of {@link #dimension()} floats
   */
  @Timed(value = "embedding.embed", description = "Time to embed a single text")
  public float[] embed(String text) {
    requireText(text, 0);
    log.debug("embed called, input length: {} chars", text.length());

    Response<Embedding> response = invoke("embed", () -> embeddingModel.embed(text));
    if (response == null || response.content() == null) {
      throw failure("Embedding model returned no vector");
    }

    float[] vector = checkDimension(response.content().vector(), 0);
    meterRegistry.counter("embedding.requests.success", "type", "single").increment();
    return vector;
  }

  /**
   * Embeds texts in order, split into sub-batches of the configured size.
   *
   * @param texts non-blank texts
   * @return one vector per input text, in input order
   */
  @Timed(value = "embedding.embedBatch", description = "Time to embed batch")
  public List<float[]> embedBatch(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    for (int i = 0; i < texts.size(); i++) {
      requireText(texts.get(i), i);
    }

    int batchSize = Math.max(1, ragConfig.getEmbedding().getBatchSize());
    List<float[]> results = new ArrayList<>(texts.size());

    for (int from = 0; from < texts.size(); from += batchSize) {
      int to = Math.min(from + batchSize, texts.size());
      List<TextSegment> segments =
          texts.subList(from, to).stream().map(TextSegment::from).toList();

      Response<List<Embedding>> response =
          invoke("embedBatch", () -> embeddingModel.embedAll(segments));
      List<Embedding> embeddings = response != null ? response.content() : null;
      if (embeddings == null || embeddings.size() != segments.size()) {
        throw failure(
            String.format(
                "Embedding generation failed: expected %d vectors, got %d",
                segments.size(), embeddings == null ? 0 : embeddings.size()));
      }

      for (int i = 0; i < embeddings.size(); i++) {
        results.add(checkDimension(embeddings.get(i).vector(), from + i));
      }
    }

    meterRegistry.counter("embedding.requests.success", "type", "batch").increment();
    log.debug("Embedded {} texts in batches of {}", texts.size(), batchSize);
    return results;
  }

  /** Dimensionality every vector produced by this service has. */
  public int dimension() {
    return ragConfig.getVectorStore().getDimensions();
  }

  /** Human-readable model identifier for status reports. */
  public String describeModel() {
    return embeddingModel.getClass().getSimpleName();
  }

  private <T> T invoke(String operation, Callable<T> call) {
    try {
      return backendCallExecutor.call(
          "embedding-" + operation,
          ragConfig.getEmbedding().getTimeout(),
          ragConfig.getEmbedding().getRetry(),
          call);
    } catch (EmbeddingUnavailableException e) {
      throw e;
    } catch (Exception e) {
      log.error("Embedding {} failed: {}", operation, e.getMessage());
      meterRegistry.counter("embedding.requests.failure", "type", operation).increment();
      throw new EmbeddingUnavailableException("Embedding model unavailable: " + e.getMessage(), e);
    }
  }

  private float[] checkDimension(float[] vector, int position) {
    int expected = dimension();
    if (vector == null || vector.length != expected) {
      throw failure(
          String.format(
              "Embedding %d has dimension %d, expected %d",
              position, vector == null ? 0 : vector.length, expected));
    }
    return vector;
  }

  private EmbeddingUnavailableException failure(String message) {
    log.error(message);
    meterRegistry.counter("embedding.requests.failure", "type", "invalid").increment();
    return new EmbeddingUnavailableException(message);
  }

  private static void requireText(String text, int position) {
    if (text == null || text.isBlank()) {
      throw new ValidationException("Cannot embed blank text at position " + position);
    }
  }
}
