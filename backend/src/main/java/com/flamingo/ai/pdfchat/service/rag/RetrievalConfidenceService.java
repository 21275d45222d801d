package com.flamingo.ai.pdfchat.service.rag;

import com.flamingo.ai.pdfchat.service.rag.model.RetrievedChunk;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Scores how well the retrieved chunks support an answer and renders them as source citations.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrievalConfidenceService {

  static final double HIGH_AGREEMENT_MEAN = 0.8;
  static final int HIGH_AGREEMENT_MIN_CHUNKS = 3;
  static final double HIGH_AGREEMENT_BOOST = 1.1;

  private final MeterRegistry meterRegistry;

  /**
   * Mean similarity of the chunks, boosted by 10% (capped at 1.0) when at least three chunks
   * agree with a mean above 0.8. Rounded to two decimals; 0.0 for no chunks.
   *
   * @param chunks retrieved chunks
   * @return confidence in [0, 1]
   */
  public double calculateConfidence(List<RetrievedChunk> chunks) {
    if (chunks == null || chunks.isEmpty()) {
      return 0.0;
    }

    double mean = chunks.stream().mapToDouble(RetrievedChunk::similarity).average().orElse(0.0);
    double confidence = mean;
    if (chunks.size() >= HIGH_AGREEMENT_MIN_CHUNKS && mean > HIGH_AGREEMENT_MEAN) {
      confidence = Math.min(1.0, mean * HIGH_AGREEMENT_BOOST);
    }
    // Cosine can be negative when the threshold is configured below zero
    confidence = Math.max(0.0, Math.min(1.0, confidence));
    double rounded = Math.round(confidence * 100.0) / 100.0;

    meterRegistry.summary("rag.retrieval.confidence").record(rounded);
    log.debug("Confidence {} from {} chunks (mean similarity {})", rounded, chunks.size(), mean);
    return rounded;
  }

  /**
   * Renders {@code filename (Page p, Similarity: s)} per chunk in rank order.
   *
   * @param chunks retrieved chunks
   * @return one citation per chunk
   */
  public List<String> formatSources(List<RetrievedChunk> chunks) {
    return chunks.stream().map(RetrievalConfidenceService::formatSource).toList();
  }

  static String formatSource(RetrievedChunk chunk) {
    return String.format(
        Locale.ROOT,
        "%s (Page %d, Similarity: %.2f)",
        chunk.fileName(),
        chunk.pageNumber(),
        chunk.similarity());
  }
}
