package com.flamingo.ai.pdfchat.vectorstore;

import com.flamingo.ai.pdfchat.config.RagConfig;
import com.flamingo.ai.pdfchat.exception.ValidationException;
import com.flamingo.ai.pdfchat.service.rag.model.DocumentChunk;
import com.flamingo.ai.pdfchat.service.rag.model.RetrievedChunk;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Validation and ranking shared by the {@link VectorIndex} implementations. */
public abstract class AbstractVectorIndex implements VectorIndex {

  protected final RagConfig ragConfig;

  protected AbstractVectorIndex(RagConfig ragConfig) {
    this.ragConfig = ragConfig;
  }

  protected int dimensions() {
    return ragConfig.getVectorStore().getDimensions();
  }

  protected double similarityThreshold() {
    return ragConfig.getRetrieval().getSimilarityThreshold();
  }

  protected void validateBatch(List<DocumentChunk> chunks, List<float[]> vectors) {
    if (chunks.size() != vectors.size()) {
      throw new ValidationException(
          String.format(
              "Chunk/vector count mismatch: %d chunks, %d vectors", chunks.size(), vectors.size()));
    }
    for (int i = 0; i < vectors.size(); i++) {
      validateVector(vectors.get(i), "vector " + i);
    }
  }

  protected void validateVector(float[] vector, String label) {
    if (vector == null || vector.length != dimensions()) {
      throw new ValidationException(
          String.format(
              "Dimension mismatch for %s: expected %d, got %d",
              label, dimensions(), vector == null ? 0 : vector.length));
    }
  }

  protected void validateK(int k) {
    if (k <= 0) {
      throw new ValidationException("k must be positive: " + k);
    }
  }

  /**
   * Applies the threshold, orders by similarity (ties by insertion sequence) and assigns ranks.
   */
  protected List<RetrievedChunk> rank(List<Candidate> candidates, int k) {
    double threshold = similarityThreshold();
    List<Candidate> kept =
        candidates.stream()
            .filter(c -> c.similarity() >= threshold)
            .sorted(
                Comparator.comparingDouble(Candidate::similarity)
                    .reversed()
                    .thenComparingLong(Candidate::sequence))
            .limit(k)
            .toList();

    List<RetrievedChunk> ranked = new ArrayList<>(kept.size());
    for (int i = 0; i < kept.size(); i++) {
      ranked.add(new RetrievedChunk(kept.get(i).chunk(), kept.get(i).similarity(), i + 1));
    }
    return ranked;
  }

  /** Cosine similarity; zero when either vector has no magnitude. */
  public static double cosineSimilarity(float[] a, float[] b) {
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.length; i++) {
      dot += (double) a[i] * b[i];
      normA += (double) a[i] * a[i];
      normB += (double) b[i] * b[i];
    }
    if (normA == 0.0 || normB == 0.0) {
      return 0.0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }

  /** A scored entry before thresholding and ranking. */
  protected record Candidate(DocumentChunk chunk, double similarity, long sequence) {}
}
