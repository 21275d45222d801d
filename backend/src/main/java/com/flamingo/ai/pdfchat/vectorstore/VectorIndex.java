package com.flamingo.ai.pdfchat.vectorstore;

import com.flamingo.ai.pdfchat.service.rag.model.DocumentChunk;
import com.flamingo.ai.pdfchat.service.rag.model.DocumentStats;
import com.flamingo.ai.pdfchat.service.rag.model.IndexStats;
import com.flamingo.ai.pdfchat.service.rag.model.RetrievedChunk;
import java.util.List;

/**
 * Storage of chunk vectors with nearest-neighbour lookup.
 *
 * <p>The index exclusively owns chunk and vector storage. Each mutating call is atomic on its own;
 * calls for different documents may run concurrently.
 */
public interface VectorIndex {

  /**
   * Stores chunks with their vectors, all or nothing.
   *
   * @param chunks chunks in document order
   * @param vectors one vector per chunk, same order
   * @throws com.flamingo.ai.pdfchat.exception.ValidationException if the lists differ in size or
   *     a vector has the wrong dimensionality
   * @throws com.flamingo.ai.pdfchat.exception.StorageException if the write failed; nothing of
   *     the batch remains stored
   */
  void store(List<DocumentChunk> chunks, List<float[]> vectors);

  /**
   * Finds the chunks most similar to a query vector.
   *
   * <p>Similarity is {@code 1 - cosineDistance}. Only entries at or above the configured threshold
   * are returned, sorted by similarity descending with ties in insertion order. The filter is
   * never widened here.
   *
   * @param queryVector query embedding
   * @param documentFilter restrict to this document id, or {@code null} for all documents
   * @param k maximum number of results
   * @return ranked results, rank starting at 1
   * @throws com.flamingo.ai.pdfchat.exception.StorageException if the index cannot be read
   */
  List<RetrievedChunk> search(float[] queryVector, String documentFilter, int k);

  /**
   * Chunk and page counts for one document.
   *
   * @param documentId the document
   * @return counts, zero for unknown documents
   */
  DocumentStats stats(String documentId);

  /** Whole-index counts. */
  IndexStats stats();

  /**
   * Removes every chunk of a document.
   *
   * @param documentId the document
   * @return {@code false} if the document had no chunks
   */
  boolean delete(String documentId);

  /**
   * Removes every chunk of every document.
   *
   * @return number of chunks removed
   * @throws com.flamingo.ai.pdfchat.exception.StorageException if the index cannot be written
   */
  long clear();
}
