package com.flamingo.ai.pdfchat.service.rag.model;

/**
 * A chunk matched by one query, paired with its cosine similarity and 1-based rank.
 *
 * @param chunk the stored chunk
 * @param similarity {@code 1 - cosineDistance} between query and chunk vectors
 * @param rank position in the result list, starting at 1
 */
public record RetrievedChunk(DocumentChunk chunk, double similarity, int rank) {

  public String content() {
    return chunk.getContent();
  }

  public int pageNumber() {
    return chunk.getPageNumber();
  }

  public String fileName() {
    return chunk.getFileName();
  }
}
