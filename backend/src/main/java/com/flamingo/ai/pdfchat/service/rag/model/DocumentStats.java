package com.flamingo.ai.pdfchat.service.rag.model;

/** Per-document index statistics. Unknown documents report zero counts. */
public record DocumentStats(String documentId, int chunkCount, int distinctPageCount) {

  public static DocumentStats empty(String documentId) {
    return new DocumentStats(documentId, 0, 0);
  }
}
