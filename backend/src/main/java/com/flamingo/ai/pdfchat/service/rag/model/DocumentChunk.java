package com.flamingo.ai.pdfchat.service.rag.model;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * A passage of a document as it is stored in the vector index. Immutable once created; removed
 * only when its document is deleted.
 */
@Value
@Builder
public class DocumentChunk {

  public static final String META_FILENAME = "filename";
  public static final String META_CHUNK_LENGTH = "chunkLength";
  public static final String META_PAGE_NUMBER = "pageNumber";

  /** {@code <documentId>_<chunkIndex>}. */
  String id;

  String documentId;
  String content;
  int pageNumber;

  /** Position within the document, continuous across pages (0-based). */
  int chunkIndex;

  @Builder.Default Map<String, Object> metadata = Map.of();

  public String getFileName() {
    Object fileName = metadata.get(META_FILENAME);
    return fileName != null ? fileName.toString() : "Unknown document";
  }

  public static String chunkId(String documentId, int chunkIndex) {
    return documentId + "_" + chunkIndex;
  }
}
