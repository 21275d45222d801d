package com.flamingo.ai.pdfchat.service.pipeline.dto;

import com.flamingo.ai.pdfchat.exception.ErrorCode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Outcome of ingesting one document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadResult {

  private boolean success;
  private String message;
  private String documentId;
  private String filename;
  private int pagesProcessed;
  private int chunksCreated;

  /** Null on success. */
  private ErrorCode errorCode;

  public static UploadResult success(
      String documentId, String filename, int pagesProcessed, int chunksCreated) {
    return UploadResult.builder()
        .success(true)
        .message("Document processed successfully")
        .documentId(documentId)
        .filename(filename)
        .pagesProcessed(pagesProcessed)
        .chunksCreated(chunksCreated)
        .build();
  }

  public static UploadResult failure(ErrorCode errorCode, String message, String filename) {
    return UploadResult.builder()
        .success(false)
        .errorCode(errorCode)
        .message(message)
        .filename(filename)
        .build();
  }
}
