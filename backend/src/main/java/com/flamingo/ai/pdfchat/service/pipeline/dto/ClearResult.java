package com.flamingo.ai.pdfchat.service.pipeline.dto;

import com.flamingo.ai.pdfchat.exception.ErrorCode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Outcome of removing every stored document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClearResult {

  private boolean success;
  private String message;
  private long chunksRemoved;

  /** Null on success. */
  private ErrorCode errorCode;

  public static ClearResult success(long chunksRemoved) {
    return ClearResult.builder()
        .success(true)
        .message("All documents cleared successfully")
        .chunksRemoved(chunksRemoved)
        .build();
  }

  public static ClearResult failure(ErrorCode errorCode, String message) {
    return ClearResult.builder().success(false).errorCode(errorCode).message(message).build();
  }
}
