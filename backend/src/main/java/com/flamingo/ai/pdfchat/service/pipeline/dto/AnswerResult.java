package com.flamingo.ai.pdfchat.service.pipeline.dto;

import com.flamingo.ai.pdfchat.exception.ErrorCode;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Answer to one question, with citations and a confidence score. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnswerResult {

  private boolean success;
  private String response;

  /** {@code filename (Page p, Similarity: s)} in rank order. */
  @Builder.Default private List<String> sources = new ArrayList<>();

  @Builder.Default private List<SourceReference> sourceReferences = new ArrayList<>();

  /** In [0, 1]. */
  private double confidence;

  /** Seconds spent on the whole query path. */
  private double processingTime;

  /** Null on success. */
  private ErrorCode errorCode;

  public static AnswerResult failure(ErrorCode errorCode, String response, double processingTime) {
    return AnswerResult.builder()
        .success(false)
        .errorCode(errorCode)
        .response(response)
        .processingTime(processingTime)
        .build();
  }
}
