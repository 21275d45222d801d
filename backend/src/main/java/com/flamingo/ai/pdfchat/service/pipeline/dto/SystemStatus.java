package com.flamingo.ai.pdfchat.service.pipeline.dto;

import java.time.LocalDateTime;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Health and configuration snapshot of the pipeline. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemStatus {
  private boolean healthy;
  private String vectorStoreType;
  private String indexName;
  private long totalChunks;
  private String embeddingModel;
  private int embeddingDimension;
  private List<String> availableGenerationBackends;
  private int chunkSize;
  private int chunkOverlap;
  private int topK;
  private double similarityThreshold;

  /** Set when the index could not be reached. */
  private String error;

  private LocalDateTime timestamp;
}
