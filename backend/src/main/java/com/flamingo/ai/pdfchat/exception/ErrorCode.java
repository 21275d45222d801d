package com.flamingo.ai.pdfchat.exception;

/** Machine-readable failure codes carried by pipeline results. */
public enum ErrorCode {
  VALIDATION_ERROR,
  EMPTY_DOCUMENT,
  EXTRACTION_FAILED,
  EMBEDDING_UNAVAILABLE,
  STORAGE_FAILURE,
  INTERNAL_ERROR
}
