package com.flamingo.ai.pdfchat.exception;

/** Exception thrown when text cannot be extracted from an uploaded document. */
public class DocumentProcessingException extends PipelineException {

  private final String fileName;

  public DocumentProcessingException(String fileName, String message, Throwable cause) {
    super(ErrorCode.EXTRACTION_FAILED, message, "Failed to read document " + fileName, cause);
    this.fileName = fileName;
  }

  protected DocumentProcessingException(
      ErrorCode errorCode, String fileName, String message, String userMessage) {
    super(errorCode, message, userMessage);
    this.fileName = fileName;
  }

  public String getFileName() {
    return fileName;
  }
}
