package com.flamingo.ai.pdfchat.exception;

/** Exception thrown when input is rejected before any I/O happens. */
public class ValidationException extends PipelineException {

  public ValidationException(String message) {
    super(ErrorCode.VALIDATION_ERROR, message, message);
  }
}
