package com.flamingo.ai.pdfchat.exception;

/**
 * Base class for failures the pipeline converts into result objects. Carries a code for callers
 * and a message that is safe to show to end users.
 */
public abstract class PipelineException extends RuntimeException {

  private final ErrorCode errorCode;
  private final String userMessage;

  protected PipelineException(ErrorCode errorCode, String message, String userMessage) {
    super(message);
    this.errorCode = errorCode;
    this.userMessage = userMessage;
  }

  protected PipelineException(
      ErrorCode errorCode, String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
    this.userMessage = userMessage;
  }

  public ErrorCode getErrorCode() {
    return errorCode;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
