package com.flamingo.ai.pdfchat.exception;

/** Exception thrown when a document yields no chunk worth indexing. */
public class EmptyDocumentException extends DocumentProcessingException {

  public EmptyDocumentException(String fileName) {
    super(
        ErrorCode.EMPTY_DOCUMENT,
        fileName,
        "No indexable text in " + fileName,
        "No text content could be extracted from the document");
  }
}
