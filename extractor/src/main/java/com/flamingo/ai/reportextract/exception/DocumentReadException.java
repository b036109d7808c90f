package com.flamingo.ai.reportextract.exception;

/** Exception thrown when a document cannot be read or parsed into a content tree. */
public class DocumentReadException extends DocumentExtractionException {

  public DocumentReadException(String message) {
    super(message);
  }

  public DocumentReadException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public String getReason() {
    return "read_error";
  }
}
