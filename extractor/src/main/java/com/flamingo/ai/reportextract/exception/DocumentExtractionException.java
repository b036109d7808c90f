package com.flamingo.ai.reportextract.exception;

/**
 * Base class for failures scoped to a single document. The batch driver records these against the
 * document and moves on to the next one.
 */
public class DocumentExtractionException extends RuntimeException {

  public DocumentExtractionException(String message) {
    super(message);
  }

  public DocumentExtractionException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Short tag used for the failure counter. */
  public String getReason() {
    return "extraction_error";
  }
}
