package com.flamingo.ai.reportextract.exception;

/** Exception thrown when no table in the document carries any header label. */
public class HeaderNotFoundException extends DocumentExtractionException {

  public HeaderNotFoundException(String message) {
    super(message);
  }

  @Override
  public String getReason() {
    return "header_not_found";
  }
}
