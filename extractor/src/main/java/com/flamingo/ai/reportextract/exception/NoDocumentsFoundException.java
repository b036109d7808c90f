package com.flamingo.ai.reportextract.exception;

/** Exception thrown when the input location yields no documents to process. */
public class NoDocumentsFoundException extends RuntimeException {

  private final String location;

  public NoDocumentsFoundException(String location) {
    super("No documents found in: " + location);
    this.location = location;
  }

  public String getLocation() {
    return location;
  }
}
