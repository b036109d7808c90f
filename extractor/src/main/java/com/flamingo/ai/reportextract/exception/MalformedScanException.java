package com.flamingo.ai.reportextract.exception;

/** Exception thrown when a positional scan exceeds its step bound. */
public class MalformedScanException extends DocumentExtractionException {

  private final String term;
  private final int position;

  public MalformedScanException(String term, int position) {
    super("Scan for '" + term + "' exceeded its bound at position " + position);
    this.term = term;
    this.position = position;
  }

  public String getTerm() {
    return term;
  }

  public int getPosition() {
    return position;
  }

  @Override
  public String getReason() {
    return "malformed_scan";
  }
}
