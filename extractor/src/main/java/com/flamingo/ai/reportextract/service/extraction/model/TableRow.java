package com.flamingo.ai.reportextract.service.extraction.model;

/**
 * A table row capped at two cells. At least one of the cells is non-blank.
 *
 * @param first text of the first cell
 * @param second text of the second cell, empty when the row had a single cell
 */
public record TableRow(String first, String second) {

  public TableRow {
    first = first == null ? "" : first;
    second = second == null ? "" : second;
  }
}
