package com.flamingo.ai.reportextract.service.extraction.model;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A table with at least one non-empty row. Nested tables are already flattened into {@link
 * #rows()}.
 *
 * @param rows two-cell rows in reading order
 */
public record TableBlock(List<TableRow> rows) implements Block {

  public TableBlock {
    rows = List.copyOf(rows);
  }

  /**
   * Returns every cell in row-major order, empty cells included, so that a label at position
   * {@code i} has its value at {@code i + 1}.
   */
  public List<String> cells() {
    List<String> cells = new ArrayList<>(rows.size() * 2);
    for (TableRow row : rows) {
      cells.add(row.first());
      cells.add(row.second());
    }
    return cells;
  }

  /** Non-blank cells, trimmed, row-major, one per line. */
  public String joinedText() {
    return joinNonBlank(cells());
  }

  /** Joins the non-blank entries of {@code cells}, trimmed, with newlines. */
  public static String joinNonBlank(List<String> cells) {
    return cells.stream()
        .filter(cell -> !cell.isBlank())
        .map(String::trim)
        .collect(Collectors.joining("\n"));
  }
}
