package com.flamingo.ai.reportextract.service.parsing.model;

import java.util.List;

/**
 * A table.
 *
 * @param rows rows in document order
 */
public record TableNode(List<TableRowNode> rows) implements ContentNode {

  public TableNode {
    rows = List.copyOf(rows);
  }

  public static TableNode of(TableRowNode... rows) {
    return new TableNode(List.of(rows));
  }
}
