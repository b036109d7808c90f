package com.flamingo.ai.reportextract.service.parsing.model;

import java.util.List;

/**
 * A table row.
 *
 * @param cells cells in column order; may hold more than two
 */
public record TableRowNode(List<TableCellNode> cells) {

  public TableRowNode {
    cells = List.copyOf(cells);
  }

  public static TableRowNode of(TableCellNode... cells) {
    return new TableRowNode(List.of(cells));
  }
}
