package com.flamingo.ai.reportextract.service.parsing.model;

import java.util.Arrays;
import java.util.List;

/**
 * A table cell.
 *
 * @param children paragraphs, nested tables and unsupported nodes, in document order
 */
public record TableCellNode(List<ContentNode> children) {

  public TableCellNode {
    children = List.copyOf(children);
  }

  /** A cell holding one single-run paragraph per given text. */
  public static TableCellNode text(String... paragraphs) {
    return new TableCellNode(
        Arrays.stream(paragraphs).<ContentNode>map(ParagraphNode::of).toList());
  }

  public static TableCellNode of(ContentNode... children) {
    return new TableCellNode(List.of(children));
  }
}
