package com.flamingo.ai.reportextract.service.parsing.model;

import java.util.List;

/**
 * A paragraph as a sequence of text runs.
 *
 * @param runs text of each run in document order; non-text run content is not represented
 */
public record ParagraphNode(List<String> runs) implements ContentNode {

  public ParagraphNode {
    runs = List.copyOf(runs);
  }

  public static ParagraphNode of(String... runs) {
    return new ParagraphNode(List.of(runs));
  }

  /** Run text concatenated without separators. */
  public String text() {
    return String.join("", runs);
  }
}
