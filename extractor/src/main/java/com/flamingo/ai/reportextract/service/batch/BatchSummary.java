package com.flamingo.ai.reportextract.service.batch;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of one batch run.
 *
 * @param total documents attempted
 * @param succeeded documents written to the output
 * @param failures skipped documents, in input order
 */
public record BatchSummary(int total, int succeeded, List<Failure> failures) {

  public BatchSummary {
    failures = List.copyOf(failures);
  }

  /**
   * A skipped document.
   *
   * @param path document path
   * @param reason failure tag, as used for the failure counter
   * @param message diagnostic message
   */
  public record Failure(Path path, String reason, String message) {}
}
