package com.flamingo.ai.reportextract.service.extraction;

import com.flamingo.ai.reportextract.exception.MalformedScanException;

/**
 * Step counter for one positional scan. A scan over {@code n} elements may take at most {@code
 * boundFactor * n} steps; the step that crosses the bound raises {@link MalformedScanException}.
 *
 * <p>Not thread-safe. Create one per scan.
 */
public final class ScanGuard {

  private final String term;
  private final long bound;
  private long steps;

  private ScanGuard(String term, long bound) {
    this.term = term;
    this.bound = bound;
  }

  /**
   * Creates a guard for a scan looking for {@code term}.
   *
   * @param term label being scanned for, reported when the guard trips
   * @param expectedLength number of elements the scan covers
   * @param boundFactor allowed steps per element; must not be negative
   */
  public static ScanGuard forScan(String term, int expectedLength, int boundFactor) {
    if (boundFactor < 0) {
      throw new IllegalArgumentException("boundFactor must not be negative: " + boundFactor);
    }
    return new ScanGuard(term, (long) Math.max(expectedLength, 1) * boundFactor);
  }

  /**
   * Records one scan step.
   *
   * @param position index the scan is about to inspect
   * @throws MalformedScanException if the step exceeds the bound
   */
  public void tick(int position) {
    steps++;
    if (steps > bound) {
      throw new MalformedScanException(term, position);
    }
  }

  public long getSteps() {
    return steps;
  }

  public long getBound() {
    return bound;
  }
}
