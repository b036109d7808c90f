package com.flamingo.ai.reportextract.service.extraction.model;

import java.util.List;

/**
 * A named, ordered set of terms to extract from one document layout.
 *
 * @param name profile name as declared under {@code extraction.profiles}
 * @param headerTerms header labels, in output column order
 * @param sectionTerms section labels in document order; the order is the tie-break when several
 *     sections share one table
 */
public record ExtractionProfile(String name, List<Term> headerTerms, List<Term> sectionTerms) {

  public ExtractionProfile {
    headerTerms = List.copyOf(headerTerms);
    sectionTerms = List.copyOf(sectionTerms);
  }
}
