package com.flamingo.ai.reportextract.service.extraction.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Section text keyed by section term, in the order the terms were requested. Every term is
 * present; an empty string means the section was not found.
 *
 * @param values section term to extracted text
 */
public record SectionValues(Map<Term, String> values) {

  public SectionValues {
    values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  /** Text for the term whose canonical label is {@code main}, or empty string. */
  public String get(String main) {
    return values.entrySet().stream()
        .filter(e -> e.getKey().main().equals(main))
        .map(Map.Entry::getValue)
        .findFirst()
        .orElse("");
  }
}
