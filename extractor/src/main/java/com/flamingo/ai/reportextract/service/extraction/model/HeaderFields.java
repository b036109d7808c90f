package com.flamingo.ai.reportextract.service.extraction.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Header values keyed by header term, in header-term order. Every term is present; an empty
 * string means the label was not found.
 *
 * @param values header term to extracted value
 */
public record HeaderFields(Map<Term, String> values) {

  public HeaderFields {
    values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  /**
   * Builds a complete mapping for {@code terms}, filling any term absent from {@code found} with
   * an empty string.
   */
  public static HeaderFields complete(List<Term> terms, Map<Term, String> found) {
    Map<Term, String> values = new LinkedHashMap<>();
    for (Term term : terms) {
      values.put(term, found.getOrDefault(term, ""));
    }
    return new HeaderFields(values);
  }

  /** Value for the term whose canonical label is {@code main}, or empty string. */
  public String get(String main) {
    return values.entrySet().stream()
        .filter(e -> e.getKey().main().equals(main))
        .map(Map.Entry::getValue)
        .findFirst()
        .orElse("");
  }

  /** Required terms whose value is empty. */
  public List<Term> missingRequired() {
    return values.entrySet().stream()
        .filter(e -> e.getKey().required() && e.getValue().isEmpty())
        .map(Map.Entry::getKey)
        .toList();
  }
}
