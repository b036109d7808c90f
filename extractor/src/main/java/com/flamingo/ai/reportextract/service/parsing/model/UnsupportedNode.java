package com.flamingo.ai.reportextract.service.parsing.model;

/**
 * Body content the parser does not model, e.g. a structured document tag.
 *
 * @param kind short description of the skipped element, used in diagnostics
 */
public record UnsupportedNode(String kind) implements ContentNode {}
