package com.flamingo.ai.reportextract.service.extraction.model;

/**
 * A non-blank paragraph.
 *
 * @param text concatenated run text, in document order
 */
public record ParagraphBlock(String text) implements Block {}
