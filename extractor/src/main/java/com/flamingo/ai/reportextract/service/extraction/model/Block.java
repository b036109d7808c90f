package com.flamingo.ai.reportextract.service.extraction.model;

/**
 * One paragraph or one table, in document reading order.
 *
 * <p>Produced by {@link com.flamingo.ai.reportextract.service.extraction.BlockBuilder}; read by
 * the header and section locators. Implementations are immutable.
 */
public interface Block {}
