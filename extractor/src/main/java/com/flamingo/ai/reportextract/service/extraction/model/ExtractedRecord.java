package com.flamingo.ai.reportextract.service.extraction.model;

/**
 * Everything extracted from one document.
 *
 * @param header header field values
 * @param sections section texts
 * @param sourceId path of the source document, written unchanged as the last column
 */
public record ExtractedRecord(HeaderFields header, SectionValues sections, String sourceId) {}
