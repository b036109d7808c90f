package com.flamingo.ai.reportextract.service.parsing.model;

/**
 * A node of the content tree produced by a {@link
 * com.flamingo.ai.reportextract.service.parsing.DocumentParser}.
 *
 * <p>The tree mirrors the document body: top-level nodes are paragraphs, tables, or anything the
 * parser does not model ({@link UnsupportedNode}). Table cells hold their own child nodes, which
 * may include nested tables.
 */
public interface ContentNode {}
