package com.flamingo.ai.reportextract.service.parsing;

import com.flamingo.ai.reportextract.service.parsing.model.ContentNode;
import java.io.InputStream;
import java.util.List;

/**
 * Parses a raw document byte-stream into its content tree.
 *
 * <p>Implementations are format-specific and must be stateless so one instance can serve
 * concurrent batch workers. A parser only parses; it knows nothing about labels or sections.
 */
public interface DocumentParser {

  /**
   * Parses the given document stream.
   *
   * <p>The caller retains ownership of {@code inputStream}; implementations must not close it.
   *
   * @param inputStream raw document bytes
   * @param mimeType detected MIME type of the document
   * @return top-level body nodes in document order
   * @throws com.flamingo.ai.reportextract.exception.DocumentReadException if the bytes cannot be
   *     parsed
   */
  List<ContentNode> parse(InputStream inputStream, String mimeType);

  /**
   * Returns {@code true} if this parser can handle the given MIME type.
   *
   * @param mimeType document MIME type
   * @return {@code true} if supported
   */
  boolean supports(String mimeType);
}
