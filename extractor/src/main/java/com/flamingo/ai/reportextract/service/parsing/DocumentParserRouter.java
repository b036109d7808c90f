package com.flamingo.ai.reportextract.service.parsing;

import com.flamingo.ai.reportextract.exception.DocumentReadException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Routes a document MIME type to the highest-priority {@link DocumentParser} that supports it.
 *
 * <p>Parsers are injected by Spring in {@code @Order} order (ascending). The router picks the
 * first parser that returns {@code true} for {@code supports(mimeType)}.
 */
@Service
@RequiredArgsConstructor
public class DocumentParserRouter {

  private final List<DocumentParser> parsers;

  /**
   * Returns the highest-priority parser that supports the given MIME type.
   *
   * @param mimeType document MIME type
   * @return selected parser
   * @throws DocumentReadException if no parser supports the MIME type
   */
  public DocumentParser route(String mimeType) {
    return parsers.stream()
        .filter(p -> p.supports(mimeType))
        .findFirst()
        .orElseThrow(() -> new DocumentReadException("Unsupported document type: " + mimeType));
  }
}
