package com.flamingo.ai.reportextract.service.batch;

import com.flamingo.ai.reportextract.service.document.DocumentHandle;
import com.flamingo.ai.reportextract.service.extraction.BlockBuilder;
import com.flamingo.ai.reportextract.service.extraction.HeaderLocator;
import com.flamingo.ai.reportextract.service.extraction.RecordAssembler;
import com.flamingo.ai.reportextract.service.extraction.SectionLocator;
import com.flamingo.ai.reportextract.service.extraction.model.Block;
import com.flamingo.ai.reportextract.service.extraction.model.ExtractedRecord;
import com.flamingo.ai.reportextract.service.extraction.model.ExtractionProfile;
import com.flamingo.ai.reportextract.service.extraction.model.HeaderFields;
import com.flamingo.ai.reportextract.service.extraction.model.SectionValues;
import com.flamingo.ai.reportextract.service.extraction.model.Term;
import com.flamingo.ai.reportextract.service.parsing.DocumentParserRouter;
import com.flamingo.ai.reportextract.service.parsing.model.ContentNode;
import io.micrometer.core.annotation.Timed;
import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Extracts one document: load, parse, build blocks, locate header and sections, assemble.
 *
 * <p>Parsing goes through {@link DocumentParserRouter}, so this service has no knowledge of any
 * document format.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentExtractionService {

  private final DocumentParserRouter parserRouter;
  private final BlockBuilder blockBuilder;
  private final HeaderLocator headerLocator;
  private final SectionLocator sectionLocator;
  private final RecordAssembler recordAssembler;

  /**
   * Extracts the record for one document file. The document is released on every exit path.
   *
   * @param path document file
   * @param profile terms to extract
   * @return the extracted record; its source id is {@code path} as given
   * @throws com.flamingo.ai.reportextract.exception.DocumentExtractionException if the document
   *     cannot be read or has no header table
   */
  @Timed(value = "document.extract", description = "Time to extract one document")
  public ExtractedRecord extract(Path path, ExtractionProfile profile) {
    try (DocumentHandle handle = new DocumentHandle(path)) {
      List<ContentNode> contentTree = handle.load().parse(parserRouter);
      return extract(contentTree, profile, path.toString());
    }
  }

  /** Extracts the record for an already parsed content tree. */
  public ExtractedRecord extract(
      List<ContentNode> contentTree, ExtractionProfile profile, String sourceId) {
    List<Block> blocks = blockBuilder.build(contentTree);
    log.debug("{}: {} blocks", sourceId, blocks.size());

    HeaderFields header = headerLocator.locate(blocks, profile.headerTerms());
    List<Term> missing = header.missingRequired();
    if (!missing.isEmpty()) {
      log.warn("{}: no value for required header field(s) {}", sourceId, missing);
    }

    SectionValues sections = sectionLocator.locate(blocks, profile.sectionTerms());
    return recordAssembler.assemble(header, sections, sourceId);
  }
}
