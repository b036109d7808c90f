package com.flamingo.ai.reportextract.service.extraction;

import com.flamingo.ai.reportextract.service.extraction.model.ExtractedRecord;
import com.flamingo.ai.reportextract.service.extraction.model.ExtractionProfile;
import com.flamingo.ai.reportextract.service.extraction.model.HeaderFields;
import com.flamingo.ai.reportextract.service.extraction.model.SectionValues;
import com.flamingo.ai.reportextract.service.extraction.model.Term;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Combines header and section results into one record and lays records out as output rows.
 *
 * <p>Columns are the header terms in order, then the section terms in order, then the source file.
 */
@Component
public class RecordAssembler {

  static final String SOURCE_COLUMN = "File";

  public ExtractedRecord assemble(HeaderFields header, SectionValues sections, String sourceId) {
    return new ExtractedRecord(header, sections, sourceId);
  }

  public List<String> toRow(ExtractedRecord record) {
    List<String> row =
        new ArrayList<>(record.header().values().size() + record.sections().values().size() + 1);
    row.addAll(record.header().values().values());
    row.addAll(record.sections().values().values());
    row.add(record.sourceId());
    return row;
  }

  public List<String> headerRow(List<Term> headerTerms, List<Term> sectionTerms) {
    List<String> row = new ArrayList<>(headerTerms.size() + sectionTerms.size() + 1);
    headerTerms.forEach(term -> row.add(term.column()));
    sectionTerms.forEach(term -> row.add(term.column()));
    row.add(SOURCE_COLUMN);
    return row;
  }

  public List<String> headerRow(ExtractionProfile profile) {
    return headerRow(profile.headerTerms(), profile.sectionTerms());
  }
}
