package com.flamingo.ai.reportextract.service.extraction;

import com.flamingo.ai.reportextract.config.ExtractionConfig;
import com.flamingo.ai.reportextract.service.extraction.model.Block;
import com.flamingo.ai.reportextract.service.extraction.model.ParagraphBlock;
import com.flamingo.ai.reportextract.service.extraction.model.SectionValues;
import com.flamingo.ai.reportextract.service.extraction.model.TableBlock;
import com.flamingo.ai.reportextract.service.extraction.model.Term;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Finds the narrative text belonging to each section term.
 *
 * <p>Lookup order for one term:
 *
 * <ol>
 *   <li>A paragraph exactly matching the term: the value is the next block, a table joined cell
 *       by cell or a paragraph as is. When the next block is another section heading the section
 *       is empty.
 *   <li>The first paragraph or table cell with a normalized match. A paragraph behaves as above;
 *       a table cell starts a slice of that table (see below).
 *   <li>The first paragraph or table cell starting with an alias; the value is the rest of it.
 * </ol>
 *
 * <p>Several sections may share one table, each heading in its own cell. A slice runs from the
 * cell after the heading up to, not including, the first later cell that matches any other section
 * term, or to the end of the table. Blank cells are left out and the rest joined with newlines.
 *
 * <p>A term found nowhere has an empty value. The result depends only on the arguments.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SectionLocator {

  private final ExtractionConfig extractionConfig;

  /**
   * Locates every section.
   *
   * @param blocks the document's blocks in reading order
   * @param sectionTerms section terms in the order they appear in documents
   * @return text for every term, empty when not found
   */
  public SectionValues locate(List<Block> blocks, List<Term> sectionTerms) {
    Map<Term, String> values = new LinkedHashMap<>();
    for (Term term : sectionTerms) {
      String value =
          byExactHeading(term, blocks, sectionTerms)
              .or(() -> byNormalizedMatch(term, blocks, sectionTerms))
              .or(() -> byPrefix(term, blocks))
              .orElse("");
      if (value.isEmpty()) {
        log.debug("No text found for section '{}'", term.main());
      }
      values.put(term, value);
    }
    return new SectionValues(values);
  }

  private Optional<String> byExactHeading(Term term, List<Block> blocks, List<Term> sectionTerms) {
    for (int i = 0; i < blocks.size(); i++) {
      if (blocks.get(i) instanceof ParagraphBlock paragraph
          && term.matchesExact(paragraph.text())) {
        return Optional.of(followingBlockText(term, blocks, i, sectionTerms));
      }
    }
    return Optional.empty();
  }

  private Optional<String> byNormalizedMatch(
      Term term, List<Block> blocks, List<Term> sectionTerms) {
    for (int i = 0; i < blocks.size(); i++) {
      Block block = blocks.get(i);
      if (block instanceof ParagraphBlock paragraph) {
        if (term.matchesNormalized(paragraph.text())) {
          return Optional.of(followingBlockText(term, blocks, i, sectionTerms));
        }
      } else if (block instanceof TableBlock table) {
        List<String> cells = table.cells();
        for (int p = 0; p < cells.size(); p++) {
          if (term.matches(cells.get(p))) {
            return Optional.of(slice(term, cells, p, sectionTerms));
          }
        }
      }
    }
    return Optional.empty();
  }

  private Optional<String> byPrefix(Term term, List<Block> blocks) {
    for (Block block : blocks) {
      if (block instanceof ParagraphBlock paragraph) {
        if (term.startsWith(paragraph.text())) {
          return Optional.of(term.strip(paragraph.text()));
        }
      } else if (block instanceof TableBlock table) {
        Optional<String> cell = table.cells().stream().filter(term::startsWith).findFirst();
        if (cell.isPresent()) {
          return Optional.of(term.strip(cell.get()));
        }
      }
    }
    return Optional.empty();
  }

  private String followingBlockText(
      Term term, List<Block> blocks, int headingIndex, List<Term> sectionTerms) {
    int next = headingIndex + 1;
    if (next >= blocks.size()) {
      return "";
    }
    Block block = blocks.get(next);
    if (block instanceof TableBlock table) {
      return table.joinedText();
    }
    String text = ((ParagraphBlock) block).text();
    boolean isOtherHeading =
        sectionTerms.stream().filter(other -> !other.equals(term)).anyMatch(o -> o.matches(text));
    return isOtherHeading ? "" : text.trim();
  }

  private String slice(Term term, List<String> cells, int start, List<Term> sectionTerms) {
    ScanGuard guard =
        ScanGuard.forScan(term.main(), cells.size(), extractionConfig.getScan().getBoundFactor());
    int end = cells.size();
    for (int i = start + 1; i < cells.size(); i++) {
      guard.tick(i);
      String cell = cells.get(i);
      boolean otherTerm =
          sectionTerms.stream()
              .filter(other -> !other.equals(term))
              .anyMatch(other -> other.matchesNormalized(cell));
      if (otherTerm) {
        end = i;
        break;
      }
    }
    return TableBlock.joinNonBlank(cells.subList(start + 1, end));
  }
}
