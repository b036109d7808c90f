package com.flamingo.ai.reportextract.service.extraction;

import com.flamingo.ai.reportextract.config.ExtractionConfig;
import com.flamingo.ai.reportextract.exception.HeaderNotFoundException;
import com.flamingo.ai.reportextract.service.extraction.model.Block;
import com.flamingo.ai.reportextract.service.extraction.model.HeaderFields;
import com.flamingo.ai.reportextract.service.extraction.model.TableBlock;
import com.flamingo.ai.reportextract.service.extraction.model.Term;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiPredicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads the header fields (province, district, …) from the document's header table.
 *
 * <p>The header table is the first table with a cell exactly matching a header alias or, when no
 * table has one, the first table with a normalized match. Only that table is read. Its cells are
 * taken row-major and every cell that is a header label is replaced by the label's canonical term;
 * a term's value is then the cell right after its label. A label that is last in the table, or
 * whose next cell is another label, has an empty value.
 *
 * <p>Labels that never stand alone in a cell are looked up by prefix ("Subject: Physics") and
 * their value is stripped from the same cell. Only cells that are neither a label nor a label's
 * value are considered, and the label must be followed by a colon.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HeaderLocator {

  private final ExtractionConfig extractionConfig;

  /**
   * Locates the header values.
   *
   * @param blocks the document's blocks in reading order
   * @param headerTerms header terms in output order
   * @return a value for every header term, empty when not found
   * @throws HeaderNotFoundException if header terms are given and no table holds any of them
   */
  public HeaderFields locate(List<Block> blocks, List<Term> headerTerms) {
    if (headerTerms.isEmpty()) {
      return HeaderFields.complete(headerTerms, Map.of());
    }
    TableBlock table =
        findHeaderTable(blocks, headerTerms, Term::matchesExact)
            .or(() -> findHeaderTable(blocks, headerTerms, Term::matchesNormalized))
            .orElseThrow(
                () ->
                    new HeaderNotFoundException(
                        "No table contains any of the header labels " + headerTerms));

    List<String> cells = table.cells();
    Term[] labels = canonicalize(cells, headerTerms);

    Map<Term, String> found = new LinkedHashMap<>();
    for (Term term : headerTerms) {
      valueAfterLabel(term, cells, labels).ifPresent(value -> found.put(term, value));
    }
    for (Term term : headerTerms) {
      if (!found.containsKey(term)) {
        inlineValue(term, cells, labels).ifPresent(value -> found.put(term, value));
      }
    }

    log.debug("Header table resolved {} of {} labels", found.size(), headerTerms.size());
    return HeaderFields.complete(headerTerms, found);
  }

  private Optional<TableBlock> findHeaderTable(
      List<Block> blocks, List<Term> headerTerms, BiPredicate<Term, String> matcher) {
    return blocks.stream()
        .filter(TableBlock.class::isInstance)
        .map(TableBlock.class::cast)
        .filter(
            table ->
                table.cells().stream()
                    .anyMatch(cell -> headerTerms.stream().anyMatch(t -> matcher.test(t, cell))))
        .findFirst();
  }

  /** Position {@code i} holds the header term cell {@code i} spells, or null for data cells. */
  private Term[] canonicalize(List<String> cells, List<Term> headerTerms) {
    Term[] labels = new Term[cells.size()];
    for (int i = 0; i < cells.size(); i++) {
      String cell = cells.get(i);
      labels[i] = headerTerms.stream().filter(t -> t.matches(cell)).findFirst().orElse(null);
    }
    return labels;
  }

  /** Looks for "label: value" in cells that are neither a label nor the value after one. */
  private Optional<String> inlineValue(Term term, List<String> cells, Term[] labels) {
    for (int i = 0; i < cells.size(); i++) {
      boolean positioned = labels[i] != null || (i > 0 && labels[i - 1] != null);
      if (!positioned && term.startsWith(cells.get(i))) {
        return Optional.of(term.strip(cells.get(i)));
      }
    }
    return Optional.empty();
  }

  private Optional<String> valueAfterLabel(Term term, List<String> cells, Term[] labels) {
    ScanGuard guard =
        ScanGuard.forScan(term.main(), cells.size(), extractionConfig.getScan().getBoundFactor());
    for (int i = 0; i < cells.size(); i++) {
      guard.tick(i);
      if (term.equals(labels[i])) {
        int next = i + 1;
        if (next >= cells.size() || labels[next] != null) {
          return Optional.of("");
        }
        return Optional.of(cells.get(next).trim());
      }
    }
    return Optional.empty();
  }
}
