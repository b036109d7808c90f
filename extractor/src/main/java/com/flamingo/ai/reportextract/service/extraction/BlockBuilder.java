package com.flamingo.ai.reportextract.service.extraction;

import com.flamingo.ai.reportextract.service.extraction.model.Block;
import com.flamingo.ai.reportextract.service.extraction.model.ParagraphBlock;
import com.flamingo.ai.reportextract.service.extraction.model.TableBlock;
import com.flamingo.ai.reportextract.service.extraction.model.TableRow;
import com.flamingo.ai.reportextract.service.parsing.model.ContentNode;
import com.flamingo.ai.reportextract.service.parsing.model.ParagraphNode;
import com.flamingo.ai.reportextract.service.parsing.model.TableCellNode;
import com.flamingo.ai.reportextract.service.parsing.model.TableNode;
import com.flamingo.ai.reportextract.service.parsing.model.TableRowNode;
import com.flamingo.ai.reportextract.service.parsing.model.UnsupportedNode;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns a parsed content tree into the ordered block sequence the locators work on.
 *
 * <ul>
 *   <li>Paragraphs become {@link ParagraphBlock}s holding their run text; blank ones are dropped.
 *   <li>Tables become {@link TableBlock}s of two-cell rows. Cells past the second are discarded,
 *       rows with two blank cells are dropped, and tables left without rows are dropped.
 *   <li>A nested table contributes its rows right after the row of the cell that holds it.
 *   <li>Anything else is skipped.
 * </ul>
 *
 * <p>Stateless; the result is owned by the caller.
 */
@Component
@Slf4j
public class BlockBuilder {

  public List<Block> build(List<ContentNode> contentTree) {
    List<Block> blocks = new ArrayList<>();
    for (ContentNode node : contentTree) {
      if (node instanceof ParagraphNode paragraph) {
        String text = paragraph.text();
        if (!text.isBlank()) {
          blocks.add(new ParagraphBlock(text));
        }
      } else if (node instanceof TableNode table) {
        List<TableRow> rows = new ArrayList<>();
        flatten(table, rows);
        if (!rows.isEmpty()) {
          blocks.add(new TableBlock(rows));
        }
      } else if (node instanceof UnsupportedNode unsupported) {
        log.debug("Skipping unsupported body element: {}", unsupported.kind());
      } else {
        log.debug("Skipping unknown content node: {}", node);
      }
    }
    return blocks;
  }

  private void flatten(TableNode table, List<TableRow> rows) {
    for (TableRowNode row : table.rows()) {
      List<TableCellNode> cells = row.cells();
      if (cells.size() > 2) {
        log.warn("Table row has {} cells, discarding all but the first two", cells.size());
        cells = cells.subList(0, 2);
      }
      String first = cells.isEmpty() ? "" : cellText(cells.get(0));
      String second = cells.size() < 2 ? "" : cellText(cells.get(1));
      if (!first.isBlank() || !second.isBlank()) {
        rows.add(new TableRow(first, second));
      }
      for (TableCellNode cell : cells) {
        for (ContentNode child : cell.children()) {
          if (child instanceof TableNode nested) {
            flatten(nested, rows);
          }
        }
      }
    }
  }

  private String cellText(TableCellNode cell) {
    return cell.children().stream()
        .filter(ParagraphNode.class::isInstance)
        .map(child -> ((ParagraphNode) child).text())
        .filter(text -> !text.isBlank())
        .collect(Collectors.joining("\n"));
  }
}
