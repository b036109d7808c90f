package com.flamingo.ai.reportextract.service.parsing;

import com.flamingo.ai.reportextract.exception.DocumentReadException;
import com.flamingo.ai.reportextract.service.parsing.model.ContentNode;
import com.flamingo.ai.reportextract.service.parsing.model.ParagraphNode;
import com.flamingo.ai.reportextract.service.parsing.model.TableCellNode;
import com.flamingo.ai.reportextract.service.parsing.model.TableNode;
import com.flamingo.ai.reportextract.service.parsing.model.TableRowNode;
import com.flamingo.ai.reportextract.service.parsing.model.UnsupportedNode;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.IRunElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFSDT;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentParser} for Office Open XML word-processing documents ({@code .docx}).
 *
 * <p>Walks {@link XWPFDocument#getBodyElements()} with Apache POI so that paragraphs and tables
 * keep their body order. Table cells are walked the same way, which is how nested tables are
 * reached. Content controls ({@link XWPFSDT}) are reported as unsupported, both at body level and
 * inside paragraphs where they are left out of the run text.
 */
@Service
@Order(10)
@Slf4j
public class XwpfDocumentParser implements DocumentParser {

  public static final String DOCX_MIME_TYPE =
      "application/vnd.openxmlformats-officedocument.wordprocessingml.document";

  @Override
  public List<ContentNode> parse(InputStream inputStream, String mimeType) {
    try (XWPFDocument document = new XWPFDocument(inputStream)) {
      return toNodes(document.getBodyElements());
    } catch (Exception e) {
      log.error("XwpfDocumentParser failed for mimeType={}: {}", mimeType, e.getMessage());
      throw new DocumentReadException("Failed to parse document: " + e.getMessage(), e);
    }
  }

  @Override
  public boolean supports(String mimeType) {
    return DOCX_MIME_TYPE.equalsIgnoreCase(mimeType);
  }

  private List<ContentNode> toNodes(List<IBodyElement> elements) {
    List<ContentNode> nodes = new ArrayList<>(elements.size());
    for (IBodyElement element : elements) {
      if (element instanceof XWPFParagraph paragraph) {
        nodes.add(toParagraph(paragraph));
      } else if (element instanceof XWPFTable table) {
        nodes.add(toTable(table));
      } else {
        nodes.add(new UnsupportedNode(element.getElementType().name().toLowerCase(Locale.ROOT)));
      }
    }
    return nodes;
  }

  private ParagraphNode toParagraph(XWPFParagraph paragraph) {
    List<String> runs = new ArrayList<>();
    for (IRunElement run : paragraph.getIRuns()) {
      if (run instanceof XWPFRun textRun) {
        runs.add(textRun.text());
      } else {
        log.debug("Ignoring non-text run element: {}", run.getClass().getSimpleName());
      }
    }
    return new ParagraphNode(runs);
  }

  private TableNode toTable(XWPFTable table) {
    List<TableRowNode> rows = new ArrayList<>();
    for (XWPFTableRow row : table.getRows()) {
      List<TableCellNode> cells = new ArrayList<>();
      for (XWPFTableCell cell : row.getTableCells()) {
        cells.add(new TableCellNode(toNodes(cell.getBodyElements())));
      }
      rows.add(new TableRowNode(cells));
    }
    return new TableNode(rows);
  }
}
