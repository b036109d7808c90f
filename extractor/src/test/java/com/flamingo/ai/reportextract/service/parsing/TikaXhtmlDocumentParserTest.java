package com.flamingo.ai.reportextract.service.parsing;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.reportextract.service.parsing.model.ContentNode;
import com.flamingo.ai.reportextract.service.parsing.model.ParagraphNode;
import com.flamingo.ai.reportextract.service.parsing.model.TableCellNode;
import com.flamingo.ai.reportextract.service.parsing.model.TableNode;
import com.flamingo.ai.reportextract.service.parsing.model.UnsupportedNode;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TikaXhtmlDocumentParser Tests")
class TikaXhtmlDocumentParserTest {

  private TikaXhtmlDocumentParser parser;

  @BeforeEach
  void setUp() {
    parser = new TikaXhtmlDocumentParser();
  }

  private List<ContentNode> parseXhtml(String xhtml) throws Exception {
    String fullXhtml =
        "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
            + "<html xmlns=\"http://www.w3.org/1999/xhtml\"><head><title>t</title></head><body>"
            + xhtml
            + "</body></html>";
    return parser.parseXhtml(fullXhtml.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  @DisplayName("should map paragraphs and headings to paragraph nodes")
  void shouldMapParagraphs() throws Exception {
    List<ContentNode> nodes = parseXhtml("<h1>MODERATION REPORT</h1><p>CONCLUSION</p>");

    assertThat(nodes)
        .containsExactly(ParagraphNode.of("MODERATION REPORT"), ParagraphNode.of("CONCLUSION"));
  }

  @Test
  @DisplayName("should map table rows inside tbody")
  void shouldMapTableRows() throws Exception {
    List<ContentNode> nodes =
        parseXhtml(
            "<table><tbody>"
                + "<tr><td><p>PROVINCE</p></td><td><p>Western Cape</p></td></tr>"
                + "<tr><td>DISTRICT</td><td>West Coast</td></tr>"
                + "</tbody></table>");

    assertThat(nodes).hasSize(1);
    TableNode table = (TableNode) nodes.get(0);
    assertThat(table.rows()).hasSize(2);
    assertThat(table.rows().get(0).cells())
        .containsExactly(TableCellNode.text("PROVINCE"), TableCellNode.text("Western Cape"));
    assertThat(table.rows().get(1).cells())
        .containsExactly(TableCellNode.text("DISTRICT"), TableCellNode.text("West Coast"));
  }

  @Test
  @DisplayName("should keep nested tables inside their cell")
  void shouldKeepNestedTables() throws Exception {
    List<ContentNode> nodes =
        parseXhtml(
            "<table><tr><td><p>SUBJECT</p></td><td><p>Physics</p>"
                + "<table><tr><td>x</td><td>y</td></tr></table>"
                + "</td></tr></table>");

    TableNode table = (TableNode) nodes.get(0);
    TableCellNode cell = table.rows().get(0).cells().get(1);
    assertThat(cell.children()).hasSize(2);
    assertThat(cell.children().get(0)).isEqualTo(ParagraphNode.of("Physics"));
    assertThat(cell.children().get(1)).isInstanceOf(TableNode.class);
    assertThat(((TableNode) cell.children().get(1)).rows().get(0).cells())
        .containsExactly(TableCellNode.text("x"), TableCellNode.text("y"));
  }

  @Test
  @DisplayName("should descend into containers and flag unknown elements")
  void shouldDescendIntoContainers() throws Exception {
    List<ContentNode> nodes =
        parseXhtml("<div><p>inside div</p></div><img src=\"a.png\"/><ul><li>item</li></ul>");

    assertThat(nodes)
        .containsExactly(
            ParagraphNode.of("inside div"), new UnsupportedNode("img"), ParagraphNode.of("item"));
  }

  @Test
  @DisplayName("should support legacy and open word-processing MIME types")
  void shouldSupportWordProcessingTypes() {
    assertThat(parser.supports("application/msword")).isTrue();
    assertThat(parser.supports("application/vnd.oasis.opendocument.text")).isTrue();
    assertThat(parser.supports("application/rtf")).isTrue();
    assertThat(parser.supports(XwpfDocumentParser.DOCX_MIME_TYPE)).isTrue();
    assertThat(parser.supports("application/pdf")).isFalse();
    assertThat(parser.supports(null)).isFalse();
  }
}
