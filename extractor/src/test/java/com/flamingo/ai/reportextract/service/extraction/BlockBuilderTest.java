package com.flamingo.ai.reportextract.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;

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
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("BlockBuilder Tests")
class BlockBuilderTest {

  private final BlockBuilder builder = new BlockBuilder();

  @Test
  @DisplayName("should concatenate paragraph runs without separators")
  void shouldConcatenateRuns() {
    List<Block> blocks = builder.build(List.of(ParagraphNode.of("AREAS OF ", "GOOD", " PRACTICE")));

    assertThat(blocks).containsExactly(new ParagraphBlock("AREAS OF GOOD PRACTICE"));
  }

  @Test
  @DisplayName("should drop blank paragraphs and skip unsupported nodes")
  void shouldDropBlankAndUnsupported() {
    List<ContentNode> tree =
        List.of(
            ParagraphNode.of("  ", "\t"),
            new UnsupportedNode("sdt"),
            ParagraphNode.of(),
            ParagraphNode.of("CONCLUSION"));

    assertThat(builder.build(tree)).containsExactly(new ParagraphBlock("CONCLUSION"));
  }

  @Test
  @DisplayName("should keep block order across paragraphs and tables")
  void shouldKeepReadingOrder() {
    List<ContentNode> tree =
        List.of(
            ParagraphNode.of("CONCLUSION"),
            TableNode.of(
                TableRowNode.of(TableCellNode.text("All good"), TableCellNode.text(""))),
            ParagraphNode.of("Signed"));

    List<Block> blocks = builder.build(tree);

    assertThat(blocks)
        .containsExactly(
            new ParagraphBlock("CONCLUSION"),
            new TableBlock(List.of(new TableRow("All good", ""))),
            new ParagraphBlock("Signed"));
  }

  @Test
  @DisplayName("should cap rows at two cells")
  void shouldCapRowsAtTwoCells() {
    TableNode table =
        TableNode.of(
            TableRowNode.of(
                TableCellNode.text("PROVINCE"),
                TableCellNode.text("Western Cape"),
                TableCellNode.text("ignored")));

    assertThat(builder.build(List.of(table)))
        .containsExactly(new TableBlock(List.of(new TableRow("PROVINCE", "Western Cape"))));
  }

  @Test
  @DisplayName("should pad single-cell rows and drop empty rows and empty tables")
  void shouldPadSingleCellRowsAndDropEmpty() {
    TableNode withContent =
        TableNode.of(
            TableRowNode.of(TableCellNode.text("RECOMMENDATIONS")),
            TableRowNode.of(TableCellNode.text(" "), TableCellNode.text("")),
            TableRowNode.of());
    TableNode empty = TableNode.of(TableRowNode.of(TableCellNode.text(""), TableCellNode.text("")));

    assertThat(builder.build(List.of(withContent, empty)))
        .containsExactly(new TableBlock(List.of(new TableRow("RECOMMENDATIONS", ""))));
  }

  @Test
  @DisplayName("should join a cell's non-blank paragraphs with newlines")
  void shouldJoinCellParagraphs() {
    TableNode table =
        TableNode.of(
            TableRowNode.of(
                TableCellNode.text("SCHOOL"),
                TableCellNode.text("Test High", "", "Other High")));

    assertThat(builder.build(List.of(table)))
        .containsExactly(new TableBlock(List.of(new TableRow("SCHOOL", "Test High\nOther High"))));
  }

  @Test
  @DisplayName("should flatten nested tables right after the parent row")
  void shouldFlattenNestedTables() {
    TableNode nested =
        TableNode.of(
            TableRowNode.of(TableCellNode.text("x1"), TableCellNode.text("y1")),
            TableRowNode.of(TableCellNode.text("x2"), TableCellNode.text("y2")));
    TableNode table =
        TableNode.of(
            TableRowNode.of(
                TableCellNode.text("SUBJECT"),
                TableCellNode.of(ParagraphNode.of("Physics"), nested)),
            TableRowNode.of(TableCellNode.text("after"), TableCellNode.text("")));

    List<Block> blocks = builder.build(List.of(table));

    assertThat(blocks).hasSize(1);
    assertThat(((TableBlock) blocks.get(0)).rows())
        .containsExactly(
            new TableRow("SUBJECT", "Physics"),
            new TableRow("x1", "y1"),
            new TableRow("x2", "y2"),
            new TableRow("after", ""));
  }

  @Test
  @DisplayName("should keep a table whose only content is a nested table")
  void shouldKeepTableWithOnlyNestedContent() {
    TableNode nested = TableNode.of(TableRowNode.of(TableCellNode.text("inner")));
    TableNode table = TableNode.of(TableRowNode.of(TableCellNode.of(nested)));

    assertThat(builder.build(List.of(table)))
        .containsExactly(new TableBlock(List.of(new TableRow("inner", ""))));
  }
}
