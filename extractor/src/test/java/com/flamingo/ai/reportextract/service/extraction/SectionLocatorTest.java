package com.flamingo.ai.reportextract.service.extraction;

import static com.flamingo.ai.reportextract.ProfileFixtures.SECTION_TERMS;
import static com.flamingo.ai.reportextract.service.extraction.HeaderLocatorTest.table;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.reportextract.config.ExtractionConfig;
import com.flamingo.ai.reportextract.exception.MalformedScanException;
import com.flamingo.ai.reportextract.service.extraction.model.Block;
import com.flamingo.ai.reportextract.service.extraction.model.ParagraphBlock;
import com.flamingo.ai.reportextract.service.extraction.model.SectionValues;
import com.flamingo.ai.reportextract.service.extraction.model.Term;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SectionLocator Tests")
class SectionLocatorTest {

  private static final String INTERVENTION = "AREAS THAT REQUIRE INTERVENTION AND SUPPORT";

  private SectionLocator locator;

  @BeforeEach
  void setUp() {
    locator = new SectionLocator(new ExtractionConfig());
  }

  private static ParagraphBlock paragraph(String text) {
    return new ParagraphBlock(text);
  }

  @Nested
  @DisplayName("heading paragraphs")
  class HeadingParagraphs {

    @Test
    @DisplayName("should take the table following an exact heading")
    void shouldTakeFollowingTable() {
      List<Block> blocks = List.of(paragraph("CONCLUSION"), table("All good", ""));

      assertThat(locator.locate(blocks, SECTION_TERMS).get("CONCLUSION")).isEqualTo("All good");
    }

    @Test
    @DisplayName("should join the following table's non-empty cells row by row")
    void shouldJoinFollowingTableCells() {
      List<Block> blocks =
          List.of(
              paragraph("RECOMMENDATIONS FOR IMPROVEMENT"),
              table("1.", " Train teachers ", "", "", "2.", "Buy books"));

      assertThat(locator.locate(blocks, SECTION_TERMS).get("RECOMMENDATIONS"))
          .isEqualTo("1.\nTrain teachers\n2.\nBuy books");
    }

    @Test
    @DisplayName("should take the following paragraph as is")
    void shouldTakeFollowingParagraph() {
      List<Block> blocks =
          List.of(paragraph("CONCLUSION"), paragraph("The school is compliant."));

      assertThat(locator.locate(blocks, SECTION_TERMS).get("CONCLUSION"))
          .isEqualTo("The school is compliant.");
    }

    @Test
    @DisplayName("should leave a section empty when the next paragraph is another heading")
    void shouldNotTakeNextHeading() {
      List<Block> blocks =
          List.of(
              paragraph("AREAS OF GOOD PRACTICE / INNOVATION"),
              paragraph("CONCLUSION"),
              paragraph("Done."));

      SectionValues sections = locator.locate(blocks, SECTION_TERMS);

      assertThat(sections.get("AREAS OF GOOD PRACTICE / INNOVATION")).isEmpty();
      assertThat(sections.get("CONCLUSION")).isEqualTo("Done.");
    }

    @Test
    @DisplayName("should leave a section empty when its heading is the last block")
    void shouldHandleHeadingAtEnd() {
      List<Block> blocks = List.of(table("x", "y"), paragraph("CONCLUSION"));

      assertThat(locator.locate(blocks, SECTION_TERMS).get("CONCLUSION")).isEmpty();
    }

    @Test
    @DisplayName("should fall back to normalized heading match")
    void shouldMatchNormalizedHeading() {
      List<Block> blocks = List.of(paragraph("Conclusion :"), paragraph("Done."));

      assertThat(locator.locate(blocks, SECTION_TERMS).get("CONCLUSION")).isEqualTo("Done.");
    }

    @Test
    @DisplayName("should prefer an exact heading over an earlier table cell")
    void shouldPreferExactHeading() {
      List<Block> blocks =
          List.of(
              table("CONCLUSION", "from table"),
              paragraph("CONCLUSION"),
              paragraph("from heading"));

      assertThat(locator.locate(blocks, SECTION_TERMS).get("CONCLUSION"))
          .isEqualTo("from heading");
    }
  }

  @Nested
  @DisplayName("shared tables")
  class SharedTables {

    @Test
    @DisplayName("should split a table holding several sections at the other terms")
    void shouldSplitSharedTable() {
      List<Block> blocks =
          List.of(table(INTERVENTION, "x", "filler", "y", "RECOMMENDATIONS", "z"));

      SectionValues sections = locator.locate(blocks, SECTION_TERMS);

      assertThat(sections.get(INTERVENTION)).isEqualTo("x\nfiller\ny");
      assertThat(sections.get("RECOMMENDATIONS")).isEqualTo("z");
    }

    @Test
    @DisplayName("should split consecutive section rows without leaking text")
    void shouldSplitConsecutiveRows() {
      List<Block> blocks =
          List.of(
              table(INTERVENTION, "Support maths", "RECOMMENDATIONS", "Hire a tutor"),
              paragraph("Signed by the moderator"));

      SectionValues sections = locator.locate(blocks, SECTION_TERMS);

      assertThat(sections.get(INTERVENTION)).isEqualTo("Support maths");
      assertThat(sections.get("RECOMMENDATIONS")).isEqualTo("Hire a tutor");
    }

    @Test
    @DisplayName("should stop at any other term, not only the next one in order")
    void shouldStopAtAnyOtherTerm() {
      List<Block> blocks =
          List.of(
              table(
                  "Recommendations for improvement", "a", "CONCLUSION", "b", INTERVENTION, "c"));

      SectionValues sections = locator.locate(blocks, SECTION_TERMS);

      assertThat(sections.get("RECOMMENDATIONS")).isEqualTo("a");
      assertThat(sections.get("CONCLUSION")).isEqualTo("b");
      assertThat(sections.get(INTERVENTION)).isEqualTo("c");
    }

    @Test
    @DisplayName("should trip the scan guard when the bound is exhausted")
    void shouldTripScanGuard() {
      ExtractionConfig config = new ExtractionConfig();
      config.getScan().setBoundFactor(0);
      SectionLocator guarded = new SectionLocator(config);
      List<Block> blocks = List.of(table("CONCLUSION", "All good"));

      assertThatThrownBy(() -> guarded.locate(blocks, SECTION_TERMS))
          .isInstanceOfSatisfying(
              MalformedScanException.class,
              e -> {
                assertThat(e.getTerm()).isEqualTo("CONCLUSION");
                assertThat(e.getPosition()).isEqualTo(1);
              });
    }
  }

  @Nested
  @DisplayName("fallbacks")
  class Fallbacks {

    @Test
    @DisplayName("should strip the value from a paragraph starting with the term")
    void shouldStripInlineParagraph() {
      List<Block> blocks = List.of(paragraph("CONCLUSION: All good"));

      assertThat(locator.locate(blocks, SECTION_TERMS).get("CONCLUSION")).isEqualTo("All good");
    }

    @Test
    @DisplayName("should strip the value from a table cell starting with the term")
    void shouldStripInlineCell() {
      List<Block> blocks = List.of(table("RECOMMENDATIONS: more practicals", ""));

      assertThat(locator.locate(blocks, SECTION_TERMS).get("RECOMMENDATIONS"))
          .isEqualTo("more practicals");
    }

    @Test
    @DisplayName("should not match a paragraph where the term is only the start of a longer word")
    void shouldNotMatchLongerWord() {
      List<Block> blocks = List.of(paragraph("CONCLUSIONS drawn from the sample are positive"));

      assertThat(locator.locate(blocks, SECTION_TERMS).get("CONCLUSION")).isEmpty();
    }

    @Test
    @DisplayName("should return empty strings for every term not found")
    void shouldReturnEmptyForMissingTerms() {
      SectionValues sections = locator.locate(List.of(paragraph("Unrelated text")), SECTION_TERMS);

      assertThat(sections.values().keySet()).containsExactlyElementsOf(SECTION_TERMS);
      assertThat(sections.values().values()).allMatch(String::isEmpty);
    }

    @Test
    @DisplayName("should give the same result on repeated calls")
    void shouldBeIdempotent() {
      List<Block> blocks =
          List.of(
              paragraph("CONCLUSION"),
              table("All good", ""),
              table(INTERVENTION, "x", "RECOMMENDATIONS", "z"));
      List<Term> terms = SECTION_TERMS;

      assertThat(locator.locate(blocks, terms)).isEqualTo(locator.locate(blocks, terms));
    }
  }
}
