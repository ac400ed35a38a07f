package com.flamingo.ai.studystructure.service.structure;

import static com.flamingo.ai.studystructure.service.structure.StructureTestData.HEADING_FONT;
import static com.flamingo.ai.studystructure.service.structure.StructureTestData.body;
import static com.flamingo.ai.studystructure.service.structure.StructureTestData.bodyPages;
import static com.flamingo.ai.studystructure.service.structure.StructureTestData.page;
import static com.flamingo.ai.studystructure.service.structure.StructureTestData.run;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.flamingo.ai.studystructure.config.StructureConfig;
import com.flamingo.ai.studystructure.service.structure.SectionSplitter.RawSection;
import com.flamingo.ai.studystructure.service.structure.model.PageContent;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link SectionSplitter}. */
class SectionSplitterTest {

  private final SectionSplitter splitter = new SectionSplitter(new StructureConfig());

  @Test
  @DisplayName("Chapter without heading candidates becomes a single Content section")
  void shouldReturnContentSection_whenNoHeadingCandidates() {
    List<RawSection> sections = splitter.split(bodyPages(3));

    assertThat(sections)
        .containsExactly(new RawSection("Content", "Page 1\nPage 2\nPage 3", 0, 2));
  }

  @Test
  void shouldReturnContentSection_forPageWithoutText() {
    assertThat(splitter.split(List.of(page(1))))
        .containsExactly(new RawSection("Content", "", 0, 0));
  }

  @Test
  void shouldSplit_atDecimalAndUppercaseHeadings() {
    List<PageContent> pages =
        List.of(
            page(1, body("Opening text")),
            page(2, run("1.1 Cells", 16f, HEADING_FONT), body("Cells are small")),
            page(3, body("More on cells")),
            page(4, run("SUMMARY", 14f, HEADING_FONT), body("Wrap up")));

    List<RawSection> sections = splitter.split(pages);

    assertThat(sections).extracting(RawSection::title).containsExactly("", "1.1 Cells", "SUMMARY");
    assertThat(sections)
        .extracting(RawSection::startPage, RawSection::endPage)
        .containsExactly(
            tuple(0, 0),
            tuple(1, 2),
            tuple(3, 3));
    assertThat(sections.get(1).content()).isEqualTo("1.1 Cells Cells are small\nMore on cells");
  }

  @Test
  void shouldNotOpenSection_forHeadingOnFirstPage() {
    List<PageContent> pages =
        List.of(
            page(1, run("1.1 Start", 16f, HEADING_FONT), body("a")),
            page(2, body("b")),
            page(3, run("1.2 Next", 16f, HEADING_FONT), body("c")));

    List<RawSection> sections = splitter.split(pages);

    assertThat(sections).extracting(RawSection::title).containsExactly("", "1.2 Next");
    assertThat(sections.get(0).content()).isEqualTo("\n1.1 Start a\nb");
    assertThat(sections.get(0).endPage()).isEqualTo(1);
  }

  @Test
  void shouldIgnoreHeadingPatterns_atOrBelowSizeThreshold() {
    List<PageContent> pages =
        List.of(page(1, body("intro")), page(2, run("2.1 Small", 12f, HEADING_FONT)));

    assertThat(splitter.split(pages)).extracting(RawSection::title).containsExactly("Content");
  }

  @Test
  void shouldRequireWholeRunUppercase_forUppercaseHeadings() {
    List<PageContent> pages =
        List.of(page(1, body("intro")), page(2, run("SUMMARY of results", 16f, HEADING_FONT)));

    assertThat(splitter.split(pages)).extracting(RawSection::title).containsExactly("Content");
  }

  @Test
  void shouldAcceptUppercaseHeading_withNoBreakSpace() {
    List<PageContent> pages =
        List.of(page(1, body("intro")), page(2, run("KEY\u00A0TERMS", 16f, HEADING_FONT)));

    assertThat(splitter.split(pages))
        .extracting(RawSection::title)
        .containsExactly("", "KEY\u00A0TERMS");
  }

  @Test
  void shouldCoverEveryPage_exactlyOnce() {
    List<PageContent> pages =
        List.of(
            page(1, body("a")),
            page(2, run("INTRODUCTION", 18f, HEADING_FONT)),
            page(3, run("2.1 Details", 18f, HEADING_FONT)),
            page(4, body("b")),
            page(5, run("2.2 More", 18f, HEADING_FONT)));

    List<RawSection> sections = splitter.split(pages);

    int expectedStart = 0;
    for (RawSection section : sections) {
      assertThat(section.startPage()).isEqualTo(expectedStart);
      assertThat(section.endPage()).isGreaterThanOrEqualTo(section.startPage());
      expectedStart = section.endPage() + 1;
    }
    assertThat(expectedStart).isEqualTo(pages.size());
  }
}
