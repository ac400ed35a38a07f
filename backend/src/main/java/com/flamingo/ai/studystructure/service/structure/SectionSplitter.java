package com.flamingo.ai.studystructure.service.structure;

import com.flamingo.ai.studystructure.config.StructureConfig;
import com.flamingo.ai.studystructure.service.structure.model.PageContent;
import com.flamingo.ai.studystructure.service.structure.model.TextRun;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Partitions a chapter's pages into sections.
 *
 * <p>A page opens a new section when one of its runs is a heading candidate: larger than the
 * section heading threshold and either decimal-numbered ({@code 2.3 ...}) or entirely upper case.
 * Pages without a candidate extend the open section. A heading only opens a section once the open
 * section has content, so a candidate on the chapter's first page does not become a title.
 *
 * <p>Chapters in which no page carries a candidate yield one {@code "Content"} section spanning the
 * whole chapter.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SectionSplitter {

  static final String FALLBACK_TITLE = "Content";

  private static final Pattern DECIMAL_HEADING = Pattern.compile("^\\d+\\.\\d+");
  private static final Pattern ALL_CAPS_HEADING =
      Pattern.compile("[A-Z][A-Z\\s]+", Pattern.UNICODE_CHARACTER_CLASS);

  private final StructureConfig structureConfig;

  /**
   * Splits pages into sections.
   *
   * @param pages the chapter's pages, non-empty, in order
   * @return sections with page offsets relative to {@code pages}; never empty
   */
  public List<RawSection> split(List<PageContent> pages) {
    List<TextRun> headings =
        pages.stream().map(this::findHeadingCandidate).collect(Collectors.toList());
    if (headings.stream().allMatch(Objects::isNull)) {
      return List.of(wholeChapter(pages));
    }

    List<RawSection> sections = new ArrayList<>();
    String title = "";
    StringBuilder content = new StringBuilder();
    int startPage = 0;
    int endPage = 0;

    for (int i = 0; i < pages.size(); i++) {
      PageContent page = pages.get(i);
      TextRun heading = headings.get(i);

      if (heading != null && content.length() > 0) {
        sections.add(new RawSection(title, content.toString(), startPage, endPage));
        title = heading.text();
        content = new StringBuilder(page.text());
        startPage = i;
        endPage = i;
      } else {
        content.append('\n').append(page.text());
        endPage = i;
      }
    }

    if (content.length() > 0) {
      sections.add(new RawSection(title, content.toString(), startPage, endPage));
    }
    log.debug("Split {} pages into {} sections", pages.size(), sections.size());
    return sections;
  }

  private TextRun findHeadingCandidate(PageContent page) {
    float minFontSize = structureConfig.getHeadings().getSectionHeadingMinFontSize();
    for (TextRun run : page.runs()) {
      if (run.fontSize() > minFontSize && isHeadingText(run.text())) {
        return run;
      }
    }
    return null;
  }

  private static boolean isHeadingText(String text) {
    return DECIMAL_HEADING.matcher(text).find() || ALL_CAPS_HEADING.matcher(text).matches();
  }

  private static RawSection wholeChapter(List<PageContent> pages) {
    String content = pages.stream().map(PageContent::text).collect(Collectors.joining("\n"));
    return new RawSection(FALLBACK_TITLE, content, 0, pages.size() - 1);
  }

  /**
   * A section before ids, default titles and absolute page numbers are assigned.
   *
   * @param title heading text, empty when the section has no heading
   * @param content page texts of the section
   * @param startPage first page, relative to the chapter's first page
   * @param endPage last page, relative and inclusive
   */
  public record RawSection(String title, String content, int startPage, int endPage) {}
}
