package com.flamingo.ai.studystructure.service.structure;

import com.flamingo.ai.studystructure.config.StructureConfig;
import com.flamingo.ai.studystructure.service.structure.model.Chapter;
import com.flamingo.ai.studystructure.service.structure.model.PageContent;
import com.flamingo.ai.studystructure.service.structure.model.Section;
import com.flamingo.ai.studystructure.service.structure.model.TextRun;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Builds a {@link Chapter} from a contiguous slice of pages. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChapterProcessor {

  static final String DEFAULT_TITLE = "Chapter";

  private final StructureConfig structureConfig;
  private final SectionSplitter sectionSplitter;
  private final ConceptExtractor conceptExtractor;
  private final TokenEstimator tokenEstimator;

  /**
   * Processes one chapter.
   *
   * @param pages the chapter's pages, non-empty, in order
   * @param startPageNumber 1-based page number of {@code pages.get(0)}
   * @param chapterId id of the chapter, used as prefix of its section ids
   * @return the chapter with its sections
   */
  public Chapter process(List<PageContent> pages, int startPageNumber, String chapterId) {
    String title = deriveTitle(pages.get(0));

    List<SectionSplitter.RawSection> rawSections = sectionSplitter.split(pages);
    List<Section> sections = new ArrayList<>(rawSections.size());
    int chapterTokens = 0;

    for (int i = 0; i < rawSections.size(); i++) {
      SectionSplitter.RawSection raw = rawSections.get(i);
      int sectionTokens = tokenEstimator.estimate(raw.content());
      sections.add(
          new Section(
              chapterId + "-section-" + i,
              raw.title().isEmpty() ? "Section " + (i + 1) : raw.title(),
              raw.content(),
              List.of(),
              startPageNumber + raw.startPage(),
              startPageNumber + raw.endPage(),
              conceptExtractor.extractConcepts(raw.content()),
              sectionTokens));
      chapterTokens += sectionTokens;
    }

    int endPageNumber = startPageNumber + pages.size() - 1;
    log.debug(
        "Chapter {} '{}' pages {}-{}: {} sections, ~{} tokens",
        chapterId,
        title,
        startPageNumber,
        endPageNumber,
        sections.size(),
        chapterTokens);
    return new Chapter(chapterId, title, sections, startPageNumber, endPageNumber, chapterTokens);
  }

  private String deriveTitle(PageContent firstPage) {
    StructureConfig.Headings headings = structureConfig.getHeadings();
    String candidate =
        firstPage.runs().stream()
            .filter(run -> run.fontSize() > headings.getChapterTitleMinFontSize())
            .map(TextRun::text)
            .collect(Collectors.joining(" "))
            .trim();
    if (candidate.isEmpty()) {
      return DEFAULT_TITLE;
    }
    int maxLength = headings.getMaxTitleLength();
    return candidate.length() > maxLength ? candidate.substring(0, maxLength) : candidate;
  }
}
