package com.flamingo.ai.studystructure.service.structure;

import com.flamingo.ai.studystructure.config.StructureConfig;
import com.flamingo.ai.studystructure.service.structure.model.BoundarySource;
import com.flamingo.ai.studystructure.service.structure.model.ChapterBoundaries;
import com.flamingo.ai.studystructure.service.structure.model.HeadingPatterns;
import com.flamingo.ai.studystructure.service.structure.model.HeadingSignature;
import com.flamingo.ai.studystructure.service.structure.model.PageContent;
import com.flamingo.ai.studystructure.service.structure.model.TextRun;
import com.flamingo.ai.studystructure.service.structure.model.TocEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Decides the zero-based page indices at which chapters begin.
 *
 * <p>Policy, in priority order:
 *
 * <ol>
 *   <li>Top-level bookmarks (level 0) each start a chapter at their target page.
 *   <li>Otherwise, a page starts a chapter when it carries a run in the chapter heading signature
 *       (size within tolerance, same font) reading "Chapter n", "Section n" or "Part n".
 *   <li>Otherwise the whole document is one chapter.
 * </ol>
 *
 * <p>Page 0 always starts the first chapter.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChapterBoundaryDetector {

  private static final Pattern CHAPTER_KEYWORD =
      Pattern.compile("^(Chapter|Section|Part)\\s+\\d+", Pattern.CASE_INSENSITIVE);

  private final StructureConfig structureConfig;

  /**
   * Detects chapter boundaries.
   *
   * @param pages pages in document order
   * @param tableOfContents flattened bookmarks
   * @param headingPatterns heading signatures of the document
   * @return ascending, duplicate-free boundaries; empty only when there are no pages
   */
  public ChapterBoundaries detect(
      List<PageContent> pages, List<TocEntry> tableOfContents, HeadingPatterns headingPatterns) {
    if (pages.isEmpty()) {
      return new ChapterBoundaries(List.of(), BoundarySource.NONE);
    }

    SortedSet<Integer> boundaries = new TreeSet<>();
    boundaries.add(0);

    List<TocEntry> chapterEntries =
        tableOfContents.stream().filter(entry -> entry.level() == 0).collect(Collectors.toList());

    BoundarySource source;
    if (!chapterEntries.isEmpty()) {
      source = BoundarySource.OUTLINE;
      for (TocEntry entry : chapterEntries) {
        int index = entry.pageNumber() - 1;
        if (index < 0 || index >= pages.size()) {
          log.debug(
              "Ignoring bookmark '{}' pointing outside the document (page {})",
              entry.title(),
              entry.pageNumber());
          continue;
        }
        boundaries.add(index);
      }
    } else if (headingPatterns.hasChapterPattern()) {
      source = BoundarySource.HEADING_FONT;
      HeadingSignature chapterPattern = headingPatterns.chapterPattern();
      for (int i = 1; i < pages.size(); i++) {
        if (hasChapterHeading(pages.get(i), chapterPattern)) {
          boundaries.add(i);
        }
      }
    } else {
      source = BoundarySource.NONE;
    }

    log.debug("Chapter boundaries from {}: {}", source, boundaries);
    return new ChapterBoundaries(new ArrayList<>(boundaries), source);
  }

  private boolean hasChapterHeading(PageContent page, HeadingSignature chapterPattern) {
    float tolerance = structureConfig.getHeadings().getPatternSizeTolerance();
    for (TextRun run : page.runs()) {
      if (Math.abs(run.fontSize() - chapterPattern.fontSize()) < tolerance
          && run.fontName().equals(chapterPattern.fontName())
          && CHAPTER_KEYWORD.matcher(run.text()).find()) {
        return true;
      }
    }
    return false;
  }
}
