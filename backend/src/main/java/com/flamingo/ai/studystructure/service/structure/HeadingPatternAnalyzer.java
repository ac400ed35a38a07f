package com.flamingo.ai.studystructure.service.structure;

import com.flamingo.ai.studystructure.service.structure.model.HeadingPatterns;
import com.flamingo.ai.studystructure.service.structure.model.HeadingSignature;
import com.flamingo.ai.studystructure.service.structure.model.PageContent;
import com.flamingo.ai.studystructure.service.structure.model.TextRun;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Derives chapter and section heading signatures from document-wide font usage.
 *
 * <p>Every run is bucketed by {@code (fontSize rounded to 0.1, fontName)}. The bucket with the
 * largest size is taken as the chapter heading signature and the next one as the section heading
 * signature; equal sizes are ordered by font name. This assumes headings use the largest fonts, which
 * does not hold for documents whose body text is set larger than their headings.
 */
@Service
@Slf4j
public class HeadingPatternAnalyzer {

  private static final Comparator<HeadingSignature> LARGEST_FIRST =
      Comparator.comparing(HeadingSignature::fontSize)
          .reversed()
          .thenComparing(HeadingSignature::fontName);

  /**
   * Analyzes font usage across all pages.
   *
   * @param pages pages in document order
   * @return the heading signatures; both {@code null} when the pages carry no text runs
   */
  public HeadingPatterns analyze(List<PageContent> pages) {
    Map<HeadingSignature, Integer> fontStats = new HashMap<>();
    for (PageContent page : pages) {
      for (TextRun run : page.runs()) {
        HeadingSignature key = new HeadingSignature(roundToTenth(run.fontSize()), run.fontName());
        fontStats.merge(key, 1, Integer::sum);
      }
    }

    if (fontStats.isEmpty()) {
      log.debug("No text runs found, heading patterns unavailable");
      return HeadingPatterns.none();
    }

    List<HeadingSignature> sorted =
        fontStats.keySet().stream().sorted(LARGEST_FIRST).collect(Collectors.toList());
    HeadingSignature chapterPattern = sorted.get(0);
    HeadingSignature sectionPattern = sorted.size() > 1 ? sorted.get(1) : null;

    log.debug(
        "Heading signatures from {} font buckets - chapter: {} ({} runs), section: {}",
        fontStats.size(),
        chapterPattern,
        fontStats.get(chapterPattern),
        sectionPattern);
    return new HeadingPatterns(chapterPattern, sectionPattern);
  }

  static float roundToTenth(float fontSize) {
    return Math.round(fontSize * 10f) / 10f;
  }
}
