package com.flamingo.ai.studystructure.service.structure.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Text and layout of one physical page.
 *
 * @param pageNumber 1-based page number
 * @param text the page's runs joined by single spaces
 * @param runs glyph runs in content order
 */
public record PageContent(int pageNumber, String text, List<TextRun> runs) {

  public PageContent {
    runs = List.copyOf(runs);
  }

  /** Builds a page whose text is derived from its runs. */
  public static PageContent of(int pageNumber, List<TextRun> runs) {
    String text = runs.stream().map(TextRun::text).collect(Collectors.joining(" "));
    return new PageContent(pageNumber, text, runs);
  }
}
