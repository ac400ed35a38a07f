package com.flamingo.ai.studystructure.service.structure.model;

import java.util.List;

/**
 * A top-level division of the document.
 *
 * @param id {@code chapter-<n>}
 * @param title text of the large-font runs on the first page, or {@code "Chapter"}
 * @param sections non-empty, in page order
 * @param startPage first page, 1-based
 * @param endPage last page, 1-based, inclusive
 * @param estimatedTokens sum of the sections' estimates
 */
public record Chapter(
    String id,
    String title,
    List<Section> sections,
    int startPage,
    int endPage,
    int estimatedTokens) {

  public Chapter {
    sections = List.copyOf(sections);
  }
}
