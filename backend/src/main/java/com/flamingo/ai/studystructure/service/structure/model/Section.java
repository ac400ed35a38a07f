package com.flamingo.ai.studystructure.service.structure.model;

import java.util.List;

/**
 * A contiguous run of pages inside a chapter.
 *
 * @param id {@code <chapterId>-section-<n>}
 * @param title heading text, {@code "Section <n+1>"} when none was detected
 * @param content text of the covered pages, separated by newlines
 * @param subsections always empty; sections are single-level
 * @param startPage first covered page, 1-based
 * @param endPage last covered page, 1-based, inclusive
 * @param concepts at most ten distinct terms in first-seen order
 * @param estimatedTokens token estimate of {@code content}
 */
public record Section(
    String id,
    String title,
    String content,
    List<Section> subsections,
    int startPage,
    int endPage,
    List<String> concepts,
    int estimatedTokens) {

  public Section {
    subsections = List.copyOf(subsections);
    concepts = List.copyOf(concepts);
  }
}
