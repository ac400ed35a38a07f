package com.flamingo.ai.studystructure.service.structure.model;

import java.util.List;

/**
 * Zero-based page indices at which chapters begin.
 *
 * @param startIndices ascending and duplicate-free; starts with 0 unless the document is empty
 * @param source the signal that produced the boundaries
 */
public record ChapterBoundaries(List<Integer> startIndices, BoundarySource source) {

  public ChapterBoundaries {
    startIndices = List.copyOf(startIndices);
  }

  public int chapterCount() {
    return startIndices.size();
  }

  /** Returns the first page index of chapter {@code i}. */
  public int startOf(int i) {
    return startIndices.get(i);
  }

  /** Returns the last page index (inclusive) of chapter {@code i}. */
  public int endOf(int i, int pageCount) {
    return i < startIndices.size() - 1 ? startIndices.get(i + 1) - 1 : pageCount - 1;
  }
}
