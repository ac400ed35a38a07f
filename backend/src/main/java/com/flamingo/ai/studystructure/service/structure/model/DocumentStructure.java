package com.flamingo.ai.studystructure.service.structure.model;

import java.util.List;

/**
 * The inferred outline of a document.
 *
 * <p>Chapters partition {@code [1, totalPages]} without gaps or overlaps.
 *
 * @param title document title, {@code "Untitled Document"} when the document declares none
 * @param author document author; may be {@code null}
 * @param chapters chapters in page order
 * @param tableOfContents the document's bookmarks, flattened
 * @param totalPages number of pages
 * @param estimatedTokens sum of the chapters' estimates
 */
public record DocumentStructure(
    String title,
    String author,
    List<Chapter> chapters,
    List<TocEntry> tableOfContents,
    int totalPages,
    int estimatedTokens) {

  public DocumentStructure {
    chapters = List.copyOf(chapters);
    tableOfContents = List.copyOf(tableOfContents);
  }
}
