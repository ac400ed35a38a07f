package com.flamingo.ai.studystructure.service.structure.model;

/**
 * Chapter and section heading signatures of a document.
 *
 * @param chapterPattern largest font signature; {@code null} when the document has no text
 * @param sectionPattern second-largest signature; {@code null} when fewer than two exist
 */
public record HeadingPatterns(HeadingSignature chapterPattern, HeadingSignature sectionPattern) {

  private static final HeadingPatterns NONE = new HeadingPatterns(null, null);

  public static HeadingPatterns none() {
    return NONE;
  }

  public boolean hasChapterPattern() {
    return chapterPattern != null;
  }
}
