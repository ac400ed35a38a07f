package com.flamingo.ai.studystructure.service.structure.model;

/** Which signal decided where chapters start. */
public enum BoundarySource {
  /** Top-level bookmarks. */
  OUTLINE,
  /** Keyword headings in the dominant heading font. */
  HEADING_FONT,
  /** No usable signal; the document is a single chapter. */
  NONE;

  public String tagValue() {
    return name().toLowerCase();
  }
}
