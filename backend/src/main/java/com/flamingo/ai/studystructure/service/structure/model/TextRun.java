package com.flamingo.ai.studystructure.service.structure.model;

/**
 * A run of glyphs sharing one font and size on a single text line.
 *
 * @param text the run's text, trimmed
 * @param x horizontal origin in PDF user space
 * @param y baseline in PDF user space (origin bottom-left)
 * @param width advance width of the run
 * @param height tallest glyph height in the run
 * @param fontSize scale magnitude of the text-rendering matrix
 * @param fontName font name as reported by the document, {@code "unknown"} when absent
 */
public record TextRun(
    String text, float x, float y, float width, float height, float fontSize, String fontName) {

  public static final String UNKNOWN_FONT = "unknown";

  public TextRun {
    text = text != null ? text : "";
    fontName = fontName == null || fontName.isBlank() ? UNKNOWN_FONT : fontName;
  }
}
