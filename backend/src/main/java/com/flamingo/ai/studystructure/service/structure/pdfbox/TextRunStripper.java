package com.flamingo.ai.studystructure.service.structure.pdfbox;

import com.flamingo.ai.studystructure.service.structure.model.TextRun;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.apache.pdfbox.util.Matrix;

/**
 * Collects {@link TextRun}s during PDFTextStripper traversal.
 *
 * <p>A run ends at a line break or where the font name or size changes. Word gaps inside a run
 * become single spaces. Positions are taken from the text-rendering matrix, so they are in PDF user
 * space.
 */
final class TextRunStripper extends PDFTextStripper {

  private static final float SIZE_EPSILON = 0.01f;

  private final List<TextRun> runs = new ArrayList<>();
  private final StringBuilder text = new StringBuilder();
  private String fontName;
  private float fontSize;
  private float x;
  private float y;
  private float endX;
  private float height;
  private boolean pendingSpace;

  TextRunStripper() throws IOException {
    super();
  }

  @Override
  protected void writeString(String string, List<TextPosition> textPositions) throws IOException {
    for (TextPosition position : textPositions) {
      String name = fontNameOf(position);
      float size = fontSizeOf(position);
      if (text.length() > 0
          && (!name.equals(fontName) || Math.abs(size - fontSize) > SIZE_EPSILON)) {
        flushRun();
      }

      Matrix matrix = position.getTextMatrix();
      if (text.length() == 0) {
        fontName = name;
        fontSize = size;
        x = matrix.getTranslateX();
        y = matrix.getTranslateY();
        height = 0;
      } else if (pendingSpace) {
        text.append(' ');
      }
      pendingSpace = false;

      String unicode = position.getUnicode();
      if (unicode != null) {
        text.append(unicode);
      }
      endX = matrix.getTranslateX() + position.getWidth();
      height = Math.max(height, position.getHeight());
    }
    super.writeString(string, textPositions);
  }

  @Override
  protected void writeWordSeparator() throws IOException {
    if (text.length() > 0) {
      pendingSpace = true;
    }
    super.writeWordSeparator();
  }

  @Override
  protected void writeLineSeparator() throws IOException {
    flushRun();
    super.writeLineSeparator();
  }

  @Override
  protected void endPage(PDPage page) throws IOException {
    flushRun();
    super.endPage(page);
  }

  List<TextRun> getRuns() {
    return List.copyOf(runs);
  }

  private void flushRun() {
    String runText = text.toString().trim();
    if (!runText.isEmpty()) {
      runs.add(new TextRun(runText, x, y, endX - x, height, fontSize, fontName));
    }
    text.setLength(0);
    pendingSpace = false;
  }

  private static float fontSizeOf(TextPosition position) {
    Matrix matrix = position.getTextMatrix();
    return (float) Math.hypot(matrix.getScaleX(), matrix.getShearY());
  }

  private static String fontNameOf(TextPosition position) {
    if (position.getFont() == null || position.getFont().getName() == null) {
      return TextRun.UNKNOWN_FONT;
    }
    return position.getFont().getName();
  }
}
