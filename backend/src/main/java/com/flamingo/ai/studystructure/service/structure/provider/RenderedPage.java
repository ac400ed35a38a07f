package com.flamingo.ai.studystructure.service.structure.provider;

import com.flamingo.ai.studystructure.service.structure.model.TextRun;
import java.util.List;

/** The text layer of a single page. */
public interface RenderedPage {

  /** Returns the page's glyph runs in content order. */
  List<TextRun> getTextRuns();
}
