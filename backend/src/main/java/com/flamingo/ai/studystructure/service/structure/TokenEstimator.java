package com.flamingo.ai.studystructure.service.structure;

import com.flamingo.ai.studystructure.config.StructureConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** Approximates LLM token cost from character count. */
@Service
@RequiredArgsConstructor
public class TokenEstimator {

  private final StructureConfig structureConfig;

  /**
   * Estimates the number of tokens in a text as {@code ceil(length / charsPerToken)}.
   *
   * @param text the text; {@code null} counts as empty
   * @return the estimate
   */
  public int estimate(String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    int charsPerToken = structureConfig.getTokens().getCharsPerToken();
    return (text.length() + charsPerToken - 1) / charsPerToken;
  }
}
