package com.flamingo.ai.studystructure.service.structure;

import com.flamingo.ai.studystructure.config.StructureConfig;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Mines candidate domain terms from section text using definition phrasing.
 *
 * <p>Recognised forms: "X is defined as", "X refers to", "The term X" (any case) and "X: Capital"
 * (case-sensitive). Terms keep first-seen order and are de-duplicated exactly (case-sensitive).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConceptExtractor {

  private static final List<Pattern> DEFINITION_PATTERNS =
      List.of(
          Pattern.compile("(\\w+)\\s+is\\s+defined\\s+as", Pattern.CASE_INSENSITIVE),
          Pattern.compile("(\\w+)\\s+refers\\s+to", Pattern.CASE_INSENSITIVE),
          Pattern.compile("The\\s+term\\s+(\\w+)", Pattern.CASE_INSENSITIVE),
          Pattern.compile("(\\w+):\\s+[A-Z]"));

  private final StructureConfig structureConfig;

  /**
   * Extracts up to {@code maxConcepts} terms from the given content.
   *
   * @param content section text; may be {@code null}
   * @return distinct terms in first-seen order, empty if none were found or extraction failed
   */
  public List<String> extractConcepts(String content) {
    if (content == null || content.isEmpty()) {
      return List.of();
    }
    try {
      StructureConfig.Concepts config = structureConfig.getConcepts();
      Set<String> concepts = new LinkedHashSet<>();
      for (Pattern pattern : DEFINITION_PATTERNS) {
        Matcher matcher = pattern.matcher(content);
        while (matcher.find()) {
          String term = matcher.group(1);
          if (term != null && term.length() >= config.getMinTermLength()) {
            concepts.add(term);
          }
        }
      }
      return concepts.stream().limit(config.getMaxConcepts()).collect(Collectors.toList());
    } catch (RuntimeException e) {
      log.warn("Concept extraction failed, continuing without concepts: {}", e.getMessage());
      return List.of();
    }
  }
}
