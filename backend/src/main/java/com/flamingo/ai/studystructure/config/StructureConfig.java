package com.flamingo.ai.studystructure.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for document structure extraction. */
@Configuration
@ConfigurationProperties(prefix = "structure")
@Getter
@Setter
public class StructureConfig {

  private Headings headings = new Headings();
  private Concepts concepts = new Concepts();
  private Tokens tokens = new Tokens();
  private PageRetrieval pageRetrieval = new PageRetrieval();
  private Outline outline = new Outline();

  /**
   * Font-size thresholds used to recognise headings.
   *
   * <p>The defaults were tuned empirically on textbook-style PDFs; changing them changes the
   * detected structure non-trivially.
   */
  @Getter
  @Setter
  public static class Headings {
    /** Runs on a chapter's first page larger than this form the chapter title. */
    private float chapterTitleMinFontSize = 14.0f;

    /** Section heading candidates must be larger than this. */
    private float sectionHeadingMinFontSize = 12.0f;

    /** Maximum size difference (exclusive) between a run and the chapter heading signature. */
    private float patternSizeTolerance = 1.0f;

    private int maxTitleLength = 100;
  }

  @Getter
  @Setter
  public static class Concepts {
    private int maxConcepts = 10;

    /** Shortest accepted term, inclusive. */
    private int minTermLength = 4;
  }

  @Getter
  @Setter
  public static class Tokens {
    private int charsPerToken = 4;
  }

  /** Page text retrieval. Parallelism 1 keeps retrieval on the calling thread. */
  @Getter
  @Setter
  public static class PageRetrieval {
    private int parallelism = 1;
  }

  @Getter
  @Setter
  public static class Outline {
    /** Upper bound on flattened bookmark entries; protects against cyclic outline trees. */
    private int maxEntries = 10_000;
  }
}
