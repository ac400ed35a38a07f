package com.flamingo.ai.studystructure.service.structure;

import com.flamingo.ai.studystructure.service.structure.model.Chapter;
import com.flamingo.ai.studystructure.service.structure.model.ChapterBoundaries;
import com.flamingo.ai.studystructure.service.structure.model.DocumentStructure;
import com.flamingo.ai.studystructure.service.structure.model.HeadingPatterns;
import com.flamingo.ai.studystructure.service.structure.model.PageContent;
import com.flamingo.ai.studystructure.service.structure.model.TocEntry;
import com.flamingo.ai.studystructure.service.structure.provider.DocumentMetadata;
import com.flamingo.ai.studystructure.service.structure.provider.DocumentSource;
import com.flamingo.ai.studystructure.service.structure.provider.DocumentSourceFactory;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Infers the chapter and section outline of a document.
 *
 * <p>Pipeline: metadata, bookmarks and pages are read from the document; heading signatures are
 * derived from font statistics; chapter boundaries come from top-level bookmarks or, failing that,
 * from keyword headings in the chapter heading font; each chapter is then split into sections.
 *
 * <p>Each call owns all of its intermediate state, so a single instance serves concurrent callers.
 * Provider failures propagate unchanged and no partial structure is ever returned.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentStructureExtractor {

  private final DocumentSourceFactory documentSourceFactory;
  private final TableOfContentsFlattener tableOfContentsFlattener;
  private final PageCollector pageCollector;
  private final HeadingPatternAnalyzer headingPatternAnalyzer;
  private final ChapterBoundaryDetector chapterBoundaryDetector;
  private final ChapterProcessor chapterProcessor;
  private final StructureAssembler structureAssembler;
  private final MeterRegistry meterRegistry;

  /**
   * Extracts the structure of a document.
   *
   * @param documentBytes raw document bytes
   * @return the document structure
   * @throws IllegalArgumentException if {@code documentBytes} is null or empty
   * @throws com.flamingo.ai.studystructure.exception.DocumentProviderException if the document
   *     cannot be read
   */
  @Timed(value = "structure.extract", description = "Time to extract document structure")
  public DocumentStructure extractStructure(byte[] documentBytes) {
    if (documentBytes == null || documentBytes.length == 0) {
      throw new IllegalArgumentException("Document bytes must not be empty");
    }
    try (DocumentSource source = documentSourceFactory.open(documentBytes)) {
      return extractStructure(source);
    }
  }

  /**
   * Extracts the structure of an already opened document. The caller keeps ownership of {@code
   * source}.
   *
   * @param source the opened document
   * @return the document structure
   */
  public DocumentStructure extractStructure(DocumentSource source) {
    DocumentMetadata metadata = source.getMetadata();
    List<TocEntry> tableOfContents = tableOfContentsFlattener.flatten(source);
    List<PageContent> pages = pageCollector.collect(source);

    HeadingPatterns headingPatterns = headingPatternAnalyzer.analyze(pages);
    ChapterBoundaries boundaries =
        chapterBoundaryDetector.detect(pages, tableOfContents, headingPatterns);
    meterRegistry
        .counter("structure.boundaries", "source", boundaries.source().tagValue())
        .increment();

    List<Chapter> chapters = new ArrayList<>(boundaries.chapterCount());
    for (int i = 0; i < boundaries.chapterCount(); i++) {
      int start = boundaries.startOf(i);
      int end = boundaries.endOf(i, pages.size());
      chapters.add(
          chapterProcessor.process(pages.subList(start, end + 1), start + 1, "chapter-" + i));
    }

    DocumentStructure structure =
        structureAssembler.assemble(metadata, chapters, tableOfContents, pages.size());
    log.info(
        "Extracted structure of '{}': {} pages, {} chapters (boundaries from {}), {} bookmarks, ~{}"
            + " tokens",
        structure.title(),
        structure.totalPages(),
        structure.chapters().size(),
        boundaries.source().tagValue(),
        structure.tableOfContents().size(),
        structure.estimatedTokens());
    return structure;
  }
}
